package com.conveyor.engine.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcPropagationTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    void wrapExecutor_copiesSubmitterContextIntoWorker() throws Exception {
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newSingleThreadExecutor());
        try {
            MDC.put("runId", "run-7");
            String seen = pool.submit(() -> MDC.get("runId")).get(5, TimeUnit.SECONDS);
            MDC.put("runId", "run-8");
            String seenLater = pool.submit(() -> MDC.get("runId")).get(5, TimeUnit.SECONDS);

            assertThat(seen).isEqualTo("run-7");
            assertThat(seenLater).isEqualTo("run-8");
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void wrapRunnable_leavesWorkerContextClean() throws Exception {
        ExecutorService raw = Executors.newSingleThreadExecutor();
        try {
            MDC.put("stageId", "build");
            raw.submit(MdcPropagation.wrapRunnable(() -> assertThat(MDC.get("stageId")).isEqualTo("build")))
                    .get(5, TimeUnit.SECONDS);

            String leftover = raw.submit(() -> MDC.get("stageId")).get(5, TimeUnit.SECONDS);

            assertThat(leftover).isNull();
        } finally {
            raw.shutdown();
        }
    }

    @Test
    void copyMdc_isEmptyWhenNothingSet() {
        assertThat(MdcPropagation.copyMdc()).isEmpty();
    }
}
