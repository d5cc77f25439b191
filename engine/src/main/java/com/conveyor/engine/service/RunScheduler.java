package com.conveyor.engine.service;

import com.conveyor.engine.model.PipelineRun;
import com.conveyor.engine.model.RunRecord;
import com.conveyor.engine.pipeline.PipelineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Polls for QUEUED runs and executes them on a fixed worker pool.
 *
 * The pool size caps how many pipelines run at once; each run still fans
 * out its own parallel groups.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "conveyor.cli", name = "enabled", havingValue = "false", matchIfMissing = true)
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final ExecutorService  workers;
    private final RunService       runService;
    private final PipelineExecutor executor;

    public RunScheduler(RunService runService,
                        PipelineExecutor executor,
                        @Value("${conveyor.scheduler.workers:2}") int workerCount) {
        this.runService = runService;
        this.executor   = executor;
        this.workers    = Executors.newFixedThreadPool(workerCount);
    }

    /** Claim one QUEUED run, if any, and hand it to a worker. */
    @Scheduled(fixedDelayString = "${conveyor.scheduler.poll-interval-ms:2000}")
    public void tick() {
        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

        Optional<RunRecord> claimed = runService.claimNextQueuedRun(workerId);
        claimed.ifPresent(run -> workers.submit(() -> execute(run)));
    }

    void execute(RunRecord run) {
        UUID runId = run.getId();
        try {
            PipelineRun result = executor.run(runService.definition(), runService.parametersOf(run), runId.toString());
            runService.complete(runId, result);
        } catch (Exception e) {
            log.error("Unhandled error executing run {}: {}", runId, e.getMessage(), e);
            runService.fail(runId, "Unhandled exception: " + e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
    }
}
