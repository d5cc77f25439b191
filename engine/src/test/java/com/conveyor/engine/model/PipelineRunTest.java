package com.conveyor.engine.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineRunTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void deriveStatus_worstContributionWins() {
        assertThat(PipelineRun.deriveStatus(List.of())).isEqualTo(RunStatus.SUCCESS);
        assertThat(PipelineRun.deriveStatus(List.of(ok("a"), unstable("b"))))
                .isEqualTo(RunStatus.UNSTABLE);
        assertThat(PipelineRun.deriveStatus(List.of(failed("a", FailurePolicy.FATAL), unstable("b"), ok("c"))))
                .isEqualTo(RunStatus.FAILURE);
    }

    @Test
    void deriveStatus_ignoredFailureDoesNotCount() {
        assertThat(PipelineRun.deriveStatus(List.of(ok("a"), failed("cleanup", FailurePolicy.IGNORED))))
                .isEqualTo(RunStatus.SUCCESS);
    }

    @Test
    void exitCode_mapsStatusAndConfigurationErrors() {
        assertThat(run(RunStatus.SUCCESS).exitCode(false)).isEqualTo(0);
        assertThat(run(RunStatus.UNSTABLE).exitCode(false)).isEqualTo(1);
        assertThat(run(RunStatus.UNSTABLE).exitCode(true)).isEqualTo(0);
        assertThat(run(RunStatus.FAILURE).exitCode(true)).isEqualTo(1);
        assertThat(PipelineRun.rejected("r", "ci", "Missing required parameter 'X'", T0, T0).exitCode(true))
                .isEqualTo(2);
    }

    @Test
    void firstFailureMessage_skipsIgnoredFailures() {
        PipelineRun run = new PipelineRun("r", "ci",
                List.of(failed("cleanup", FailurePolicy.IGNORED), failed("build", FailurePolicy.FATAL)),
                RunStatus.FAILURE, T0, T0.plusSeconds(3), null, Map.of());

        assertThat(run.firstFailureMessage()).contains("build broke");
        assertThat(run.durationMs()).isEqualTo(3000);
    }

    @Test
    void allSkipped_trueOnlyWhenNoStageExecuted() {
        PipelineRun skipped = new PipelineRun("r", "ci",
                List.of(StageResult.skipped("a", FailurePolicy.FATAL, "condition not met")),
                RunStatus.SUCCESS, T0, T0, null, Map.of());

        assertThat(skipped.allSkipped()).isTrue();
        assertThat(run(RunStatus.SUCCESS).allSkipped()).isFalse();
    }

    private static PipelineRun run(RunStatus status) {
        return new PipelineRun("r", "ci", List.of(ok("a")), status, T0, T0, null, Map.of());
    }

    private static StageResult ok(String id) {
        return new StageResult(id, StageStatus.SUCCESS, null, 1, Map.of(), null, FailurePolicy.FATAL, 1);
    }

    private static StageResult unstable(String id) {
        return new StageResult(id, StageStatus.UNSTABLE, 1, 1, Map.of(), "findings", FailurePolicy.FATAL, 1);
    }

    private static StageResult failed(String id, FailurePolicy policy) {
        return new StageResult(id, StageStatus.FAILURE, 1, 1, Map.of(), id + " broke", policy, 1);
    }
}
