package com.conveyor.engine.pipeline;

import com.conveyor.engine.collaborator.JobTrigger;
import com.conveyor.engine.exception.ConfigurationException;
import com.conveyor.engine.exception.ToolFailureException;
import com.conveyor.engine.model.FailurePolicy;
import com.conveyor.engine.model.PipelineRun;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.model.RunStatus;
import com.conveyor.engine.model.StageResult;
import com.conveyor.engine.model.StageStatus;
import com.conveyor.engine.notify.NotificationChannel;
import com.conveyor.engine.notify.Notifier;
import com.conveyor.engine.retry.AbortSignal;
import com.conveyor.engine.retry.Retrier;
import com.conveyor.engine.util.MdcPropagation;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a {@link PipelineDefinition} from parameter validation to finalization.
 *
 * Per run:
 * <ol>
 *   <li>Resolve parameters and the environment. Any error here rejects the run
 *       before a single stage executes.</li>
 *   <li>Walk the stage groups in order. A lone stage runs on the calling thread;
 *       a parallel group fans out on a pool sized to the group, and its outputs
 *       become visible only once every member has finished.</li>
 *   <li>A FATAL failure raises the run's {@link AbortSignal}: retry waits are
 *       cancelled and every later stage is SKIPPED unless it is {@code alwaysRun}.</li>
 *   <li>Finalize once: overall status, one notification, and the downstream
 *       trigger on SUCCESS only.</li>
 * </ol>
 *
 * One instance serves many runs; all per-run state lives on the stack.
 */
@Component
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final Notifier      notifier;
    private final JobTrigger    jobTrigger;
    private final MeterRegistry meterRegistry;
    private final boolean       failFast;

    public PipelineExecutor(Notifier notifier,
                            JobTrigger jobTrigger,
                            MeterRegistry meterRegistry,
                            @Value("${conveyor.engine.fail-fast:true}") boolean failFast) {
        this.notifier      = notifier;
        this.jobTrigger    = jobTrigger;
        this.meterRegistry = meterRegistry;
        this.failFast      = failFast;
    }

    public PipelineRun run(PipelineDefinition definition, Map<String, String> rawParameters) {
        return run(definition, rawParameters, UUID.randomUUID().toString());
    }

    public PipelineRun run(PipelineDefinition definition, Map<String, String> rawParameters, String runId) {
        MDC.put("runId", runId);
        try {
            return execute(definition, rawParameters, runId);
        } finally {
            MDC.remove("runId");
        }
    }

    private PipelineRun execute(PipelineDefinition definition, Map<String, String> rawParameters, String runId) {
        Instant start = Instant.now();
        log.info("Run {} of pipeline '{}' starting", runId, definition.name());

        PipelineState state;
        try {
            Map<String, Object> parameters = definition.resolveParameters(rawParameters);
            state = new PipelineState(parameters, definition.resolveEnvironment(parameters),
                    definition.outputOwners());
        } catch (ConfigurationException e) {
            log.error("Run {} rejected before any stage ran: {}", runId, e.getMessage());
            meterRegistry.counter("conveyor.run.completed", "status", "configuration_error").increment();
            return PipelineRun.rejected(runId, definition.name(), e.getMessage(), start, Instant.now());
        }

        AbortSignal abort = new AbortSignal();
        List<StageResult> results = new ArrayList<>();

        for (StageGroup group : definition.groups()) {
            if (group.parallel()) {
                results.addAll(runGroup(runId, group, state, abort));
            } else {
                Stage stage = group.stages().get(0);
                StageExecution execution = skippedByAbort(stage, abort)
                        ? skip(stage, "run aborted: " + abort.reason())
                        : acceptOutputs(stage, runStage(runId, stage, state, abort), state, abort);
                state.apply(stage.id(), execution.outputs());
                results.add(execution.result());
            }
        }

        RunStatus status = PipelineRun.deriveStatus(results);
        PipelineRun run = new PipelineRun(runId, definition.name(), results, status,
                start, Instant.now(), null, state.snapshot());
        log.info("Run {} finished {} in {} ms", runId, status, run.durationMs());
        meterRegistry.counter("conveyor.run.completed", "status", status.name().toLowerCase()).increment();

        sendNotification(definition, run, state);
        triggerDownstream(definition, run, state);
        return run;
    }

    // ------------------------------------------------------------------
    // Parallel groups
    // ------------------------------------------------------------------

    private List<StageResult> runGroup(String runId, StageGroup group, PipelineState state, AbortSignal abort) {
        List<Stage> members = group.stages();
        log.info("Parallel group '{}' starting {} stages", group.id(), members.size());

        // which members start is decided here, once, for the whole group
        Map<String, StageExecution> finished = new HashMap<>();
        List<Stage> starting = new ArrayList<>();
        for (Stage stage : members) {
            if (skippedByAbort(stage, abort)) {
                finished.put(stage.id(), skip(stage, "run aborted: " + abort.reason()));
            } else {
                starting.add(stage);
            }
        }

        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(Math.max(1, starting.size())));
        CompletionService<StageExecution> completion = new ExecutorCompletionService<>(pool);
        for (Stage stage : starting) {
            completion.submit(() -> runStage(runId, stage, state, abort));
        }

        try {
            for (int i = 0; i < starting.size(); i++) {
                StageExecution execution = completion.take().get();
                finished.put(execution.result().stageId(), execution);
                if (failFast && execution.result().status() == StageStatus.FAILURE
                        && execution.result().failurePolicy() == FailurePolicy.FATAL) {
                    log.warn("Parallel group '{}' failed fast on stage '{}'",
                            group.id(), execution.result().stageId());
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort.abort("interrupted while waiting for parallel group '" + group.id() + "'");
        } catch (ExecutionException e) {
            throw new IllegalStateException("Stage in parallel group '" + group.id() + "' crashed the engine",
                    e.getCause());
        } finally {
            // stragglers are left to finish; their results are not collected
            pool.shutdown();
        }

        List<StageResult> results = new ArrayList<>();
        Map<String, Map<String, Object>> writes = new LinkedHashMap<>();
        for (Stage stage : members) {
            StageExecution execution = finished.get(stage.id());
            if (execution == null) {
                String reason = "result discarded: parallel group '" + group.id() + "' failed fast";
                log.info("Stage '{}' SKIPPED: {}", stage.id(), reason);
                results.add(StageResult.skipped(stage.id(), stage.failurePolicy(), reason));
            } else {
                execution = acceptOutputs(stage, execution, state, abort);
                results.add(execution.result());
                writes.put(stage.id(), execution.outputs());
            }
        }
        state.applyAll(writes);
        log.info("Parallel group '{}' finished {}", group.id(), PipelineRun.deriveStatus(results));
        return results;
    }

    // ------------------------------------------------------------------
    // One stage
    // ------------------------------------------------------------------

    private static boolean skippedByAbort(Stage stage, AbortSignal abort) {
        return abort.isAborted() && !stage.alwaysRun();
    }

    /**
     * Runs a stage that has already been cleared to start. The run's abort
     * signal is only consulted between retry attempts.
     */
    private StageExecution runStage(String runId, Stage stage, PipelineState state, AbortSignal abort) {
        boolean shouldRun;
        try {
            shouldRun = stage.predicate().test(state);
        } catch (RuntimeException e) {
            return finish(stage, StageOutcome.failed("condition could not be evaluated: " + rootMessage(e)),
                    Map.of(), 0, 0, abort);
        }
        if (!shouldRun) {
            return skip(stage, "condition not met");
        }

        MDC.put("stageId", stage.id());
        long startNanos = System.nanoTime();
        try {
            log.info("Stage '{}' RUNNING", stage.id());
            AtomicInteger attempts = new AtomicInteger();
            AtomicReference<StageContext> lastContext = new AtomicReference<>();
            // cleanup keeps its own retries even while the run is aborting
            AbortSignal retrySignal = stage.alwaysRun() ? new AbortSignal() : abort;

            StageOutcome outcome = Retrier.withRetry("Stage '" + stage.id() + "'", () -> {
                int attempt = attempts.incrementAndGet();
                MDC.put("attempt", String.valueOf(attempt));
                StageContext context = new StageContext(runId, stage, state, abort, attempt);
                lastContext.set(context);
                return invokeBody(stage, context);
            }, o -> !o.failed(), stage.retryPolicy(), retrySignal);

            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            return finish(stage, outcome, lastContext.get().outputs(), durationMs, attempts.get(), abort);
        } finally {
            MDC.remove("attempt");
            MDC.remove("stageId");
        }
    }

    private static StageOutcome invokeBody(Stage stage, StageContext context) {
        try {
            StageOutcome outcome = stage.body().execute(context);
            return outcome != null ? outcome : StageOutcome.success();
        } catch (RuntimeException e) {
            log.warn("Stage '{}' threw {}", stage.id(), e.toString());
            return StageOutcome.failed(rootMessage(e), exitCodeOf(e));
        }
    }

    private StageExecution finish(Stage stage, StageOutcome outcome, Map<String, Object> outputs,
                                  long durationMs, int attempts, AbortSignal abort) {
        StageStatus status = statusOf(outcome, stage.failurePolicy());
        StageResult result = new StageResult(stage.id(), status, outcome.exitCode(), durationMs,
                outputs, outcome.message(), stage.failurePolicy(), attempts);

        if (outcome.failed()) {
            switch (stage.failurePolicy()) {
                case FATAL -> {
                    log.error("Stage '{}' FAILED after {} attempt(s): {}", stage.id(), attempts, outcome.message());
                    abort.abort("stage '" + stage.id() + "' failed");
                }
                case UNSTABLE -> log.warn("Stage '{}' failed, run marked UNSTABLE: {}", stage.id(), outcome.message());
                case IGNORED  -> log.warn("Stage '{}' failed, failure ignored: {}", stage.id(), outcome.message());
            }
        } else {
            log.info("Stage '{}' {} in {} ms", stage.id(), status, durationMs);
        }
        record(stage, status, durationMs);
        return new StageExecution(result, outputs);
    }

    /** A write the state would refuse fails the stage that made it, not the run. */
    private StageExecution acceptOutputs(Stage stage, StageExecution execution, PipelineState state,
                                         AbortSignal abort) {
        try {
            state.checkWrites(stage.id(), execution.outputs());
            return execution;
        } catch (ConfigurationException e) {
            StageResult result = execution.result();
            StageStatus status = stage.failurePolicy() == FailurePolicy.UNSTABLE
                    ? StageStatus.UNSTABLE : StageStatus.FAILURE;
            log.error("Stage '{}' outputs rejected: {}", stage.id(), e.getMessage());
            if (stage.failurePolicy() == FailurePolicy.FATAL) {
                abort.abort("stage '" + stage.id() + "' failed");
            }
            return new StageExecution(new StageResult(stage.id(), status, result.exitCode(), result.durationMs(),
                    Map.of(), e.getMessage(), stage.failurePolicy(), result.attempts()), Map.of());
        }
    }

    private StageExecution skip(Stage stage, String reason) {
        log.info("Stage '{}' SKIPPED: {}", stage.id(), reason);
        record(stage, StageStatus.SKIPPED, 0);
        return new StageExecution(StageResult.skipped(stage.id(), stage.failurePolicy(), reason), Map.of());
    }

    private static StageStatus statusOf(StageOutcome outcome, FailurePolicy policy) {
        return switch (outcome.kind()) {
            case SUCCEEDED -> StageStatus.SUCCESS;
            case UNSTABLE  -> StageStatus.UNSTABLE;
            case FAILED    -> policy == FailurePolicy.UNSTABLE ? StageStatus.UNSTABLE : StageStatus.FAILURE;
        };
    }

    private void record(Stage stage, StageStatus status, long durationMs) {
        String statusTag = status.name().toLowerCase();
        meterRegistry.counter("conveyor.stage.runs", "stage", stage.id(), "status", statusTag).increment();
        Timer.builder("conveyor.stage.duration")
                .tag("stage", stage.id())
                .tag("status", statusTag)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    // ------------------------------------------------------------------
    // Finalization
    // ------------------------------------------------------------------

    private void sendNotification(PipelineDefinition definition, PipelineRun run, PipelineState state) {
        PipelineDefinition.Notification notification = definition.notification();
        if (notification == null) {
            return;
        }
        try {
            NotificationChannel channel = notification.channel().apply(state);
            notifier.notify(run, channel, notification.template());
        } catch (RuntimeException e) {
            log.error("Notification for run {} failed: {}", run.runId(), e.getMessage(), e);
        }
    }

    private void triggerDownstream(PipelineDefinition definition, PipelineRun run, PipelineState state) {
        PipelineDefinition.Downstream downstream = definition.downstream();
        if (downstream == null) {
            return;
        }
        if (run.status() != RunStatus.SUCCESS) {
            log.info("Downstream job '{}' not triggered: run is {}", downstream.jobName(), run.status());
            return;
        }
        try {
            boolean accepted = jobTrigger.triggerJob(downstream.jobName(), downstream.parameters().apply(state));
            log.info("Downstream job '{}' {}", downstream.jobName(), accepted ? "accepted" : "was not accepted");
        } catch (RuntimeException e) {
            log.error("Triggering downstream job '{}' failed: {}", downstream.jobName(), e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Error helpers
    // ------------------------------------------------------------------

    /** Message of the deepest cause, falling back to its class name. */
    static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private static Integer exitCodeOf(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ToolFailureException tf && tf.getExitCode() != null) {
                return tf.getExitCode();
            }
        }
        return null;
    }

    private record StageExecution(StageResult result, Map<String, Object> outputs) {}
}
