package com.conveyor.engine.pipeline;

import com.conveyor.engine.model.FailurePolicy;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.retry.RetryPolicy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A named, independently gated unit of pipeline work. Defined statically,
 * as part of a {@link PipelineDefinition}; never created at run time.
 *
 * @param predicate       decides, against the state at that point, whether the stage runs
 * @param retryPolicy     applied to the whole body; a FAILED outcome triggers another attempt
 * @param declaredOutputs state keys this stage may write
 * @param reads           state keys this stage (body or predicate) consumes; checked at
 *                        definition time so producers always come before consumers
 * @param parallelGroup   stages sharing a group id run concurrently; null for sequential
 * @param alwaysRun       still runs after a fatal failure aborted the run (cleanup)
 */
public record Stage(
        String                   id,
        Predicate<PipelineState> predicate,
        StageBody                body,
        FailurePolicy            failurePolicy,
        RetryPolicy              retryPolicy,
        Set<String>              declaredOutputs,
        Set<String>              reads,
        String                   parallelGroup,
        boolean                  alwaysRun
) {
    public Stage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(body, "body of stage " + id);
        predicate       = predicate == null ? state -> true : predicate;
        failurePolicy   = failurePolicy == null ? FailurePolicy.FATAL : failurePolicy;
        retryPolicy     = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
        declaredOutputs = Set.copyOf(declaredOutputs);
        reads           = Set.copyOf(reads);
    }

    public static Builder named(String id) {
        return new Builder(id);
    }

    public boolean parallel() {
        return parallelGroup != null;
    }

    public static final class Builder {

        private final String id;
        private Predicate<PipelineState> predicate;
        private StageBody body;
        private FailurePolicy failurePolicy = FailurePolicy.FATAL;
        private RetryPolicy retryPolicy = RetryPolicy.none();
        private final Set<String> outputs = new LinkedHashSet<>();
        private final Set<String> reads = new LinkedHashSet<>();
        private String parallelGroup;
        private boolean alwaysRun;

        private Builder(String id) {
            this.id = id;
        }

        public Builder when(Predicate<PipelineState> predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder reads(String... keys) {
            this.reads.addAll(List.of(keys));
            return this;
        }

        public Builder outputs(String... keys) {
            this.outputs.addAll(List.of(keys));
            return this;
        }

        public Builder policy(FailurePolicy policy) {
            this.failurePolicy = policy;
            return this;
        }

        public Builder retry(RetryPolicy policy) {
            this.retryPolicy = policy;
            return this;
        }

        public Builder inParallelGroup(String groupId) {
            this.parallelGroup = groupId;
            return this;
        }

        public Builder alwaysRun() {
            this.alwaysRun = true;
            return this;
        }

        public Builder body(StageBody body) {
            this.body = body;
            return this;
        }

        public Stage build() {
            return new Stage(id, predicate, body, failurePolicy, retryPolicy,
                    outputs, reads, parallelGroup, alwaysRun);
        }
    }
}
