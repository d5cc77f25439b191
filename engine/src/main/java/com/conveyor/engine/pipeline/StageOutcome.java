package com.conveyor.engine.pipeline;

/**
 * What a stage body reports back to the executor.
 *
 * Bodies return an outcome rather than throwing to signal an expected
 * result; exceptions are reserved for things that went wrong, and the
 * executor converts any that escape into a FAILED outcome.
 *
 * @param exitCode exit code of the deciding tool call, if there was one
 */
public record StageOutcome(Kind kind, String message, Integer exitCode) {

    public enum Kind {
        SUCCEEDED,
        UNSTABLE,   // completed, but with tolerated problems (e.g. scan findings)
        FAILED
    }

    public static StageOutcome success() {
        return new StageOutcome(Kind.SUCCEEDED, null, null);
    }

    public static StageOutcome success(String message) {
        return new StageOutcome(Kind.SUCCEEDED, message, null);
    }

    public static StageOutcome unstable(String message) {
        return new StageOutcome(Kind.UNSTABLE, message, null);
    }

    public static StageOutcome unstable(String message, int exitCode) {
        return new StageOutcome(Kind.UNSTABLE, message, exitCode);
    }

    public static StageOutcome failed(String message) {
        return new StageOutcome(Kind.FAILED, message, null);
    }

    public static StageOutcome failed(String message, Integer exitCode) {
        return new StageOutcome(Kind.FAILED, message, exitCode);
    }

    public boolean failed() {
        return kind == Kind.FAILED;
    }
}
