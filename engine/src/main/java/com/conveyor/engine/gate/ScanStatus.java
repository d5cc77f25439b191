package com.conveyor.engine.gate;

/**
 * Outcome class of a vulnerability scan, derived from the scanner's exit code.
 *
 * CLEAN    (0)   nothing found at the requested severities
 * FINDINGS (1)   vulnerabilities found; tolerable under some severity filters
 * ERROR    (2+)  the scanner itself failed; never tolerable
 */
public enum ScanStatus {
    CLEAN(0),
    FINDINGS(1),
    ERROR(2);

    private final int code;

    ScanStatus(int code) {
        this.code = code;
    }

    /** Nominal exit code of this class; ERROR covers every code from 2 up. */
    public int code() {
        return code;
    }

    /** Negative codes (killed by a signal) are treated as ERROR. */
    public static ScanStatus fromExitCode(int exitCode) {
        return switch (exitCode) {
            case 0  -> CLEAN;
            case 1  -> FINDINGS;
            default -> ERROR;
        };
    }
}
