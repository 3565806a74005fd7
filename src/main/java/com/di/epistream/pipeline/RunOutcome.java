package com.di.epistream.pipeline;

/**
 * Final state of a run and the process exit code it maps to.
 */
public enum RunOutcome {
    SUCCESS(0),
    PARTIAL_FAILURE(2),
    FAILED(1);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
