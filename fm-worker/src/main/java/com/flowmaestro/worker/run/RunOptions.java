package com.flowmaestro.worker.run;

import com.flowmaestro.worker.dispatch.CancellationToken;

/**
 * Per-run overrides. Unset values fall back to the runner's defaults.
 */
public final class RunOptions {

    private static final RunOptions DEFAULTS = new RunOptions(null, null);

    private final String runId;
    private final CancellationToken cancellation;

    private RunOptions(String runId, CancellationToken cancellation) {
        this.runId = runId;
        this.cancellation = cancellation;
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public static RunOptions of(String runId, CancellationToken cancellation) {
        return new RunOptions(runId, cancellation);
    }

    public String getRunId() {
        return runId;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }
}
