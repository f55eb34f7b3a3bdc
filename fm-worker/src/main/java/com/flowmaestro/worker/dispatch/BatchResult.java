package com.flowmaestro.worker.dispatch;

import java.util.List;

/**
 * Completions collected for a batch. When the run was cancelled mid-batch, only the steps that
 * finished before cancellation are present.
 */
public final class BatchResult {

    private final List<StepCompletion> completions;
    private final boolean cancelled;

    public BatchResult(List<StepCompletion> completions, boolean cancelled) {
        this.completions = List.copyOf(completions);
        this.cancelled = cancelled;
    }

    public List<StepCompletion> getCompletions() {
        return completions;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
