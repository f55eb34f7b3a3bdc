package com.flowmaestro.worker.engine;

import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.graph.compiled.Step;

import java.util.List;

/**
 * A dispatched step together with the context snapshot frozen at dispatch time.
 */
public final class ReadyStep {

    private final Step step;
    private final ContextSnapshot snapshot;
    private final List<String> sourceStepIds;

    ReadyStep(Step step, ContextSnapshot snapshot, List<String> sourceStepIds) {
        this.step = step;
        this.snapshot = snapshot;
        this.sourceStepIds = List.copyOf(sourceStepIds);
    }

    public Step getStep() {
        return step;
    }

    public String getStepId() {
        return step.getId();
    }

    public ContextSnapshot getSnapshot() {
        return snapshot;
    }

    /** Predecessors whose edge into this step was taken, in compile order. */
    public List<String> getSourceStepIds() {
        return sourceStepIds;
    }
}
