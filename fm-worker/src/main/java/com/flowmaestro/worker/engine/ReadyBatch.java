package com.flowmaestro.worker.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Steps moved to EXECUTING together. Members are offered for concurrent execution; no
 * ordering among them is implied.
 */
public final class ReadyBatch {

    private static final ReadyBatch EMPTY = new ReadyBatch(List.of());

    private final List<ReadyStep> steps;

    ReadyBatch(List<ReadyStep> steps) {
        this.steps = List.copyOf(steps);
    }

    static ReadyBatch empty() {
        return EMPTY;
    }

    public List<ReadyStep> getSteps() {
        return steps;
    }

    public List<String> getStepIds() {
        List<String> ids = new ArrayList<>(steps.size());
        for (ReadyStep s : steps) ids.add(s.getStepId());
        return ids;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }
}
