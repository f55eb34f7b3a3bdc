package com.flowmaestro.graph;

import java.util.List;

/**
 * Depth computation did not reach a fixed point: the definition contains a cycle.
 */
public final class CyclicGraphException extends GraphCompileException {

    public static final String ERROR_CODE = "CyclicGraph";

    private final List<String> stepsOnCycle;

    public CyclicGraphException(List<String> stepsOnCycle) {
        super("Workflow graph contains a cycle through steps " + stepsOnCycle);
        this.stepsOnCycle = stepsOnCycle != null ? List.copyOf(stepsOnCycle) : List.of();
    }

    /** Steps whose depth was still changing when relaxation gave up. */
    public List<String> getStepsOnCycle() {
        return stepsOnCycle;
    }

    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
