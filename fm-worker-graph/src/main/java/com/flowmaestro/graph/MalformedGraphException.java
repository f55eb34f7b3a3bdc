package com.flowmaestro.graph;

/**
 * Definition is structurally invalid: an edge references a missing step, there are no steps,
 * ids collide, or a step is not reachable from the entry step.
 */
public final class MalformedGraphException extends GraphCompileException {

    public static final String ERROR_CODE = "MalformedGraph";

    public MalformedGraphException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return ERROR_CODE;
    }
}
