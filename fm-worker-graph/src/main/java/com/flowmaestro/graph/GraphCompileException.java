package com.flowmaestro.graph;

/**
 * Thrown when a workflow definition cannot be compiled into an executable graph.
 * Compile errors abort a run before any admission check or step dispatch.
 */
public abstract class GraphCompileException extends RuntimeException {

    protected GraphCompileException(String message) {
        super(message);
    }

    /** Stable error code reported in run results (e.g. {@code MalformedGraph}). */
    public abstract String getErrorCode();
}
