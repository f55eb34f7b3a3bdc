package com.flowmaestro.worker.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error codes reported in {@link RunResult#getError()}. {@code CollaboratorFailure} exists for
 * logging only and is never returned.
 */
public enum RunErrorCode {
    MALFORMED_GRAPH("MalformedGraph"),
    CYCLIC_GRAPH("CyclicGraph"),
    INSUFFICIENT_BUDGET("InsufficientBudget"),
    STEP_EXECUTION_FAILURE("StepExecutionFailure"),
    UNREACHABLE_TERMINAL("UnreachableTerminal"),
    COLLABORATOR_FAILURE("CollaboratorFailure"),
    CANCELLED("Cancelled");

    private final String code;

    RunErrorCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RunErrorCode fromCode(String code) {
        for (RunErrorCode c : values()) {
            if (c.code.equals(code)) return c;
        }
        throw new IllegalArgumentException("Unknown run error code: " + code);
    }
}
