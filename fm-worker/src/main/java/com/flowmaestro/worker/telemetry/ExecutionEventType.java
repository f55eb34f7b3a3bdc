package com.flowmaestro.worker.telemetry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Run and step lifecycle events. The value doubles as the channel suffix after the configured
 * prefix, e.g. {@code workflow:events} + {@code :node:started}.
 */
public enum ExecutionEventType {
    EXECUTION_STARTED("execution:started"),
    EXECUTION_PROGRESS("execution:progress"),
    EXECUTION_COMPLETED("execution:completed"),
    EXECUTION_FAILED("execution:failed"),
    NODE_STARTED("node:started"),
    NODE_COMPLETED("node:completed"),
    NODE_FAILED("node:failed");

    private final String value;

    ExecutionEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String channel(String prefix) {
        return prefix == null || prefix.isEmpty() ? value : prefix + ":" + value;
    }

    @JsonCreator
    public static ExecutionEventType fromValue(String value) {
        for (ExecutionEventType t : values()) {
            if (t.value.equals(value)) return t;
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
