package com.flowmaestro.graph.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a workflow edge. JSON uses lower-case names; missing or unknown values deserialize as {@link #DEFAULT}.
 */
public enum EdgeKind {
    /** Followed when the source step succeeds (subject to branch selection). */
    DEFAULT,
    /** Followed only when the source step fails and routes through this edge. */
    ERROR;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static EdgeKind fromValue(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        return "error".equalsIgnoreCase(value.trim()) ? ERROR : DEFAULT;
    }
}
