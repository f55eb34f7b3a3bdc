package com.flowmaestro.graph.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed link between two steps. A step may have several outgoing edges on different
 * {@code sourceHandle}s (branch selection) plus any number of {@link EdgeKind#ERROR} edges.
 */
public final class EdgeDefinition {

    public static final String DEFAULT_SOURCE_HANDLE = "output";
    public static final String DEFAULT_TARGET_HANDLE = "input";

    private final String id;
    private final String source;
    private final String target;
    private final String sourceHandle;
    private final String targetHandle;
    private final EdgeKind kind;

    @JsonCreator
    public EdgeDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("source") String source,
            @JsonProperty("target") String target,
            @JsonProperty("sourceHandle") String sourceHandle,
            @JsonProperty("targetHandle") String targetHandle,
            @JsonProperty("kind") EdgeKind kind) {
        this.id = id;
        this.source = source;
        this.target = target;
        this.sourceHandle = sourceHandle != null && !sourceHandle.isBlank() ? sourceHandle : DEFAULT_SOURCE_HANDLE;
        this.targetHandle = targetHandle != null && !targetHandle.isBlank() ? targetHandle : DEFAULT_TARGET_HANDLE;
        this.kind = kind != null ? kind : EdgeKind.DEFAULT;
    }

    /** Default-kind edge on the default handles. */
    public static EdgeDefinition of(String id, String source, String target) {
        return new EdgeDefinition(id, source, target, null, null, EdgeKind.DEFAULT);
    }

    /** Default-kind edge leaving the given source handle (branch output). */
    public static EdgeDefinition onHandle(String id, String source, String sourceHandle, String target) {
        return new EdgeDefinition(id, source, target, sourceHandle, null, EdgeKind.DEFAULT);
    }

    /** Error-kind edge. */
    public static EdgeDefinition onError(String id, String source, String target) {
        return new EdgeDefinition(id, source, target, "error", null, EdgeKind.ERROR);
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    public String getTargetHandle() {
        return targetHandle;
    }

    public EdgeKind getKind() {
        return kind;
    }
}
