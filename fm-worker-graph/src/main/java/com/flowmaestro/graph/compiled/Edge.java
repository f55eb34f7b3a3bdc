package com.flowmaestro.graph.compiled;

import com.flowmaestro.graph.definition.EdgeKind;

import java.util.Objects;

/**
 * Compiled edge. Endpoints are guaranteed to exist in the owning {@link CompiledGraph}.
 */
public final class Edge {

    private final String id;
    private final String sourceStepId;
    private final String targetStepId;
    private final String sourceHandle;
    private final String targetHandle;
    private final EdgeKind kind;

    public Edge(String id, String sourceStepId, String targetStepId, String sourceHandle, String targetHandle, EdgeKind kind) {
        this.id = Objects.requireNonNull(id, "id");
        this.sourceStepId = Objects.requireNonNull(sourceStepId, "sourceStepId");
        this.targetStepId = Objects.requireNonNull(targetStepId, "targetStepId");
        this.sourceHandle = sourceHandle;
        this.targetHandle = targetHandle;
        this.kind = kind != null ? kind : EdgeKind.DEFAULT;
    }

    public String getId() {
        return id;
    }

    public String getSourceStepId() {
        return sourceStepId;
    }

    public String getTargetStepId() {
        return targetStepId;
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

    public boolean isError() {
        return kind == EdgeKind.ERROR;
    }

    @Override
    public String toString() {
        return id + "(" + sourceStepId + ":" + sourceHandle + " -" + kind.toValue() + "-> " + targetStepId + ")";
    }
}
