package com.flowmaestro.worker.dispatch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.graph.compiled.Step;
import com.flowmaestro.worker.engine.ReadyStep;

import java.util.Objects;

/**
 * Everything needed to execute one step, in a form that crosses an activity boundary.
 */
public final class StepInvocation {

    private final String kind;
    private final ObjectNode config;
    private final ContextSnapshot snapshot;
    private final StepMeta meta;

    @JsonCreator
    public StepInvocation(
            @JsonProperty("kind") String kind,
            @JsonProperty("config") ObjectNode config,
            @JsonProperty("snapshot") ContextSnapshot snapshot,
            @JsonProperty("meta") StepMeta meta) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.config = config != null ? config : JsonNodeFactory.instance.objectNode();
        this.snapshot = snapshot != null ? snapshot : ContextSnapshot.empty();
        this.meta = Objects.requireNonNull(meta, "meta");
    }

    public static StepInvocation of(String runId, ReadyStep ready) {
        Step step = ready.getStep();
        StepMeta meta = new StepMeta(runId, step.getId(), step.getName(), step.getDepth(), ready.getSourceStepIds());
        return new StepInvocation(step.getKind(), step.getConfig(), ready.getSnapshot(), meta);
    }

    public String getKind() {
        return kind;
    }

    public ObjectNode getConfig() {
        return config;
    }

    public ContextSnapshot getSnapshot() {
        return snapshot;
    }

    public StepMeta getMeta() {
        return meta;
    }

    public String stepId() {
        return meta.getStepId();
    }
}
