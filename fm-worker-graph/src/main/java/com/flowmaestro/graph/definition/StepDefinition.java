package com.flowmaestro.graph.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Declarative step as authored in a workflow definition. {@code config} is opaque to the core;
 * its shape is validated by the executor for the step's kind.
 */
public final class StepDefinition {

    private final String id;
    private final String kind;
    private final String name;
    private final ObjectNode config;

    @JsonCreator
    public StepDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("kind") String kind,
            @JsonProperty("name") String name,
            @JsonProperty("config") ObjectNode config) {
        this.id = id;
        this.kind = kind != null ? kind : "";
        this.name = name;
        this.config = config != null ? config.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public StepDefinition(String id, String kind) {
        this(id, kind, null, null);
    }

    public String getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    /** Display name; may be null (id is used instead). */
    public String getName() {
        return name;
    }

    /** Returns a copy of the step configuration. */
    public ObjectNode getConfig() {
        return config.deepCopy();
    }
}
