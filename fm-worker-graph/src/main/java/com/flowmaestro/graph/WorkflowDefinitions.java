package com.flowmaestro.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowmaestro.graph.definition.WorkflowDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of workflow definitions.
 * JSON excludes null values when serializing; unknown properties are ignored when reading.
 */
public final class WorkflowDefinitions {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private WorkflowDefinitions() {
    }

    /**
     * Deserializes a workflow definition from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static WorkflowDefinition fromJson(String json) {
        try {
            return MAPPER.readValue(json, WorkflowDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(WorkflowDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
