package com.flowmaestro.graph.definition;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workflow as authored: steps keyed by id, edges, optional entry step, optional explicit output
 * steps and optional concurrency cap. Input to {@link com.flowmaestro.graph.GraphCompiler}.
 * Step order is preserved (insertion order of the JSON object).
 */
public final class WorkflowDefinition {

    private final String name;
    private final Map<String, StepDefinition> steps;
    private final List<EdgeDefinition> edges;
    private final String entryStepId;
    private final List<String> outputStepIds;
    private final Integer maxConcurrent;

    @JsonCreator
    public WorkflowDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("steps") Map<String, StepDefinition> steps,
            @JsonProperty("edges") List<EdgeDefinition> edges,
            @JsonProperty("entryStepId") String entryStepId,
            @JsonProperty("outputStepIds") List<String> outputStepIds,
            @JsonProperty("maxConcurrent") Integer maxConcurrent) {
        this.name = name;
        this.steps = steps != null ? Collections.unmodifiableMap(new LinkedHashMap<>(steps)) : Map.of();
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.entryStepId = entryStepId;
        this.outputStepIds = outputStepIds != null ? List.copyOf(outputStepIds) : List.of();
        this.maxConcurrent = maxConcurrent;
    }

    public String getName() {
        return name;
    }

    public Map<String, StepDefinition> getSteps() {
        return steps;
    }

    public List<EdgeDefinition> getEdges() {
        return edges;
    }

    /** Designated entry step; null = detect (first input step, else first step without incoming edges). */
    public String getEntryStepId() {
        return entryStepId;
    }

    /** Explicit output steps; empty = steps of kind {@code output}, else steps without dependents. */
    public List<String> getOutputStepIds() {
        return outputStepIds;
    }

    /** Concurrency cap for this workflow; null or non-positive = configured default. */
    public Integer getMaxConcurrent() {
        return maxConcurrent;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Programmatic construction, mainly for tests and embedded callers. */
    public static final class Builder {
        private final String name;
        private final Map<String, StepDefinition> steps = new LinkedHashMap<>();
        private final List<EdgeDefinition> edges = new ArrayList<>();
        private String entryStepId;
        private List<String> outputStepIds = List.of();
        private Integer maxConcurrent;

        private Builder(String name) {
            this.name = name;
        }

        public Builder step(StepDefinition step) {
            steps.put(step.getId(), step);
            return this;
        }

        public Builder step(String id, String kind) {
            return step(new StepDefinition(id, kind));
        }

        public Builder edge(EdgeDefinition edge) {
            edges.add(edge);
            return this;
        }

        public Builder edge(String source, String target) {
            return edge(EdgeDefinition.of(source + "->" + target, source, target));
        }

        public Builder errorEdge(String source, String target) {
            return edge(EdgeDefinition.onError(source + "-error->" + target, source, target));
        }

        public Builder entryStepId(String entryStepId) {
            this.entryStepId = entryStepId;
            return this;
        }

        public Builder outputStepIds(List<String> outputStepIds) {
            this.outputStepIds = outputStepIds;
            return this;
        }

        public Builder maxConcurrent(Integer maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(name, steps, edges, entryStepId, outputStepIds, maxConcurrent);
        }
    }
}
