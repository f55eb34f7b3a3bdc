package com.flowmaestro.worker.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.compiled.Step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable scheduling state of a run: status per step, state per edge, unresolved dependency
 * count per step, and the error message of every step that failed. Replaced as a whole on every
 * transition via {@link #edit()}, so a host can checkpoint any value it has observed.
 * Step iteration order is the compiled graph's order.
 */
public final class QueueState {

    private final Map<String, StepStatus> steps;
    private final Map<String, EdgeState> edges;
    private final Map<String, Integer> unresolved;
    private final Map<String, String> errors;

    @JsonCreator
    public QueueState(
            @JsonProperty("steps") Map<String, StepStatus> steps,
            @JsonProperty("edges") Map<String, EdgeState> edges,
            @JsonProperty("unresolved") Map<String, Integer> unresolved,
            @JsonProperty("errors") Map<String, String> errors) {
        this.steps = freeze(steps);
        this.edges = freeze(edges);
        this.unresolved = freeze(unresolved);
        this.errors = freeze(errors);
    }

    /**
     * Every step PENDING with its dependency count, except steps with no dependencies which start READY.
     */
    public static QueueState initial(CompiledGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, StepStatus> steps = new LinkedHashMap<>();
        Map<String, Integer> unresolved = new LinkedHashMap<>();
        for (Step step : graph.getSteps().values()) {
            int deps = step.getDependencies().size();
            steps.put(step.getId(), deps == 0 ? StepStatus.READY : StepStatus.PENDING);
            unresolved.put(step.getId(), deps);
        }
        Map<String, EdgeState> edges = new LinkedHashMap<>();
        for (String edgeId : graph.getEdges().keySet()) {
            edges.put(edgeId, EdgeState.PENDING);
        }
        return new QueueState(steps, edges, unresolved, Map.of());
    }

    public Map<String, StepStatus> getSteps() {
        return steps;
    }

    public Map<String, EdgeState> getEdges() {
        return edges;
    }

    public Map<String, Integer> getUnresolved() {
        return unresolved;
    }

    /** Error message by step id, for failed and error-routed steps. */
    public Map<String, String> getErrors() {
        return errors;
    }

    public StepStatus statusOf(String stepId) {
        StepStatus s = steps.get(stepId);
        if (s == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return s;
    }

    public EdgeState edgeState(String edgeId) {
        EdgeState s = edges.get(edgeId);
        if (s == null) {
            throw new IllegalArgumentException("Unknown edge: " + edgeId);
        }
        return s;
    }

    public int unresolvedDependencyCount(String stepId) {
        return unresolved.getOrDefault(stepId, 0);
    }

    /** Step ids with the given status, in compile order. */
    public Set<String> withStatus(StepStatus status) {
        Set<String> ids = new LinkedHashSet<>();
        for (Map.Entry<String, StepStatus> e : steps.entrySet()) {
            if (e.getValue() == status) ids.add(e.getKey());
        }
        return ids;
    }

    public int count(StepStatus status) {
        int n = 0;
        for (StepStatus s : steps.values()) {
            if (s == status) n++;
        }
        return n;
    }

    public Set<String> pending() {
        return withStatus(StepStatus.PENDING);
    }

    public Set<String> ready() {
        return withStatus(StepStatus.READY);
    }

    public Set<String> executing() {
        return withStatus(StepStatus.EXECUTING);
    }

    public Set<String> settled() {
        return withStatus(StepStatus.SETTLED);
    }

    public Set<String> failed() {
        return withStatus(StepStatus.FAILED);
    }

    /** Starts a copy-on-write transition from this state. */
    public Transition edit() {
        return new Transition(this);
    }

    private static <K, V> Map<K, V> freeze(Map<K, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Mutable working copy; {@link #commit()} produces the next immutable state. */
    public static final class Transition {
        private final Map<String, StepStatus> steps;
        private final Map<String, EdgeState> edges;
        private final Map<String, Integer> unresolved;
        private final Map<String, String> errors;

        private Transition(QueueState from) {
            this.steps = new LinkedHashMap<>(from.steps);
            this.edges = new LinkedHashMap<>(from.edges);
            this.unresolved = new LinkedHashMap<>(from.unresolved);
            this.errors = new LinkedHashMap<>(from.errors);
        }

        public StepStatus status(String stepId) {
            return steps.get(stepId);
        }

        public EdgeState edge(String edgeId) {
            return edges.get(edgeId);
        }

        public Transition step(String stepId, StepStatus status) {
            steps.put(stepId, status);
            return this;
        }

        public Transition edge(String edgeId, EdgeState state) {
            edges.put(edgeId, state);
            return this;
        }

        public Transition unresolved(String stepId, int count) {
            unresolved.put(stepId, count);
            return this;
        }

        public Transition error(String stepId, String message) {
            errors.put(stepId, message);
            return this;
        }

        public QueueState commit() {
            return new QueueState(steps, edges, unresolved, errors);
        }
    }
}
