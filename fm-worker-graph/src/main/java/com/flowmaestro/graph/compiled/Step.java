package com.flowmaestro.graph.compiled;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compiled step: definition data plus its position in the dependency order. Immutable.
 * Dependencies include sources of error edges.
 */
public final class Step {

    private final String id;
    private final String kind;
    private final String name;
    private final ObjectNode config;
    private final int depth;
    private final Set<String> dependencies;
    private final Set<String> dependents;
    private final List<String> incomingEdgeIds;
    private final List<String> outgoingEdgeIds;

    public Step(String id, String kind, String name, ObjectNode config, int depth,
                Set<String> dependencies, Set<String> dependents,
                List<String> incomingEdgeIds, List<String> outgoingEdgeIds) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = kind != null ? kind : "";
        this.name = name != null && !name.isBlank() ? name : id;
        this.config = Objects.requireNonNull(config, "config").deepCopy();
        this.depth = depth;
        this.dependencies = dependencies != null ? Collections.unmodifiableSet(new LinkedHashSet<>(dependencies)) : Set.of();
        this.dependents = dependents != null ? Collections.unmodifiableSet(new LinkedHashSet<>(dependents)) : Set.of();
        this.incomingEdgeIds = incomingEdgeIds != null ? List.copyOf(incomingEdgeIds) : List.of();
        this.outgoingEdgeIds = outgoingEdgeIds != null ? List.copyOf(outgoingEdgeIds) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /** Returns a copy of the opaque step configuration. */
    public ObjectNode getConfig() {
        return config.deepCopy();
    }

    /** Longest-path distance from the entry step. */
    public int getDepth() {
        return depth;
    }

    /** Predecessor step ids in edge order. */
    public Set<String> getDependencies() {
        return dependencies;
    }

    /** Successor step ids in edge order. */
    public Set<String> getDependents() {
        return dependents;
    }

    public List<String> getIncomingEdgeIds() {
        return incomingEdgeIds;
    }

    public List<String> getOutgoingEdgeIds() {
        return outgoingEdgeIds;
    }
}
