package com.flowmaestro.graph.compiled;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Executable, leveled workflow graph produced once per run by
 * {@link com.flowmaestro.graph.GraphCompiler}. Acyclic, every step reachable from the entry step,
 * every edge's endpoints present, and {@code depth(target) > depth(source)} for every edge.
 * Those invariants are established at compile time and not re-checked here.
 */
public final class CompiledGraph {

    private final String name;
    private final Map<String, Step> steps;
    private final Map<String, Edge> edges;
    private final List<Set<String>> levels;
    private final String entryStepId;
    private final Set<String> terminalStepIds;
    private final int maxConcurrent;

    public CompiledGraph(String name, Map<String, Step> steps, Map<String, Edge> edges, List<Set<String>> levels,
                         String entryStepId, Set<String> terminalStepIds, int maxConcurrent) {
        this.name = name != null ? name : "workflow";
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(steps, "steps")));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(edges, "edges")));
        List<Set<String>> levelCopy = new ArrayList<>();
        for (Set<String> level : levels) {
            levelCopy.add(Collections.unmodifiableSet(new LinkedHashSet<>(level)));
        }
        this.levels = Collections.unmodifiableList(levelCopy);
        this.entryStepId = Objects.requireNonNull(entryStepId, "entryStepId");
        this.terminalStepIds = Collections.unmodifiableSet(new LinkedHashSet<>(terminalStepIds));
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
    }

    public String getName() {
        return name;
    }

    /** Steps by id in compile order (level order, then definition order). */
    public Map<String, Step> getSteps() {
        return steps;
    }

    public Step getStep(String stepId) {
        Step step = steps.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step: " + stepId);
        }
        return step;
    }

    public Map<String, Edge> getEdges() {
        return edges;
    }

    public Edge getEdge(String edgeId) {
        return edges.get(edgeId);
    }

    /** Step ids grouped by depth, ascending. A scheduling hint only. */
    public List<Set<String>> getLevels() {
        return levels;
    }

    public String getEntryStepId() {
        return entryStepId;
    }

    public Set<String> getTerminalStepIds() {
        return terminalStepIds;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public List<Edge> getOutgoingEdges(String stepId) {
        return resolveEdges(getStep(stepId).getOutgoingEdgeIds());
    }

    public List<Edge> getIncomingEdges(String stepId) {
        return resolveEdges(getStep(stepId).getIncomingEdgeIds());
    }

    public boolean isTerminal(String stepId) {
        return terminalStepIds.contains(stepId);
    }

    public GraphSummary summary() {
        int widest = 0;
        for (Set<String> level : levels) {
            widest = Math.max(widest, level.size());
        }
        return new GraphSummary(name, steps.size(), edges.size(), levels.size(), widest,
                entryStepId, List.copyOf(terminalStepIds), maxConcurrent);
    }

    private List<Edge> resolveEdges(List<String> edgeIds) {
        List<Edge> out = new ArrayList<>(edgeIds.size());
        for (String id : edgeIds) {
            out.add(edges.get(id));
        }
        return out;
    }
}
