package com.flowmaestro.graph;

import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.compiled.Edge;
import com.flowmaestro.graph.compiled.Step;
import com.flowmaestro.graph.definition.EdgeDefinition;
import com.flowmaestro.graph.definition.StepDefinition;
import com.flowmaestro.graph.definition.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Validates a {@link WorkflowDefinition} and compiles it into a {@link CompiledGraph}.
 * <p>
 * Order of checks: steps present and well-formed, edges reference existing steps, entry step
 * resolved, depth relaxation reaches a fixed point (else {@link CyclicGraphException}), every step
 * reachable from the entry step. Error edges count as dependency edges.
 * <p>
 * Depth is the longest path from the entry step, computed by bounded relaxation over the edge list
 * (at most one round per step) rather than recursion, so deep graphs do not exhaust the stack.
 */
public final class GraphCompiler {

    private static final Logger log = LoggerFactory.getLogger(GraphCompiler.class);

    static final String INPUT_KIND = "input";
    static final String OUTPUT_KIND = "output";

    private final int defaultMaxConcurrent;

    public GraphCompiler(int defaultMaxConcurrent) {
        if (defaultMaxConcurrent < 1) {
            throw new IllegalArgumentException("defaultMaxConcurrent must be >= 1");
        }
        this.defaultMaxConcurrent = defaultMaxConcurrent;
    }

    /**
     * Compiles the definition.
     *
     * @throws MalformedGraphException on bad references, empty or unreachable steps
     * @throws CyclicGraphException    when no valid depth ordering exists
     */
    public CompiledGraph compile(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        Map<String, StepDefinition> stepDefs = validateSteps(definition);
        List<Edge> edges = validateEdges(definition, stepDefs);
        String entryStepId = resolveEntry(definition, stepDefs, edges);

        Map<String, Set<String>> dependencies = new HashMap<>();
        Map<String, Set<String>> dependents = new HashMap<>();
        Map<String, List<String>> incoming = new HashMap<>();
        Map<String, List<String>> outgoing = new HashMap<>();
        for (String id : stepDefs.keySet()) {
            dependencies.put(id, new LinkedHashSet<>());
            dependents.put(id, new LinkedHashSet<>());
            incoming.put(id, new ArrayList<>());
            outgoing.put(id, new ArrayList<>());
        }
        for (Edge edge : edges) {
            dependencies.get(edge.getTargetStepId()).add(edge.getSourceStepId());
            dependents.get(edge.getSourceStepId()).add(edge.getTargetStepId());
            incoming.get(edge.getTargetStepId()).add(edge.getId());
            outgoing.get(edge.getSourceStepId()).add(edge.getId());
        }

        Map<String, Integer> depths = computeDepths(stepDefs.keySet(), edges);
        checkReachable(entryStepId, stepDefs.keySet(), dependents);

        TreeMap<Integer, Set<String>> byDepth = new TreeMap<>();
        for (String id : stepDefs.keySet()) {
            byDepth.computeIfAbsent(depths.get(id), d -> new LinkedHashSet<>()).add(id);
        }
        List<Set<String>> levels = new ArrayList<>(byDepth.values());

        Map<String, Step> steps = new LinkedHashMap<>();
        for (Set<String> level : levels) {
            for (String id : level) {
                StepDefinition def = stepDefs.get(id);
                steps.put(id, new Step(id, def.getKind(), def.getName(), def.getConfig(), depths.get(id),
                        dependencies.get(id), dependents.get(id), incoming.get(id), outgoing.get(id)));
            }
        }
        Map<String, Edge> edgeMap = new LinkedHashMap<>();
        for (Edge edge : edges) {
            edgeMap.put(edge.getId(), edge);
        }

        Set<String> terminals = resolveTerminals(definition, stepDefs, dependents);
        int maxConcurrent = definition.getMaxConcurrent() != null && definition.getMaxConcurrent() > 0
                ? definition.getMaxConcurrent() : defaultMaxConcurrent;

        CompiledGraph graph = new CompiledGraph(definition.getName(), steps, edgeMap, levels,
                entryStepId, terminals, maxConcurrent);
        if (log.isInfoEnabled()) {
            log.info("Graph compiled | name={} | steps={} | edges={} | levels={} | entry={} | terminals={}",
                    graph.getName(), steps.size(), edgeMap.size(), levels.size(), entryStepId, terminals);
        }
        return graph;
    }

    private static Map<String, StepDefinition> validateSteps(WorkflowDefinition definition) {
        Map<String, StepDefinition> defs = definition.getSteps();
        if (defs.isEmpty()) {
            throw new MalformedGraphException("Workflow has no steps");
        }
        Map<String, StepDefinition> out = new LinkedHashMap<>();
        for (Map.Entry<String, StepDefinition> e : defs.entrySet()) {
            String key = e.getKey();
            StepDefinition def = e.getValue();
            if (key == null || key.isBlank() || def == null) {
                throw new MalformedGraphException("Step entry with blank id or missing definition: " + key);
            }
            if (def.getId() != null && !def.getId().equals(key)) {
                throw new MalformedGraphException("Step key " + key + " does not match step id " + def.getId());
            }
            if (def.getId() == null) {
                def = new StepDefinition(key, def.getKind(), def.getName(), def.getConfig());
            }
            out.put(key, def);
        }
        return out;
    }

    private static List<Edge> validateEdges(WorkflowDefinition definition, Map<String, StepDefinition> steps) {
        List<Edge> edges = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int index = 0;
        for (EdgeDefinition def : definition.getEdges()) {
            if (def == null) {
                throw new MalformedGraphException("Null edge at index " + index);
            }
            String id = def.getId() != null && !def.getId().isBlank() ? def.getId() : "edge-" + index;
            if (!seenIds.add(id)) {
                throw new MalformedGraphException("Duplicate edge id: " + id);
            }
            if (def.getSource() == null || !steps.containsKey(def.getSource())) {
                throw new MalformedGraphException("Edge " + id + " references unknown source step: " + def.getSource());
            }
            if (def.getTarget() == null || !steps.containsKey(def.getTarget())) {
                throw new MalformedGraphException("Edge " + id + " references unknown target step: " + def.getTarget());
            }
            edges.add(new Edge(id, def.getSource(), def.getTarget(), def.getSourceHandle(), def.getTargetHandle(), def.getKind()));
            index++;
        }
        return edges;
    }

    private static String resolveEntry(WorkflowDefinition definition, Map<String, StepDefinition> steps, List<Edge> edges) {
        String explicit = definition.getEntryStepId();
        if (explicit != null && !explicit.isBlank()) {
            if (!steps.containsKey(explicit)) {
                throw new MalformedGraphException("Entry step does not exist: " + explicit);
            }
            return explicit;
        }
        for (Map.Entry<String, StepDefinition> e : steps.entrySet()) {
            if (INPUT_KIND.equalsIgnoreCase(e.getValue().getKind())) {
                return e.getKey();
            }
        }
        Set<String> targets = new HashSet<>();
        for (Edge edge : edges) {
            targets.add(edge.getTargetStepId());
        }
        for (String id : steps.keySet()) {
            if (!targets.contains(id)) {
                return id;
            }
        }
        return steps.keySet().iterator().next();
    }

    /**
     * Bellman-Ford-style longest-path relaxation. An acyclic graph stabilizes within
     * {@code |steps| - 1} rounds; a change in round {@code |steps|} means a cycle.
     */
    static Map<String, Integer> computeDepths(Set<String> stepIds, List<Edge> edges) {
        Map<String, Integer> depth = new HashMap<>();
        for (String id : stepIds) {
            depth.put(id, 0);
        }
        Set<String> changedInRound = new LinkedHashSet<>();
        for (int round = 0; round <= stepIds.size(); round++) {
            changedInRound.clear();
            for (Edge edge : edges) {
                int candidate = depth.get(edge.getSourceStepId()) + 1;
                if (candidate > depth.get(edge.getTargetStepId())) {
                    depth.put(edge.getTargetStepId(), candidate);
                    changedInRound.add(edge.getTargetStepId());
                }
            }
            if (changedInRound.isEmpty()) {
                return depth;
            }
        }
        List<String> onCycle = new ArrayList<>(changedInRound);
        onCycle.sort(Comparator.naturalOrder());
        log.warn("Graph compile failed | cycle detected | steps={}", onCycle);
        throw new CyclicGraphException(onCycle);
    }

    private static void checkReachable(String entryStepId, Set<String> stepIds, Map<String, Set<String>> dependents) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(entryStepId);
        seen.add(entryStepId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            for (String next : dependents.get(id)) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        if (seen.size() != stepIds.size()) {
            List<String> unreachable = new ArrayList<>();
            for (String id : stepIds) {
                if (!seen.contains(id)) unreachable.add(id);
            }
            throw new MalformedGraphException("Steps not reachable from entry step " + entryStepId + ": " + unreachable);
        }
    }

    private static Set<String> resolveTerminals(WorkflowDefinition definition, Map<String, StepDefinition> steps,
                                                Map<String, Set<String>> dependents) {
        Set<String> terminals = new LinkedHashSet<>();
        if (!definition.getOutputStepIds().isEmpty()) {
            for (String id : definition.getOutputStepIds()) {
                if (!steps.containsKey(id)) {
                    throw new MalformedGraphException("Output step does not exist: " + id);
                }
                terminals.add(id);
            }
            return terminals;
        }
        for (Map.Entry<String, StepDefinition> e : steps.entrySet()) {
            if (OUTPUT_KIND.equalsIgnoreCase(e.getValue().getKind())) {
                terminals.add(e.getKey());
            }
        }
        if (!terminals.isEmpty()) {
            return terminals;
        }
        for (String id : steps.keySet()) {
            if (dependents.get(id).isEmpty()) {
                terminals.add(id);
            }
        }
        return terminals;
    }
}
