package com.flowmaestro.worker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowmaestro.executioncontext.ContextSnapshot;
import com.flowmaestro.executioncontext.ExecutionContext;
import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.compiled.Edge;
import com.flowmaestro.graph.compiled.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Drives one run over a {@link CompiledGraph}: tracks step and edge states, hands out ready
 * batches, and applies completions.
 * <p>
 * Readiness rule: for each predecessor of a step, the predecessor's edges into the step are
 * combined. Any satisfied edge satisfies the predecessor; otherwise it is unresolved while an edge
 * is pending, blocked if an edge is blocked, and pruned otherwise. A step becomes
 * <ul>
 *   <li>UNREACHABLE as soon as any predecessor is blocked,</li>
 *   <li>READY once no predecessor is unresolved and at least one is satisfied,</li>
 *   <li>PRUNED once every predecessor is pruned.</li>
 * </ul>
 * UNREACHABLE and PRUNED close the step's outgoing edges (blocked and pruned) and cascade.
 * <p>
 * Every transition replaces the {@link QueueState} and {@link ExecutionContext} under the instance
 * lock, so concurrent completions of one batch cannot double-promote a dependent.
 */
public final class ReadinessScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReadinessScheduler.class);

    private final CompiledGraph graph;
    private final ErrorBoundaryRouter router;
    private QueueState state;
    private ExecutionContext context;

    public ReadinessScheduler(CompiledGraph graph, ExecutionContext context) {
        this(graph, context, QueueState.initial(graph), new ErrorBoundaryRouter());
    }

    /** Resumes from a previously observed state. */
    public ReadinessScheduler(CompiledGraph graph, ExecutionContext context, QueueState state, ErrorBoundaryRouter router) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.context = Objects.requireNonNull(context, "context");
        this.state = Objects.requireNonNull(state, "state");
        this.router = router != null ? router : new ErrorBoundaryRouter();
    }

    public CompiledGraph getGraph() {
        return graph;
    }

    public synchronized QueueState getState() {
        return state;
    }

    public synchronized ExecutionContext getContext() {
        return context;
    }

    public synchronized StepStatus statusOf(String stepId) {
        return state.statusOf(stepId);
    }

    /**
     * Moves up to {@code maxConcurrent} READY steps (compile order) to EXECUTING. All members
     * share one context snapshot taken now.
     */
    public synchronized ReadyBatch getReadyBatch(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1: " + maxConcurrent);
        }
        Set<String> ready = state.ready();
        if (ready.isEmpty()) {
            return ReadyBatch.empty();
        }
        ContextSnapshot snapshot = context.snapshot();
        QueueState.Transition t = state.edit();
        List<ReadyStep> batch = new ArrayList<>();
        for (String id : ready) {
            if (batch.size() >= maxConcurrent) break;
            t.step(id, StepStatus.EXECUTING);
            batch.add(new ReadyStep(graph.getStep(id), snapshot, takenSources(id)));
        }
        state = t.commit();
        if (log.isInfoEnabled()) {
            log.info("Scheduler batch | size={} | stepIds={} | stillReady={}", batch.size(),
                    batch.stream().map(ReadyStep::getStepId).toList(), ready.size() - batch.size());
        }
        return new ReadyBatch(batch);
    }

    public void markSettled(String stepId, JsonNode output) {
        markSettled(stepId, output, List.of());
    }

    /**
     * Records the step's output and satisfies its default edges. When {@code selectedHandles} is
     * non-empty, only default edges on those source handles are satisfied and the rest are
     * pruned. Error edges are always pruned.
     *
     * @throws IllegalStateException if the step is neither executing nor already completed
     */
    public synchronized void markSettled(String stepId, JsonNode output, Collection<String> selectedHandles) {
        if (!acceptCompletion(stepId, "markSettled")) return;
        Set<String> selected = selectedHandles != null ? new LinkedHashSet<>(selectedHandles) : Set.of();
        ExecutionContext nextContext = context.recordOutput(stepId, output);
        QueueState.Transition t = state.edit().step(stepId, StepStatus.SETTLED);
        Set<String> targets = new LinkedHashSet<>();
        for (Edge edge : graph.getOutgoingEdges(stepId)) {
            boolean taken = !edge.isError() && (selected.isEmpty() || selected.contains(edge.getSourceHandle()));
            t.edge(edge.getId(), taken ? EdgeState.SATISFIED : EdgeState.PRUNED);
            targets.add(edge.getTargetStepId());
        }
        propagate(t, targets);
        context = nextContext;
        state = t.commit();
        if (log.isInfoEnabled()) {
            log.info("Scheduler markSettled | stepId={} | selectedHandles={}", stepId, selected);
        }
    }

    /**
     * Routes the failure through {@link ErrorBoundaryRouter}: the error output is recorded, then
     * either the error edges are satisfied (step SETTLED) or all outgoing edges are blocked
     * (step FAILED).
     *
     * @return the routing applied, or null when the completion was ignored
     * @throws IllegalStateException if the step is neither executing nor already completed
     */
    public synchronized RoutingDecision markFailed(String stepId, String errorMessage) {
        if (!acceptCompletion(stepId, "markFailed")) return null;
        RoutingDecision decision = router.route(graph, stepId, errorMessage);
        ExecutionContext nextContext = context.recordOutput(stepId, decision.getErrorOutput());
        QueueState.Transition t = state.edit()
                .step(stepId, decision.getResultingStatus())
                .error(stepId, errorMessage != null ? errorMessage : "Step failed");
        for (String edgeId : decision.getSatisfiedEdgeIds()) t.edge(edgeId, EdgeState.SATISFIED);
        for (String edgeId : decision.getPrunedEdgeIds()) t.edge(edgeId, EdgeState.PRUNED);
        for (String edgeId : decision.getBlockedEdgeIds()) t.edge(edgeId, EdgeState.BLOCKED);
        Set<String> targets = new LinkedHashSet<>();
        for (Edge edge : graph.getOutgoingEdges(stepId)) targets.add(edge.getTargetStepId());
        propagate(t, targets);
        context = nextContext;
        state = t.commit();
        return decision;
    }

    /**
     * Marks every executing step CANCELLED. Later completions for those steps are ignored.
     *
     * @return the cancelled step ids
     */
    public synchronized List<String> cancelExecuting() {
        List<String> cancelled = new ArrayList<>(state.executing());
        if (cancelled.isEmpty()) return cancelled;
        QueueState.Transition t = state.edit();
        for (String id : cancelled) t.step(id, StepStatus.CANCELLED);
        state = t.commit();
        log.info("Scheduler cancelExecuting | stepIds={}", cancelled);
        return cancelled;
    }

    /**
     * True when nothing is ready or executing and no pending step has a live path. A pending step
     * can only advance through a ready or executing ancestor, so the first two sets decide it.
     */
    public synchronized boolean isComplete() {
        return state.count(StepStatus.READY) == 0 && state.count(StepStatus.EXECUTING) == 0;
    }

    public synchronized ExecutionProgress progress() {
        return new ExecutionProgress(state);
    }

    /** Terminal steps that completed (including error-routed), in compile order. */
    public synchronized List<String> settledTerminals() {
        List<String> ids = new ArrayList<>();
        for (String id : graph.getTerminalStepIds()) {
            if (state.statusOf(id) == StepStatus.SETTLED) ids.add(id);
        }
        return ids;
    }

    /** Terminal steps that are neither settled nor pruned. */
    public synchronized List<String> unreachedTerminals() {
        List<String> ids = new ArrayList<>();
        for (String id : graph.getTerminalStepIds()) {
            StepStatus s = state.statusOf(id);
            if (s != StepStatus.SETTLED && s != StepStatus.PRUNED) ids.add(id);
        }
        return ids;
    }

    private List<String> takenSources(String stepId) {
        Set<String> sources = new LinkedHashSet<>();
        for (Edge edge : graph.getIncomingEdges(stepId)) {
            if (state.edgeState(edge.getId()) == EdgeState.SATISFIED) sources.add(edge.getSourceStepId());
        }
        return new ArrayList<>(sources);
    }

    private boolean acceptCompletion(String stepId, String operation) {
        StepStatus current = state.statusOf(stepId);
        switch (current) {
            case EXECUTING:
                return true;
            case SETTLED:
            case FAILED:
                log.warn("Scheduler {} ignored | stepId={} | already completed as {}", operation, stepId, current);
                return false;
            case CANCELLED:
                log.info("Scheduler {} ignored | stepId={} | step was cancelled", operation, stepId);
                return false;
            default:
                throw new IllegalStateException("Cannot complete step " + stepId + " in status " + current);
        }
    }

    private void propagate(QueueState.Transition t, Collection<String> targets) {
        Deque<String> work = new ArrayDeque<>(targets);
        while (!work.isEmpty()) {
            String id = work.poll();
            if (t.status(id) != StepStatus.PENDING) continue;
            Step step = graph.getStep(id);
            int unresolved = 0;
            boolean blocked = false;
            boolean satisfied = false;
            for (String pred : step.getDependencies()) {
                switch (relation(t, pred, step)) {
                    case PENDING -> unresolved++;
                    case BLOCKED -> blocked = true;
                    case SATISFIED -> satisfied = true;
                    case PRUNED -> { }
                }
            }
            t.unresolved(id, unresolved);
            if (blocked) {
                t.step(id, StepStatus.UNREACHABLE);
                closeOutgoing(t, id, EdgeState.BLOCKED, work);
                if (log.isInfoEnabled()) log.info("Scheduler step unreachable | stepId={}", id);
            } else if (unresolved > 0) {
                if (log.isDebugEnabled()) log.debug("Scheduler step waiting | stepId={} | unresolved={}", id, unresolved);
            } else if (satisfied) {
                t.step(id, StepStatus.READY);
                if (log.isInfoEnabled()) log.info("Scheduler step ready | stepId={}", id);
            } else {
                t.step(id, StepStatus.PRUNED);
                closeOutgoing(t, id, EdgeState.PRUNED, work);
                if (log.isInfoEnabled()) log.info("Scheduler step pruned | stepId={}", id);
            }
        }
    }

    private EdgeState relation(QueueState.Transition t, String predecessorId, Step target) {
        boolean pending = false;
        boolean blocked = false;
        for (String edgeId : target.getIncomingEdgeIds()) {
            Edge edge = graph.getEdge(edgeId);
            if (!edge.getSourceStepId().equals(predecessorId)) continue;
            EdgeState s = t.edge(edgeId);
            if (s == EdgeState.SATISFIED) return EdgeState.SATISFIED;
            if (s == EdgeState.PENDING) pending = true;
            else if (s == EdgeState.BLOCKED) blocked = true;
        }
        if (pending) return EdgeState.PENDING;
        return blocked ? EdgeState.BLOCKED : EdgeState.PRUNED;
    }

    private void closeOutgoing(QueueState.Transition t, String stepId, EdgeState closed, Deque<String> work) {
        for (Edge edge : graph.getOutgoingEdges(stepId)) {
            t.edge(edge.getId(), closed);
            work.add(edge.getTargetStepId());
        }
    }
}
