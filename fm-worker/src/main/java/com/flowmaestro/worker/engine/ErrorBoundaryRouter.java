package com.flowmaestro.worker.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowmaestro.executioncontext.ExecutionContext;
import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.compiled.Edge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides where a failed step's signal goes. A step fails into exactly one branch: with error
 * edges, those are taken and its default edges are pruned; without, every outgoing edge is
 * blocked and the failure stays local to the step's own downstream.
 */
public final class ErrorBoundaryRouter {

    private static final Logger log = LoggerFactory.getLogger(ErrorBoundaryRouter.class);

    public RoutingDecision route(CompiledGraph graph, String stepId, String errorMessage) {
        ObjectNode errorOutput = ExecutionContext.errorOutput(errorMessage);
        List<String> errorEdges = new ArrayList<>();
        List<String> defaultEdges = new ArrayList<>();
        for (Edge edge : graph.getOutgoingEdges(stepId)) {
            if (edge.isError()) {
                errorEdges.add(edge.getId());
            } else {
                defaultEdges.add(edge.getId());
            }
        }
        if (errorEdges.isEmpty()) {
            if (log.isInfoEnabled()) {
                log.info("Router fatal | stepId={} | blockedEdges={} | error={}", stepId, defaultEdges, errorMessage);
            }
            return RoutingDecision.fatal(stepId, errorOutput, defaultEdges);
        }
        if (log.isInfoEnabled()) {
            log.info("Router error-routed | stepId={} | errorEdges={} | prunedEdges={}", stepId, errorEdges, defaultEdges);
        }
        return RoutingDecision.routed(stepId, errorOutput, errorEdges, defaultEdges);
    }
}
