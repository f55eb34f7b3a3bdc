package com.flowmaestro.graph.compiled;

import java.util.List;

/**
 * Shape of a compiled graph, logged at run start.
 */
public record GraphSummary(
        String name,
        int stepCount,
        int edgeCount,
        int levelCount,
        int maxLevelWidth,
        String entryStepId,
        List<String> terminalStepIds,
        int maxConcurrent) {
}
