package com.flowmaestro.worker.run;

import com.flowmaestro.graph.compiled.CompiledGraph;
import com.flowmaestro.graph.compiled.Step;

/**
 * Estimates the credits a run may consume, for the pre-flight check and the hold.
 */
@FunctionalInterface
public interface CostEstimator {

    String ESTIMATED_COST_KEY = "estimatedCost";

    long estimate(CompiledGraph graph);

    /**
     * Sums each step's {@code config.estimatedCost}, using {@code defaultStepCost} for steps that
     * declare none. Every step is counted, so the hold covers the most expensive branch. The sum
     * saturates at {@link Long#MAX_VALUE}.
     */
    static CostEstimator perStep(long defaultStepCost) {
        return graph -> {
            long total = 0L;
            for (Step step : graph.getSteps().values()) {
                var declared = step.getConfig().get(ESTIMATED_COST_KEY);
                long cost = declared != null && declared.canConvertToLong() ? declared.asLong() : defaultStepCost;
                total = saturatedAdd(total, Math.max(0L, cost));
            }
            return total;
        };
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
