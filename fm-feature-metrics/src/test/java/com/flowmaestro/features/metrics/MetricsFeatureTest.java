package com.flowmaestro.features.metrics;

import com.flowmaestro.features.FeatureRegistry;
import com.flowmaestro.features.StepFeatureRunner;
import com.flowmaestro.features.StepHookContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class MetricsFeatureTest {

    @Test
    void recordsDispatchCompletionAndCost() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        FeatureRegistry registry = new FeatureRegistry();
        registry.registerCommunity(new MetricsFeature(meters));
        StepFeatureRunner runner = new StepFeatureRunner(registry);

        StepHookContext ctx = new StepHookContext("run-1", "llm", "llm", "LLM", null);
        runner.runPre(ctx);
        runner.runPost(ctx.withOutcome(true, 40L, 7L, null), null);
        runner.runPost(ctx.withOutcome(false, 5L, null, "boom"), null);

        assertEquals(1.0, meters.get(MetricsFeature.DISPATCHED).tag("kind", "llm").counter().count());
        assertEquals(1.0, meters.get(MetricsFeature.COMPLETED).tag("outcome", "success").counter().count());
        assertEquals(1.0, meters.get(MetricsFeature.COMPLETED).tag("outcome", "failure").counter().count());
        assertEquals(7.0, meters.get(MetricsFeature.COST).summary().totalAmount());
    }

    @Test
    void sharedRegistry_isCreatedOnce() {
        assertSame(MetricsFeature.sharedRegistry(), MetricsFeature.sharedRegistry());
        assertSame(MetricsFeature.sharedRegistry(), new MetricsFeature().getRegistry());
    }
}
