package com.flowmaestro.features;

import com.flowmaestro.annotations.FeaturePhase;
import com.flowmaestro.annotations.FlowFeature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StepFeatureRunnerTest {

    @FlowFeature(name = "recorder", phase = FeaturePhase.PRE_FINALLY, applicableStepKinds = { "llm.*" })
    static final class RecordingFeature implements PreStepCall, PostStepCall {
        final List<String> calls = new ArrayList<>();

        @Override
        public void before(StepHookContext context) {
            calls.add("before:" + context.getStepId());
        }

        @Override
        public void after(StepHookContext context, Object stepResult) {
            calls.add("after:" + context.getStepId() + ":" + context.isExecutionSucceeded());
        }
    }

    @FlowFeature(name = "broken", phase = FeaturePhase.PRE)
    static final class BrokenFeature implements PreStepCall {
        @Override
        public void before(StepHookContext context) {
            throw new IllegalStateException("telemetry down");
        }
    }

    static final class NotAnnotated implements PreStepCall {
        @Override
        public void before(StepHookContext context) {
        }
    }

    @Test
    void runPreAndPost_onlyForApplicableKinds() {
        FeatureRegistry registry = new FeatureRegistry();
        RecordingFeature feature = new RecordingFeature();
        registry.registerInternal(feature);
        StepFeatureRunner runner = new StepFeatureRunner(registry);

        StepHookContext llm = new StepHookContext("run-1", "summarize", "llm.openai", null, null);
        runner.runPre(llm);
        runner.runPost(llm.withOutcome(true, 12L, 3L, null), "ok");
        runner.runPre(new StepHookContext("run-1", "in", "input", null, null));

        assertEquals(List.of("before:summarize", "after:summarize:true"), feature.calls);
    }

    @Test
    void communityFailure_isSwallowed() {
        FeatureRegistry registry = new FeatureRegistry();
        registry.registerCommunity(new BrokenFeature());

        new StepFeatureRunner(registry).runPre(new StepHookContext("run-1", "s", "llm", null, null));
    }

    @Test
    void internalPreFailure_propagates() {
        FeatureRegistry registry = new FeatureRegistry();
        registry.registerInternal(new BrokenFeature());

        assertThrows(IllegalStateException.class,
                () -> new StepFeatureRunner(registry).runPre(new StepHookContext("run-1", "s", "llm", null, null)));
    }

    @Test
    void register_requiresAnnotation_andUniqueName() {
        FeatureRegistry registry = new FeatureRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.registerInternal(new NotAnnotated()));

        registry.registerInternal(new RecordingFeature());
        IllegalArgumentException dup = assertThrows(IllegalArgumentException.class,
                () -> registry.registerCommunity(new RecordingFeature()));
        assertTrue(dup.getMessage().contains("recorder"));
    }
}
