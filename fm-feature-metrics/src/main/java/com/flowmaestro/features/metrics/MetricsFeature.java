package com.flowmaestro.features.metrics;

import com.flowmaestro.annotations.FeaturePhase;
import com.flowmaestro.annotations.FlowFeature;
import com.flowmaestro.annotations.ResourceCleanup;
import com.flowmaestro.features.PostStepCall;
import com.flowmaestro.features.PreStepCall;
import com.flowmaestro.features.StepHookContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Observer feature that records step metrics: dispatch and completion counters per kind and
 * outcome, a duration timer per kind, and a distribution of reported step cost.
 * Without an explicit registry a shared {@link SimpleMeterRegistry} is created lazily (CAS) and
 * reused for the life of the process.
 */
@FlowFeature(name = "metrics", phase = FeaturePhase.PRE_FINALLY, applicableStepKinds = { "*" })
public final class MetricsFeature implements PreStepCall, PostStepCall, ResourceCleanup {

    private static final AtomicReference<MeterRegistry> SHARED = new AtomicReference<>();

    static final String DISPATCHED = "flowmaestro.step.dispatched";
    static final String COMPLETED = "flowmaestro.step.completed";
    static final String DURATION = "flowmaestro.step.duration";
    static final String COST = "flowmaestro.step.cost";

    private final MeterRegistry registry;

    public MetricsFeature() {
        this(null);
    }

    public MetricsFeature(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Returns the shared registry, creating it on first call (lock-free CAS).
     * At most one registry is ever published.
     */
    static MeterRegistry sharedRegistry() {
        MeterRegistry existing = SHARED.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (SHARED.compareAndSet(null, created)) {
            return created;
        }
        return SHARED.get();
    }

    public MeterRegistry getRegistry() {
        return registry != null ? registry : sharedRegistry();
    }

    @Override
    public void before(StepHookContext ctx) {
        getRegistry().counter(DISPATCHED, "kind", kindOf(ctx)).increment();
    }

    @Override
    public void after(StepHookContext ctx, Object stepResult) {
        MeterRegistry r = getRegistry();
        String kind = kindOf(ctx);
        String outcome = ctx.isExecutionSucceeded() ? "success" : "failure";
        r.counter(COMPLETED, "kind", kind, "outcome", outcome).increment();
        Timer.builder(DURATION)
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(r)
                .record(Math.max(0L, ctx.getDurationMs()), TimeUnit.MILLISECONDS);
        if (ctx.getCost() != null) {
            r.summary(COST, "kind", kind).record(ctx.getCost());
        }
    }

    @Override
    public void onExit() {
        MeterRegistry shared = SHARED.getAndSet(null);
        if (shared != null) {
            shared.close();
        }
    }

    private static String kindOf(StepHookContext ctx) {
        String kind = ctx.getKind();
        return kind != null && !kind.isBlank() ? kind : "unknown";
    }
}
