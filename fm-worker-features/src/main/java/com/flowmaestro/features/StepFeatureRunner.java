package com.flowmaestro.features;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs pre- and post-execution feature hooks for a step.
 * Community hook failures are logged and swallowed; an internal pre hook failure propagates.
 * Post hooks never propagate: the step has already completed.
 */
public final class StepFeatureRunner {

    private static final Logger log = LoggerFactory.getLogger(StepFeatureRunner.class);

    private final FeatureRegistry registry;

    public StepFeatureRunner(FeatureRegistry registry) {
        this.registry = registry != null ? registry : new FeatureRegistry();
    }

    public void runPre(StepHookContext context) {
        for (FeatureRegistry.FeatureEntry e : registry.getFeaturesForStep(context.getKind())) {
            if (!e.isPre() || !(e.getInstance() instanceof PreStepCall)) continue;
            PreStepCall call = (PreStepCall) e.getInstance();
            if (e.isCommunity()) {
                try {
                    call.before(context);
                } catch (Throwable t) {
                    log.warn("Community pre feature {} failed (observer-only); continuing | stepId={}", e.getName(), context.getStepId(), t);
                }
            } else {
                call.before(context);
            }
        }
    }

    public void runPost(StepHookContext context, Object stepResult) {
        boolean succeeded = context.isExecutionSucceeded();
        for (FeatureRegistry.FeatureEntry e : registry.getFeaturesForStep(context.getKind())) {
            boolean applies = succeeded ? e.isPostSuccess() : e.isPostError();
            if (!applies || !(e.getInstance() instanceof PostStepCall)) continue;
            try {
                ((PostStepCall) e.getInstance()).after(context, stepResult);
            } catch (Throwable t) {
                log.warn("Post feature {} failed | stepId={}", e.getName(), context.getStepId(), t);
            }
        }
    }
}
