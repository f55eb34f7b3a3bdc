package com.flowmaestro.worker.dispatch;

import com.flowmaestro.features.StepFeatureRunner;
import com.flowmaestro.features.StepHookContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Runs a {@link StepExecutor} for one invocation with feature hooks around it. Never throws:
 * any error, including an internal pre-hook rejecting the step, becomes a failed outcome.
 */
public final class StepInvoker {

    private static final Logger log = LoggerFactory.getLogger(StepInvoker.class);

    private final StepExecutor executor;
    private final StepFeatureRunner features;

    public StepInvoker(StepExecutor executor, StepFeatureRunner features) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.features = features;
    }

    public StepInvoker(StepExecutor executor) {
        this(executor, null);
    }

    public StepCompletion invoke(StepInvocation invocation) {
        StepMeta meta = invocation.getMeta();
        StepHookContext hookContext = new StepHookContext(meta.getRunId(), meta.getStepId(), invocation.getKind(),
                meta.getStepName(), Map.of("depth", meta.getDepth()));
        long start = System.nanoTime();
        StepOutcome outcome;
        try {
            if (features != null) features.runPre(hookContext);
            outcome = executor.execute(invocation.getKind(), invocation.getConfig(), invocation.getSnapshot(), meta);
            if (outcome == null) {
                outcome = StepOutcome.failure("Executor returned no outcome for step " + meta.getStepId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = StepOutcome.failure("Step interrupted");
        } catch (Throwable t) {
            String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
            log.warn("Step execution failed | runId={} | stepId={} | kind={} | error={}",
                    meta.getRunId(), meta.getStepId(), invocation.getKind(), message, t);
            outcome = StepOutcome.failure(message);
        }
        long durationMs = (System.nanoTime() - start) / 1_000_000L;
        if (features != null) {
            features.runPost(hookContext.withOutcome(outcome.isSuccess(), durationMs, outcome.getCost(), outcome.getError()), outcome);
        }
        if (log.isDebugEnabled()) {
            log.debug("Step invoked | stepId={} | success={} | durationMs={}", meta.getStepId(), outcome.isSuccess(), durationMs);
        }
        return new StepCompletion(meta.getStepId(), outcome, durationMs);
    }
}
