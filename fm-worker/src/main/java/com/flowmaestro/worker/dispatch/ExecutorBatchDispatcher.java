package com.flowmaestro.worker.dispatch;

import com.flowmaestro.annotations.ResourceCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process dispatcher: submits each batch member to a fixed thread pool and waits for all of
 * them, polling the cancellation token. A member running past the step timeout is interrupted
 * and reported as failed. The timeout counts from when a pool thread picks the member up, so
 * members queued behind a smaller pool get their full budget.
 */
public final class ExecutorBatchDispatcher implements BatchDispatcher, ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(ExecutorBatchDispatcher.class);
    private static final long POLL_MILLIS = 20L;

    private final StepInvoker invoker;
    private final ExecutorService executor;
    private final long stepTimeoutMillis;

    /**
     * @param threads           pool size; should be at least the largest {@code maxConcurrent} in use
     * @param stepTimeoutMillis per-step limit; non-positive means none
     */
    public ExecutorBatchDispatcher(StepInvoker invoker, int threads, long stepTimeoutMillis) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "fm-step-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.stepTimeoutMillis = stepTimeoutMillis;
    }

    @Override
    public BatchResult dispatch(List<StepInvocation> batch, CancellationToken cancellation) {
        Map<String, Future<StepCompletion>> pending = new LinkedHashMap<>();
        Map<String, Long> startedAt = new ConcurrentHashMap<>();
        long submittedAt = System.currentTimeMillis();
        for (StepInvocation invocation : batch) {
            pending.put(invocation.stepId(), executor.submit(() -> {
                startedAt.put(invocation.stepId(), System.currentTimeMillis());
                return invoker.invoke(invocation);
            }));
        }
        List<StepCompletion> completions = new ArrayList<>(batch.size());
        while (!pending.isEmpty()) {
            if (cancellation != null && cancellation.isCancelled()) {
                log.info("Dispatch cancelled | reason={} | abandoned={}", cancellation.getReason(), pending.keySet());
                pending.values().forEach(f -> f.cancel(true));
                return new BatchResult(completions, true);
            }
            String stepId = pending.keySet().iterator().next();
            Future<StepCompletion> future = pending.get(stepId);
            try {
                completions.add(future.get(POLL_MILLIS, TimeUnit.MILLISECONDS));
                pending.remove(stepId);
            } catch (TimeoutException e) {
                Long started = startedAt.get(stepId);
                long elapsed = started != null ? System.currentTimeMillis() - started : 0L;
                if (stepTimeoutMillis > 0 && started != null && elapsed >= stepTimeoutMillis) {
                    future.cancel(true);
                    pending.remove(stepId);
                    log.warn("Step timed out | stepId={} | elapsedMs={}", stepId, elapsed);
                    completions.add(new StepCompletion(stepId,
                            StepOutcome.failure("Step timed out after " + stepTimeoutMillis + "ms"), elapsed));
                } else {
                    // Rotate so a slow member does not hide completed ones.
                    pending.remove(stepId);
                    pending.put(stepId, future);
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                pending.remove(stepId);
                completions.add(new StepCompletion(stepId, StepOutcome.failure(cause.getMessage()),
                        System.currentTimeMillis() - startedAt.getOrDefault(stepId, submittedAt)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                return new BatchResult(completions, true);
            }
        }
        return new BatchResult(completions, false);
    }

    @Override
    public void onExit() {
        executor.shutdownNow();
    }
}
