package com.flowmaestro.worker.dispatch;

import java.util.function.LongSupplier;

/**
 * Run-level cancellation: an explicit {@link #cancel(String)} or a deadline on the supplied clock.
 * The clock is injected so a workflow host can use its deterministic time.
 */
public final class CancellationToken {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final LongSupplier clock;
    private final long deadlineMillis;
    private volatile String reason;

    private CancellationToken(LongSupplier clock, long deadlineMillis) {
        this.clock = clock;
        this.deadlineMillis = deadlineMillis;
    }

    /** Cancellable only explicitly. */
    public static CancellationToken create() {
        return new CancellationToken(System::currentTimeMillis, NO_DEADLINE);
    }

    /** Expires {@code timeoutMillis} after now on {@code clock}; a non-positive timeout means no deadline. */
    public static CancellationToken withTimeout(LongSupplier clock, long timeoutMillis) {
        long deadline = timeoutMillis > 0 ? clock.getAsLong() + timeoutMillis : NO_DEADLINE;
        return new CancellationToken(clock, deadline);
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason != null ? reason : "Cancelled";
        }
    }

    public boolean isCancelled() {
        return reason != null || isExpired();
    }

    /** Why the run was cancelled; null when it was not. */
    public String getReason() {
        if (reason != null) return reason;
        return isExpired() ? "Run timed out" : null;
    }

    /** Millis until the deadline; {@link Long#MAX_VALUE} when there is none. */
    public long remainingMillis() {
        if (deadlineMillis == NO_DEADLINE) return Long.MAX_VALUE;
        return Math.max(0L, deadlineMillis - clock.getAsLong());
    }

    private boolean isExpired() {
        return deadlineMillis != NO_DEADLINE && clock.getAsLong() >= deadlineMillis;
    }
}
