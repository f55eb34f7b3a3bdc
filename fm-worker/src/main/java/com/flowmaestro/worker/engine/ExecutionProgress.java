package com.flowmaestro.worker.engine;

/**
 * Point-in-time counts per step status. {@link #getPercentage()} is the share of steps that will
 * not run again (completed, failed, pruned, unreachable or cancelled).
 */
public final class ExecutionProgress {

    private final int total;
    private final int pending;
    private final int ready;
    private final int executing;
    private final int settled;
    private final int failed;
    private final int pruned;
    private final int unreachable;
    private final int cancelled;

    ExecutionProgress(QueueState state) {
        this.total = state.getSteps().size();
        this.pending = state.count(StepStatus.PENDING);
        this.ready = state.count(StepStatus.READY);
        this.executing = state.count(StepStatus.EXECUTING);
        this.settled = state.count(StepStatus.SETTLED);
        this.failed = state.count(StepStatus.FAILED);
        this.pruned = state.count(StepStatus.PRUNED);
        this.unreachable = state.count(StepStatus.UNREACHABLE);
        this.cancelled = state.count(StepStatus.CANCELLED);
    }

    public int getTotal() {
        return total;
    }

    public int getPending() {
        return pending;
    }

    public int getReady() {
        return ready;
    }

    public int getExecuting() {
        return executing;
    }

    /** Steps that completed or were error-routed. */
    public int getCompleted() {
        return settled;
    }

    public int getFailed() {
        return failed;
    }

    public int getPruned() {
        return pruned;
    }

    public int getUnreachable() {
        return unreachable;
    }

    public int getCancelled() {
        return cancelled;
    }

    public int getResolved() {
        return settled + failed + pruned + unreachable + cancelled;
    }

    public int getPercentage() {
        return total == 0 ? 100 : (int) Math.round(getResolved() * 100.0 / total);
    }

    @Override
    public String toString() {
        return "ExecutionProgress{total=" + total + ", completed=" + settled + ", failed=" + failed
                + ", pruned=" + pruned + ", executing=" + executing + ", percentage=" + getPercentage() + "}";
    }
}
