package com.flowmaestro.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Process-local ledger. Balances and holds live in memory; all operations are serialized on the
 * instance. Used by the worker when no external ledger is wired and by tests.
 */
public final class InMemoryCreditLedger implements CreditLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCreditLedger.class);

    private final Map<String, Long> balances = new HashMap<>();
    private final Map<String, ReservationHandle> holds = new LinkedHashMap<>();

    public synchronized InMemoryCreditLedger setBalance(String subjectId, long credits) {
        balances.put(Objects.requireNonNull(subjectId, "subjectId"), credits);
        return this;
    }

    public synchronized long getBalance(String subjectId) {
        return balances.getOrDefault(subjectId, 0L);
    }

    public synchronized long getHeld(String subjectId) {
        long held = 0L;
        for (ReservationHandle h : holds.values()) {
            if (h.getSubjectId().equals(subjectId)) held += h.getAmount();
        }
        return held;
    }

    /** Balance minus outstanding holds. */
    public synchronized long getAvailable(String subjectId) {
        return getBalance(subjectId) - getHeld(subjectId);
    }

    public synchronized int openHoldCount() {
        return holds.size();
    }

    @Override
    public synchronized boolean checkAllowance(String subjectId, long amount) {
        return amount >= 0 && getAvailable(subjectId) >= amount;
    }

    @Override
    public synchronized ReservationHandle hold(String subjectId, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Hold amount must not be negative: " + amount);
        }
        long available = getAvailable(subjectId);
        if (available < amount) {
            throw new InsufficientBudgetException(subjectId, amount, available);
        }
        ReservationHandle handle = new ReservationHandle(UUID.randomUUID().toString(), subjectId, amount);
        holds.put(handle.getId(), handle);
        log.debug("Credits held | subject={} | amount={} | handle={}", subjectId, amount, handle.getId());
        return handle;
    }

    @Override
    public synchronized void settle(ReservationHandle handle, long actualAmount) {
        ReservationHandle held = removeHold(handle);
        balances.merge(held.getSubjectId(), -actualAmount, Long::sum);
        log.debug("Credits settled | subject={} | held={} | debited={}", held.getSubjectId(), held.getAmount(), actualAmount);
    }

    @Override
    public synchronized void release(ReservationHandle handle) {
        ReservationHandle held = removeHold(handle);
        log.debug("Credits released | subject={} | amount={}", held.getSubjectId(), held.getAmount());
    }

    private ReservationHandle removeHold(ReservationHandle handle) {
        Objects.requireNonNull(handle, "handle");
        ReservationHandle held = holds.remove(handle.getId());
        if (held == null) {
            throw new IllegalStateException("No open hold for handle " + handle.getId());
        }
        return held;
    }
}
