package com.flowmaestro.ledger;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionGateTest {

    /** Counts ledger calls so tests can assert exactly-once settlement. */
    private static final class CountingLedger implements CreditLedger {
        final InMemoryCreditLedger delegate = new InMemoryCreditLedger();
        final AtomicInteger settles = new AtomicInteger();
        final AtomicInteger releases = new AtomicInteger();
        long lastSettled = -1;

        @Override
        public boolean checkAllowance(String subjectId, long amount) {
            return delegate.checkAllowance(subjectId, amount);
        }

        @Override
        public ReservationHandle hold(String subjectId, long amount) {
            return delegate.hold(subjectId, amount);
        }

        @Override
        public void settle(ReservationHandle handle, long actualAmount) {
            settles.incrementAndGet();
            lastSettled = actualAmount;
            delegate.settle(handle, actualAmount);
        }

        @Override
        public void release(ReservationHandle handle) {
            releases.incrementAndGet();
            delegate.release(handle);
        }
    }

    @Test
    void preflight_allowsWhenAffordable() {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 50);
        AdmissionDecision decision = new AdmissionGate(ledger).preflight("acct", 50);
        assertTrue(decision.isAllowed());
        assertNull(decision.getReason());
    }

    @Test
    void preflight_deniesWhenUnaffordable() {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 5);
        AdmissionDecision decision = new AdmissionGate(ledger).preflight("acct", 6);
        assertFalse(decision.isAllowed());
        assertNotNull(decision.getReason());
        assertEquals(0, ledger.delegate.openHoldCount());
    }

    @Test
    void preflight_negativeEstimate_denies() {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 0);
        AdmissionDecision decision = new AdmissionGate(ledger).preflight("acct", Long.MIN_VALUE);
        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("Invalid estimated cost"));
    }

    @Test
    void preflight_ledgerFailure_denies() {
        CreditLedger broken = new CreditLedger() {
            @Override public boolean checkAllowance(String s, long a) { throw new IllegalStateException("ledger down"); }
            @Override public ReservationHandle hold(String s, long a) { throw new UnsupportedOperationException(); }
            @Override public void settle(ReservationHandle h, long a) { throw new UnsupportedOperationException(); }
            @Override public void release(ReservationHandle h) { throw new UnsupportedOperationException(); }
        };
        AdmissionDecision decision = new AdmissionGate(broken).preflight("acct", 1);
        assertFalse(decision.isAllowed());
        assertTrue(decision.getReason().contains("ledger down"));
    }

    @Test
    void finish_withDispatchedSteps_settlesAccumulatedCost() {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 100);
        AdmissionGate gate = new AdmissionGate(ledger);
        Reservation r = gate.reserve("run-1", "acct", 30);
        gate.recordCost(r, "a", 4);
        gate.recordCost(r, "b", 6);
        gate.recordCost(r, "c", -3);

        assertTrue(gate.finish(r, true));
        assertEquals(Reservation.State.SETTLED, r.getState());
        assertEquals(10, ledger.lastSettled);
        assertEquals(90, ledger.delegate.getBalance("acct"));
        assertEquals(0, ledger.releases.get());
    }

    @Test
    void finish_withoutDispatch_releases() {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 100);
        AdmissionGate gate = new AdmissionGate(ledger);
        Reservation r = gate.reserve("run-1", "acct", 30);

        assertTrue(gate.finish(r, false));
        assertEquals(Reservation.State.RELEASED, r.getState());
        assertEquals(1, ledger.releases.get());
        assertEquals(0, ledger.settles.get());
        assertEquals(100, ledger.delegate.getAvailable("acct"));
    }

    @Test
    void finish_calledTwice_reachesLedgerOnce() {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 100);
        AdmissionGate gate = new AdmissionGate(ledger);
        Reservation r = gate.reserve("run-1", "acct", 30);

        assertTrue(gate.finish(r, true));
        assertFalse(gate.finish(r, true));
        assertFalse(gate.finish(r, false));
        assertEquals(1, ledger.settles.get());
        assertEquals(0, ledger.releases.get());
    }

    @Test
    void finish_concurrentCallers_exactlyOneWins() throws Exception {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 100);
        AdmissionGate gate = new AdmissionGate(ledger);
        Reservation r = gate.reserve("run-1", "acct", 30);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        for (int i = 0; i < threads; i++) {
            boolean dispatched = i % 2 == 0;
            pool.submit(() -> {
                start.await();
                if (gate.finish(r, dispatched)) winners.incrementAndGet();
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, winners.get());
        assertEquals(1, ledger.settles.get() + ledger.releases.get());
    }

    @Test
    void reserve_insufficient_throwsWithoutHold() {
        CountingLedger ledger = new CountingLedger();
        ledger.delegate.setBalance("acct", 1);
        AdmissionGate gate = new AdmissionGate(ledger);
        assertThrows(InsufficientBudgetException.class, () -> gate.reserve("run-1", "acct", 2));
        assertEquals(0, ledger.delegate.openHoldCount());
    }
}
