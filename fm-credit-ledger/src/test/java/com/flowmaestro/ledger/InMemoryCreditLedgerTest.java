package com.flowmaestro.ledger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryCreditLedgerTest {

    @Test
    void hold_reducesAvailableButNotBalance() {
        InMemoryCreditLedger ledger = new InMemoryCreditLedger().setBalance("acct", 100);
        ledger.hold("acct", 30);
        assertEquals(100, ledger.getBalance("acct"));
        assertEquals(70, ledger.getAvailable("acct"));
        assertTrue(ledger.checkAllowance("acct", 70));
        assertFalse(ledger.checkAllowance("acct", 71));
    }

    @Test
    void hold_beyondAvailable_throws() {
        InMemoryCreditLedger ledger = new InMemoryCreditLedger().setBalance("acct", 10);
        InsufficientBudgetException ex = assertThrows(InsufficientBudgetException.class, () -> ledger.hold("acct", 11));
        assertEquals(11, ex.getRequested());
        assertEquals(10, ex.getAvailable());
        assertEquals(0, ledger.openHoldCount());
    }

    @Test
    void negativeAmounts_areNeverAffordable() {
        InMemoryCreditLedger ledger = new InMemoryCreditLedger().setBalance("acct", 0);
        assertFalse(ledger.checkAllowance("acct", -5));
        assertThrows(IllegalArgumentException.class, () -> ledger.hold("acct", -5));
        assertEquals(0, ledger.openHoldCount());
    }

    @Test
    void settle_debitsActualAndClearsHold() {
        InMemoryCreditLedger ledger = new InMemoryCreditLedger().setBalance("acct", 100);
        ReservationHandle h = ledger.hold("acct", 40);
        ledger.settle(h, 15);
        assertEquals(85, ledger.getBalance("acct"));
        assertEquals(85, ledger.getAvailable("acct"));
        assertEquals(0, ledger.openHoldCount());
    }

    @Test
    void release_restoresAvailable() {
        InMemoryCreditLedger ledger = new InMemoryCreditLedger().setBalance("acct", 100);
        ReservationHandle h = ledger.hold("acct", 40);
        ledger.release(h);
        assertEquals(100, ledger.getAvailable("acct"));
    }

    @Test
    void settleAfterRelease_throws() {
        InMemoryCreditLedger ledger = new InMemoryCreditLedger().setBalance("acct", 100);
        ReservationHandle h = ledger.hold("acct", 40);
        ledger.release(h);
        assertThrows(IllegalStateException.class, () -> ledger.settle(h, 1));
    }

    @Test
    void unknownSubject_hasZeroBalance() {
        InMemoryCreditLedger ledger = new InMemoryCreditLedger();
        assertFalse(ledger.checkAllowance("nobody", 1));
        assertTrue(ledger.checkAllowance("nobody", 0));
    }
}
