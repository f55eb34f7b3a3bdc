package com.flowmaestro.worker.dispatch;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {

    @Test
    void explicitCancel_keepsFirstReason() {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        assertNull(token.getReason());
        assertEquals(Long.MAX_VALUE, token.remainingMillis());

        token.cancel("user");
        token.cancel("second");

        assertTrue(token.isCancelled());
        assertEquals("user", token.getReason());
    }

    @Test
    void deadline_followsInjectedClock() {
        AtomicLong clock = new AtomicLong(1_000L);
        CancellationToken token = CancellationToken.withTimeout(clock::get, 500L);

        assertEquals(500L, token.remainingMillis());
        clock.set(1_400L);
        assertFalse(token.isCancelled());
        assertEquals(100L, token.remainingMillis());
        clock.set(1_500L);
        assertTrue(token.isCancelled());
        assertEquals("Run timed out", token.getReason());
        assertEquals(0L, token.remainingMillis());
    }

    @Test
    void nonPositiveTimeout_meansNoDeadline() {
        CancellationToken token = CancellationToken.withTimeout(() -> 0L, 0L);
        assertEquals(Long.MAX_VALUE, token.remainingMillis());
        assertFalse(token.isCancelled());
    }
}
