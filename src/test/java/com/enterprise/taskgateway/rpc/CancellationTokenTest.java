package com.enterprise.taskgateway.rpc;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void testListenersRunOnceOnCancel() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();
        token.onCancel(runs::incrementAndGet);
        token.onCancel(runs::incrementAndGet);

        assertFalse(token.isCancelled());
        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(2, runs.get());
    }

    @Test
    void testLateListenerRunsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger runs = new AtomicInteger();

        token.onCancel(runs::incrementAndGet);

        assertEquals(1, runs.get());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(runs::incrementAndGet);

        token.cancel();

        assertEquals(1, runs.get());
    }

    @Test
    void testRemovedListenerDoesNotRun() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();
        CancellationToken.Registration first = token.onCancel(runs::incrementAndGet);
        token.onCancel(runs::incrementAndGet);
        assertEquals(2, token.getListenerCount());

        first.remove();
        first.remove();
        assertEquals(1, token.getListenerCount());
        token.cancel();

        assertEquals(1, runs.get());
        assertEquals(0, token.getListenerCount());
    }

    @Test
    void testReusedTokenDoesNotAccumulateListeners() {
        CancellationToken token = new CancellationToken();

        for (int i = 0; i < 1000; i++) {
            token.onCancel(() -> { }).remove();
        }

        assertEquals(0, token.getListenerCount());
    }
}
