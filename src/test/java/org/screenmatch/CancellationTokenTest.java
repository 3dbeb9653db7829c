package org.screenmatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CancellationTokenTest {

    @Test
    void testCancelAndReset() {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancelled());
        token.cancel();
        token.cancel();
        assertTrue(token.isCancelled());
        token.reset();
        assertFalse(token.isCancelled());
    }

    @Test
    void testThrowIfCancelled() {
        CancellationToken token = new CancellationToken();
        token.throwIfCancelled("click");
        token.cancel();
        CancelledException e = assertThrows(CancelledException.class, () -> token.throwIfCancelled("click"));
        assertEquals("click", e.getOperation());
        assertTrue(e.getMessage().contains("click"));
    }

    @Test
    void testCancelIsVisibleAcrossThreads() throws InterruptedException {
        CancellationToken token = new CancellationToken();
        Thread canceller = new Thread(token::cancel);
        canceller.start();
        canceller.join();
        assertTrue(token.isCancelled());
    }
}
