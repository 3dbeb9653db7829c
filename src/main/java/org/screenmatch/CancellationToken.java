package org.screenmatch;

import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Cooperative cancellation flag shared between the party that may cancel and the polling loops that check it.
 * Checking never interrupts work already in progress; it only affects the next iteration.
 */
public class CancellationToken {
    private static final Logger l = LogManager.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            l.debug("Cancellation token triggered");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void reset() {
        cancelled.set(false);
    }

    /** Throws {@link CancelledException} naming the operation if the token is set. */
    public void throwIfCancelled(String operation) {
        if (cancelled.get()) {
            throw new CancelledException(operation);
        }
    }
}
