package org.screenmatch;

import java.time.Duration;

/**
 * Deadline for a hand-written polling loop.
 * <pre>
 *   TimeoutGuard guard = new TimeoutGuard(Duration.ofSeconds(5));
 *   while (!guard.isExpired()) {
 *       ...
 *   }
 * </pre>
 */
public class TimeoutGuard {
    private final Duration timeout;
    private long start;

    public TimeoutGuard(Duration timeout) {
        this.timeout = timeout;
        this.start = System.nanoTime();
    }

    public boolean isExpired() {
        return elapsed().compareTo(timeout) >= 0;
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    public Duration remaining() {
        Duration remaining = timeout.minus(elapsed());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public void reset() {
        start = System.nanoTime();
    }

    /**
     * @throws FindFailedException naming the operation once the deadline has passed
     */
    public void check(String operation) {
        if (isExpired()) {
            throw new FindFailedException(operation, timeout.toMillis() / 1000.0);
        }
    }
}
