package org.screenmatch;

import java.time.Duration;

/**
 * Timeouts for the polling operations of {@link ImageMatcher} when no explicit one is given.
 * Immutable; the {@code with...} methods return copies.
 */
public final class DefaultTimeouts {
    private final Duration waitTimeout;
    private final Duration exists;
    private final Duration vanish;

    public DefaultTimeouts() {
        this(Duration.ofSeconds(3), Duration.ZERO, Duration.ofSeconds(3));
    }

    private DefaultTimeouts(Duration waitTimeout, Duration exists, Duration vanish) {
        this.waitTimeout = waitTimeout;
        this.exists = exists;
        this.vanish = vanish;
    }

    public Duration getWait() {
        return waitTimeout;
    }

    /** Zero means a single capture and search. */
    public Duration getExists() {
        return exists;
    }

    public Duration getVanish() {
        return vanish;
    }

    public DefaultTimeouts withWait(Duration duration) {
        return new DefaultTimeouts(duration, exists, vanish);
    }

    public DefaultTimeouts withExists(Duration duration) {
        return new DefaultTimeouts(waitTimeout, duration, vanish);
    }

    public DefaultTimeouts withVanish(Duration duration) {
        return new DefaultTimeouts(waitTimeout, exists, duration);
    }

    @Override
    public String toString() {
        return "DefaultTimeouts(wait " + waitTimeout + ", exists " + exists + ", vanish " + vanish + ")";
    }
}
