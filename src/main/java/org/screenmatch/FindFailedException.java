package org.screenmatch;

import java.util.Locale;

/**
 * A pattern (or condition) did not show up before the deadline.
 */
public class FindFailedException extends ScreenMatchException {
    private final String patternName;
    private final double timeoutSecs;

    public FindFailedException(String patternName, double timeoutSecs) {
        super(String.format(Locale.ROOT, "FindFailed: %s not found within %.2fs", patternName, timeoutSecs));
        this.patternName = patternName;
        this.timeoutSecs = timeoutSecs;
    }

    public String getPatternName() {
        return patternName;
    }

    public double getTimeoutSecs() {
        return timeoutSecs;
    }
}
