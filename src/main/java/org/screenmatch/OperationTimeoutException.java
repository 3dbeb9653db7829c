package org.screenmatch;

import java.util.Locale;

public class OperationTimeoutException extends ScreenMatchException {
    private final String operation;
    private final double timeoutSecs;

    public OperationTimeoutException(String operation, double timeoutSecs) {
        super(String.format(Locale.ROOT, "Operation timed out after %.2fs: %s", timeoutSecs, operation));
        this.operation = operation;
        this.timeoutSecs = timeoutSecs;
    }

    public String getOperation() {
        return operation;
    }

    public double getTimeoutSecs() {
        return timeoutSecs;
    }
}
