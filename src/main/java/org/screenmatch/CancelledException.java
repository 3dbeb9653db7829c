package org.screenmatch;

/**
 * A {@link CancellationToken} was observed set, or the polling thread was interrupted.
 */
public class CancelledException extends ScreenMatchException {
    private final String operation;

    public CancelledException(String operation) {
        super("Operation cancelled: " + operation);
        this.operation = operation;
    }

    public CancelledException(String operation, Throwable cause) {
        super("Operation cancelled: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
