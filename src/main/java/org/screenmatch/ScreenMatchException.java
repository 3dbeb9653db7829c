package org.screenmatch;

/**
 * Base class of everything this library throws on its own account.
 */
public class ScreenMatchException extends RuntimeException {
    public ScreenMatchException(String message) {
        super(message);
    }

    public ScreenMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
