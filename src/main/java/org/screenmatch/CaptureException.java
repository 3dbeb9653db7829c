package org.screenmatch;

public class CaptureException extends ScreenMatchException {
    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
