package org.screenmatch;

public class ImageLoadException extends ScreenMatchException {
    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
