package org.screenmatch;

import org.opencv.core.Mat;

/**
 * Source of screen images. Implementations return 8-bit BGR, BGRA or grayscale images owned by the caller.
 */
public interface ScreenCapture {

    /** Captures the whole primary display. */
    Mat capture() throws CaptureException;

    /**
     * Captures the given rectangle of the primary display. The image must have the region's size; a region that
     * cannot be captured completely is a {@link CaptureException}, never a silently smaller image.
     */
    Mat captureRegion(Region region) throws CaptureException;
}
