package org.screenmatch;

import java.awt.AWTException;
import java.awt.Dimension;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;

/**
 * {@link ScreenCapture} of the primary display through {@link Robot}.
 */
public class RobotScreenCapture implements ScreenCapture {
    private static final Logger l = LogManager.getLogger(RobotScreenCapture.class);

    private final Robot robot;

    public RobotScreenCapture() {
        try {
            this.robot = new Robot();
        } catch (AWTException e) {
            throw new CaptureException("Failed to initialize screen capture", e);
        }
    }

    @Override
    public Mat capture() {
        return grab(getScreenBounds());
    }

    /** The region has to lie completely on the screen; the image returned has exactly its size. */
    @Override
    public Mat captureRegion(Region region) {
        Rectangle bounds = getScreenBounds();
        Rectangle requested = new Rectangle(region.getX(), region.getY(), region.getWidth(), region.getHeight());
        if (region.isEmpty() || !bounds.contains(requested)) {
            throw new CaptureException(region + " is not within the screen " + bounds);
        }
        return grab(requested);
    }

    private Mat grab(Rectangle rect) {
        l.debug("Capturing {}", rect);
        try {
            return Images.toMat(robot.createScreenCapture(rect));
        } catch (RuntimeException e) {
            throw new CaptureException("Screen capture of " + rect + " failed", e);
        }
    }

    private Rectangle getScreenBounds() {
        Rectangle bounds = GraphicsEnvironment.getLocalGraphicsEnvironment()
            .getDefaultScreenDevice()
            .getDefaultConfiguration()
            .getBounds();
        if (bounds == null || bounds.width <= 0 || bounds.height <= 0) {
            Dimension d = Toolkit.getDefaultToolkit().getScreenSize();
            bounds = new Rectangle(0, 0, d.width, d.height);
        }
        return bounds;
    }
}
