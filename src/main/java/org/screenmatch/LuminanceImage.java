package org.screenmatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * Single-channel 8-bit luminance raster, row-major, values 0..255.
 * Matching and difference measures operate on this instead of on {@link Mat} directly so the hot loops run over
 * plain Java arrays.
 */
public final class LuminanceImage {
    private static final Logger l = LogManager.getLogger(LuminanceImage.class);

    private final int width;
    private final int height;
    private final int[] pixels;

    public LuminanceImage(int width, int height, int[] pixels) {
        if (width < 0 || height < 0 || pixels.length != width * height) {
            throw new IllegalArgumentException(String.format("%d pixels do not fit %dx%d", pixels.length, width, height));
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /** Converts a BGR, BGRA or grayscale 8-bit image. */
    public static LuminanceImage of(Mat image) {
        OpenCvLoader.load();
        int width = image.cols();
        int height = image.rows();
        if (image.empty()) {
            return new LuminanceImage(width, height, new int[width * height]);
        }

        Mat gray;
        switch (image.channels()) {
            case 1 -> gray = image.isContinuous() ? image : image.clone();
            case 3 -> {
                gray = new Mat();
                Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
            }
            case 4 -> {
                gray = new Mat();
                Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
            }
            default -> throw new ImageLoadException("Unsupported channel count " + image.channels() + " for " + image);
        }

        byte[] raw = new byte[width * height];
        gray.get(0, 0, raw);
        if (gray != image) {
            gray.release();
        }
        int[] pixels = new int[raw.length];
        for (int i = 0; i < raw.length; i++) {
            pixels[i] = raw[i] & 0xFF;
        }
        return new LuminanceImage(width, height, pixels);
    }

    /** Decodes an encoded image (any format OpenCV's imgcodecs reads) straight to grayscale. */
    public static LuminanceImage decode(byte[] encoded) {
        OpenCvLoader.load();
        if (encoded.length == 0) {
            throw new ImageLoadException("Cannot decode an empty image buffer");
        }
        MatOfByte buffer = new MatOfByte(encoded);
        Mat decoded = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_GRAYSCALE);
        try {
            if (decoded.empty()) {
                throw new ImageLoadException("Failed to decode image of " + encoded.length + " bytes");
            }
            l.debug("Decoded {} bytes into {}x{} luminance", encoded.length, decoded.cols(), decoded.rows());
            return of(decoded);
        } finally {
            decoded.release();
            buffer.release();
        }
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int get(int x, int y) {
        return pixels[y * width + x];
    }

    // direct access for the correlation loops
    int[] pixels() {
        return pixels;
    }

    @Override
    public String toString() {
        return "LuminanceImage(" + width + "x" + height + ")";
    }
}
