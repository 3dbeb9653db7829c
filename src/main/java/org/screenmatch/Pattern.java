package org.screenmatch;

import java.awt.Point;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import org.apache.commons.io.FileUtils;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;

/**
 * The image to search for, kept in its encoded form (PNG, JPEG, ...) together with the similarity it needs to
 * reach and a click target offset relative to the match center.
 * <p>
 * Instances are immutable; {@link #similar(double)}, {@link #targetOffset(int, int)} and {@link #named(String)}
 * return updated copies.
 */
public final class Pattern {
    public static final double DEFAULT_SIMILARITY = 0.7;

    private final byte[] imageData;
    private final double similarity;
    private final Point targetOffset;
    private final String name;

    public Pattern(byte[] imageData) {
        this(imageData.clone(), DEFAULT_SIMILARITY, new Point(0, 0), "pattern");
    }

    private Pattern(byte[] imageData, double similarity, Point targetOffset, String name) {
        this.imageData = imageData;
        this.similarity = similarity;
        this.targetOffset = targetOffset;
        this.name = name;
    }

    public static Pattern fromFile(Path file) throws IOException {
        byte[] bytes = FileUtils.readFileToByteArray(file.toFile());
        return new Pattern(bytes, DEFAULT_SIMILARITY, new Point(0, 0), file.getFileName().toString());
    }

    /** Encodes the image as PNG. */
    public static Pattern fromImage(Mat image) {
        OpenCvLoader.load();
        MatOfByte buffer = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(".png", image, buffer)) {
                throw new ImageLoadException("Failed to encode " + image + " as PNG");
            }
            return new Pattern(buffer.toArray(), DEFAULT_SIMILARITY, new Point(0, 0), "image");
        } finally {
            buffer.release();
        }
    }

    public Pattern similar(double similarity) {
        return new Pattern(imageData, Math.max(0.0, Math.min(1.0, similarity)), targetOffset, name);
    }

    public Pattern targetOffset(int x, int y) {
        return new Pattern(imageData, similarity, new Point(x, y), name);
    }

    public Pattern named(String name) {
        return new Pattern(imageData, similarity, targetOffset, name);
    }

    public byte[] getImageData() {
        return imageData.clone();
    }

    // shared with the decoder, never handed out
    byte[] imageDataUnsafe() {
        return imageData;
    }

    public double getSimilarity() {
        return similarity;
    }

    public Point getTargetOffset() {
        return new Point(targetOffset);
    }

    public String getName() {
        return name;
    }

    public boolean isValid() {
        return imageData.length > 0;
    }

    public int dataSize() {
        return imageData.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pattern)) return false;
        Pattern pattern = (Pattern) o;
        return Double.compare(pattern.similarity, similarity) == 0
               && Arrays.equals(imageData, pattern.imageData)
               && targetOffset.equals(pattern.targetOffset)
               && name.equals(pattern.name);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(imageData) + Double.hashCode(similarity);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Pattern(%s, %d bytes, similarity %.2f, offset %d,%d)",
            name, imageData.length, similarity, targetOffset.x, targetOffset.y);
    }
}
