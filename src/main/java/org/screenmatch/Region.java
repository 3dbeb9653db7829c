package org.screenmatch;

import java.awt.Point;
import java.util.Objects;
import java.util.Optional;
import org.opencv.core.Rect;

/**
 * A rectangular area of the screen. Origin may be negative (multi-monitor setups), width and height never are.
 * A zero-area region is a valid value.
 */
public final class Region {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public Region(int x, int y, int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(String.format("Region dimensions must not be negative: %dx%d", width, height));
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /** Builds a region spanning two opposite corners, given in any order. */
    public static Region fromCorners(int x1, int y1, int x2, int y2) {
        int minX = Math.min(x1, x2);
        int minY = Math.min(y1, y2);
        return new Region(minX, minY, Math.max(x1, x2) - minX, Math.max(y1, y2) - minY);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Point getCenter() {
        return new Point(x + width / 2, y + height / 2);
    }

    public Point getTopLeft() {
        return new Point(x, y);
    }

    public Point getBottomRight() {
        return new Point(x + width, y + height);
    }

    public long area() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /** Right and bottom edges are exclusive. */
    public boolean contains(int px, int py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }

    public boolean contains(Region other) {
        return other.x >= x && other.y >= y
               && other.x + other.width <= x + width
               && other.y + other.height <= y + height;
    }

    /** Regions that only touch along an edge do not intersect. */
    public boolean intersects(Region other) {
        return x < other.x + other.width
               && x + width > other.x
               && y < other.y + other.height
               && y + height > other.y;
    }

    public Optional<Region> intersection(Region other) {
        int x1 = Math.max(x, other.x);
        int y1 = Math.max(y, other.y);
        int x2 = Math.min(x + width, other.x + other.width);
        int y2 = Math.min(y + height, other.y + other.height);
        if (x1 < x2 && y1 < y2) {
            return Optional.of(new Region(x1, y1, x2 - x1, y2 - y1));
        }
        return Optional.empty();
    }

    /**
     * Intersection over union, 0.0 for disjoint or degenerate regions, 1.0 for identical ones.
     */
    public double overlap(Region other) {
        int x1 = Math.max(x, other.x);
        int y1 = Math.max(y, other.y);
        int x2 = Math.min(x + width, other.x + other.width);
        int y2 = Math.min(y + height, other.y + other.height);
        if (x1 >= x2 || y1 >= y2) {
            return 0.0;
        }
        double intersection = (double) (x2 - x1) * (y2 - y1);
        double union = area() + other.area() - intersection;
        return intersection / union;
    }

    public Region offset(int dx, int dy) {
        return new Region(x + dx, y + dy, width, height);
    }

    /** Grows (or shrinks, for a negative amount) the region on every side. */
    public Region expand(int amount) {
        return new Region(x - amount, y - amount,
            Math.max(0, width + 2 * amount),
            Math.max(0, height + 2 * amount));
    }

    public Rect toRect() {
        return new Rect(x, y, width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Region)) return false;
        Region region = (Region) o;
        return x == region.x && y == region.y && width == region.width && height == region.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("Region(%d, %d, %d, %d)", x, y, width, height);
    }
}
