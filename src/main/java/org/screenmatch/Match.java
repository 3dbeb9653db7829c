package org.screenmatch;

import java.awt.Point;
import java.util.Locale;
import java.util.Objects;

/**
 * A location where a pattern was found, with its correlation score.
 */
public final class Match {
    private final Region region;
    private final double score;

    public Match(Region region, double score) {
        this.region = Objects.requireNonNull(region, "region");
        this.score = score;
    }

    public Region getRegion() {
        return region;
    }

    public double getScore() {
        return score;
    }

    public int getX() {
        return region.getX();
    }

    public int getY() {
        return region.getY();
    }

    public Point getCenter() {
        return region.getCenter();
    }

    public Point getTarget() {
        return region.getCenter();
    }

    /** Center shifted by the target offset of the pattern that produced this match. */
    public Point getTarget(Pattern pattern) {
        Point center = region.getCenter();
        Point offset = pattern.getTargetOffset();
        return new Point(center.x + offset.x, center.y + offset.y);
    }

    public boolean isGoodMatch(double threshold) {
        return score >= threshold;
    }

    public String getScorePercent() {
        return String.format(Locale.ROOT, "%.1f%%", score * 100.0);
    }

    public Match offset(int dx, int dy) {
        return new Match(region.offset(dx, dy), score);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        Match match = (Match) o;
        return Double.compare(match.score, score) == 0 && region.equals(match.region);
    }

    @Override
    public int hashCode() {
        return Objects.hash(region, score);
    }

    @Override
    public String toString() {
        return "Match(" + region + ", score " + getScorePercent() + ")";
    }
}
