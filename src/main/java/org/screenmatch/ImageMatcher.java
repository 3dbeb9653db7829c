package org.screenmatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;

/**
 * Template matching by normalized cross-correlation, plus the polling operations built on top of it.
 * <p>
 * Searching slides the pattern over every valid offset of the screen image. Rows of offsets are scanned in
 * parallel, each row reducing to its own best candidate (or its own candidate list for {@link #findAll}), and the
 * per-row results are combined afterwards, so no mutable state is shared between workers.
 * <p>
 * The polling operations ({@code wait}, {@code exists}, {@code waitVanish}, {@code onChange}) capture, search and
 * sleep for {@link #getScanInterval()} milliseconds until they succeed or the timeout has elapsed. Their
 * cancellable variants check a {@link CancellationToken} before every capture; a set token wins over both success
 * and timeout.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public class ImageMatcher {
    private static final Logger l = LogManager.getLogger(ImageMatcher.class);

    public static final double DEFAULT_MIN_SIMILARITY = 0.7;
    public static final long DEFAULT_SCAN_INTERVAL_MS = 50;
    public static final long MIN_SCAN_INTERVAL_MS = 10;

    private final double minSimilarity;
    private final long scanIntervalMs;
    private final DefaultTimeouts timeouts;

    public ImageMatcher() {
        this(DEFAULT_MIN_SIMILARITY, DEFAULT_SCAN_INTERVAL_MS, new DefaultTimeouts());
    }

    private ImageMatcher(double minSimilarity, long scanIntervalMs, DefaultTimeouts timeouts) {
        this.minSimilarity = minSimilarity;
        this.scanIntervalMs = scanIntervalMs;
        this.timeouts = timeouts;
    }

    /** Lower bound for the similarity a match needs; the pattern's own similarity applies when it is higher. */
    public ImageMatcher withMinSimilarity(double similarity) {
        return new ImageMatcher(Math.max(0.0, Math.min(1.0, similarity)), scanIntervalMs, timeouts);
    }

    public ImageMatcher withScanInterval(long intervalMs) {
        return new ImageMatcher(minSimilarity, Math.max(MIN_SCAN_INTERVAL_MS, intervalMs), timeouts);
    }

    /** Timeouts used by the {@code wait}, {@code exists} and {@code waitVanish} overloads without one. */
    public ImageMatcher withTimeouts(DefaultTimeouts timeouts) {
        return new ImageMatcher(minSimilarity, scanIntervalMs, timeouts);
    }

    public DefaultTimeouts getTimeouts() {
        return timeouts;
    }

    public double getMinSimilarity() {
        return minSimilarity;
    }

    public long getScanInterval() {
        return scanIntervalMs;
    }

    // ---- searching ----

    public Optional<Match> find(Mat screen, Pattern pattern) {
        return find(LuminanceImage.of(screen), pattern);
    }

    /**
     * Best match of the pattern, if it reaches {@code max(pattern similarity, min similarity)}.
     * A pattern larger than the screen is simply not found.
     *
     * @throws ImageLoadException if the pattern bytes cannot be decoded
     */
    public Optional<Match> find(LuminanceImage screen, Pattern pattern) {
        TemplateStatistics stats = TemplateStatistics.precompute(pattern);
        double threshold = effectiveThreshold(pattern);
        int maxX = screen.getWidth() - stats.getWidth();
        int maxY = screen.getHeight() - stats.getHeight();
        if (maxX < 0 || maxY < 0 || stats.getWidth() == 0 || stats.getHeight() == 0) {
            l.debug("{} ({}x{}) does not fit into {}", pattern.getName(), stats.getWidth(), stats.getHeight(), screen);
            return Optional.empty();
        }

        Optional<RowBest> best = IntStream.rangeClosed(0, maxY)
            .parallel()
            .mapToObj(y -> bestInRow(screen, stats, y, maxX))
            .reduce(ImageMatcher::better);

        RowBest winner = best.orElseThrow();
        l.debug("Best score for {} is {} at ({}, {}), threshold {}", pattern.getName(), winner.score, winner.x, winner.y, threshold);
        if (winner.score >= threshold) {
            return Optional.of(new Match(new Region(winner.x, winner.y, stats.getWidth(), stats.getHeight()), winner.score));
        }
        return Optional.empty();
    }

    public List<Match> findAll(Mat screen, Pattern pattern) {
        return findAll(LuminanceImage.of(screen), pattern);
    }

    /**
     * Every location reaching the threshold, with overlapping detections collapsed by non-maximum suppression.
     * Sorted by descending score.
     *
     * @throws ImageLoadException if the pattern bytes cannot be decoded
     */
    public List<Match> findAll(LuminanceImage screen, Pattern pattern) {
        TemplateStatistics stats = TemplateStatistics.precompute(pattern);
        double threshold = effectiveThreshold(pattern);
        int maxX = screen.getWidth() - stats.getWidth();
        int maxY = screen.getHeight() - stats.getHeight();
        if (maxX < 0 || maxY < 0 || stats.getWidth() == 0 || stats.getHeight() == 0) {
            return new ArrayList<>();
        }

        List<Match> candidates = IntStream.rangeClosed(0, maxY)
            .parallel()
            .mapToObj(y -> matchesInRow(screen, stats, y, maxX, threshold))
            .flatMap(List::stream)
            .collect(Collectors.toList());

        List<Match> matches = NonMaximumSuppression.suppress(candidates);
        l.debug("{} candidates for {} above {}, {} after suppression", candidates.size(), pattern.getName(), threshold, matches.size());
        return matches;
    }

    private double effectiveThreshold(Pattern pattern) {
        return Math.max(pattern.getSimilarity(), minSimilarity);
    }

    private static RowBest bestInRow(LuminanceImage screen, TemplateStatistics stats, int y, int maxX) {
        double bestScore = -1.0;
        int bestX = 0;
        for (int x = 0; x <= maxX; x++) {
            double score = Correlation.score(screen, stats, x, y);
            if (score > bestScore) {
                bestScore = score;
                bestX = x;
            }
        }
        return new RowBest(bestScore, bestX, y);
    }

    private static List<Match> matchesInRow(LuminanceImage screen, TemplateStatistics stats, int y, int maxX, double threshold) {
        List<Match> row = new ArrayList<>();
        for (int x = 0; x <= maxX; x++) {
            double score = Correlation.score(screen, stats, x, y);
            if (score >= threshold) {
                row.add(new Match(new Region(x, y, stats.getWidth(), stats.getHeight()), score));
            }
        }
        return row;
    }

    // ties keep the earlier row
    private static RowBest better(RowBest a, RowBest b) {
        return b.score > a.score ? b : a;
    }

    private static final class RowBest {
        final double score;
        final int x;
        final int y;

        RowBest(double score, int x, int y) {
            this.score = score;
            this.x = x;
            this.y = y;
        }
    }

    // ---- waiting for a pattern to appear ----

    /**
     * Polls the whole screen until the pattern shows up.
     *
     * @throws FindFailedException if it does not within {@code timeoutSecs}
     */
    public Match wait(ScreenCapture screen, Pattern pattern) {
        return waitFor(screen, null, pattern, seconds(timeouts.getWait()), null);
    }

    public Match wait(ScreenCapture screen, Pattern pattern, double timeoutSecs) {
        return waitFor(screen, null, pattern, timeoutSecs, null);
    }

    public Match wait(ScreenCapture screen, Pattern pattern, double timeoutSecs, CancellationToken token) {
        return waitFor(screen, null, pattern, timeoutSecs, token);
    }

    /** Like {@link #wait(ScreenCapture, Pattern, double)} restricted to a region; the match is in screen coordinates. */
    public Match waitIn(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs) {
        return waitFor(screen, region, pattern, timeoutSecs, null);
    }

    public Match waitIn(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs, CancellationToken token) {
        return waitFor(screen, region, pattern, timeoutSecs, token);
    }

    private Match waitFor(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs, CancellationToken token) {
        String operation = "wait " + pattern.getName();
        return poll(operation, timeoutSecs, token, () -> findOnScreen(screen, region, pattern))
            .orElseThrow(() -> {
                l.warn("{} not found within {}s", pattern.getName(), timeoutSecs);
                return new FindFailedException(pattern.getName(), timeoutSecs);
            });
    }

    // ---- checking whether a pattern is there ----

    /**
     * Like {@code wait}, but answers with an empty result instead of failing. A timeout of zero makes exactly one
     * capture and search.
     */
    public Optional<Match> exists(ScreenCapture screen, Pattern pattern) {
        return exists(screen, pattern, seconds(timeouts.getExists()));
    }

    public Optional<Match> exists(ScreenCapture screen, Pattern pattern, double timeoutSecs) {
        return poll("exists " + pattern.getName(), timeoutSecs, null, () -> findOnScreen(screen, null, pattern));
    }

    public Optional<Match> exists(ScreenCapture screen, Pattern pattern, double timeoutSecs, CancellationToken token) {
        return poll("exists " + pattern.getName(), timeoutSecs, token, () -> findOnScreen(screen, null, pattern));
    }

    public Optional<Match> existsIn(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs) {
        return poll("exists " + pattern.getName(), timeoutSecs, null, () -> findOnScreen(screen, region, pattern));
    }

    public Optional<Match> existsIn(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs, CancellationToken token) {
        return poll("exists " + pattern.getName(), timeoutSecs, token, () -> findOnScreen(screen, region, pattern));
    }

    // ---- waiting for a pattern to go away ----

    /**
     * @return true as soon as the pattern is not found, false if it was still there when the timeout elapsed
     */
    public boolean waitVanish(ScreenCapture screen, Pattern pattern) {
        return vanish(screen, null, pattern, seconds(timeouts.getVanish()), null);
    }

    public boolean waitVanish(ScreenCapture screen, Pattern pattern, double timeoutSecs) {
        return vanish(screen, null, pattern, timeoutSecs, null);
    }

    public boolean waitVanish(ScreenCapture screen, Pattern pattern, double timeoutSecs, CancellationToken token) {
        return vanish(screen, null, pattern, timeoutSecs, token);
    }

    public boolean waitVanishIn(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs) {
        return vanish(screen, region, pattern, timeoutSecs, null);
    }

    public boolean waitVanishIn(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs, CancellationToken token) {
        return vanish(screen, region, pattern, timeoutSecs, token);
    }

    private boolean vanish(ScreenCapture screen, Region region, Pattern pattern, double timeoutSecs, CancellationToken token) {
        Supplier<Optional<Boolean>> gone = () -> findOnScreen(screen, region, pattern).isPresent()
            ? Optional.empty()
            : Optional.of(Boolean.TRUE);
        boolean vanished = poll("waitVanish " + pattern.getName(), timeoutSecs, token, gone).isPresent();
        if (!vanished) {
            l.debug("{} still visible after {}s", pattern.getName(), timeoutSecs);
        }
        return vanished;
    }

    // ---- waiting for the region to change ----

    /**
     * Takes a reference snapshot of the region, then keeps comparing fresh snapshots against it.
     *
     * @param minChangePercent share of pixels (0..100) whose luminance must have moved by more than
     *                         {@link ImageDifference#PIXEL_THRESHOLD}
     * @return true once the change is reached, false if the timeout elapsed first
     */
    public boolean onChange(ScreenCapture screen, Region region, double timeoutSecs, double minChangePercent) {
        return onChange(screen, region, timeoutSecs, minChangePercent, null);
    }

    public boolean onChange(ScreenCapture screen, Region region, double timeoutSecs, double minChangePercent, CancellationToken token) {
        String operation = "onChange " + region;
        TimeoutGuard guard = new TimeoutGuard(toDuration(timeoutSecs));
        LuminanceImage reference = captureLuminance(screen, region);

        while (true) {
            if (token != null) {
                token.throwIfCancelled(operation);
            }
            sleep(operation);
            double percent = ImageDifference.changedPercent(reference, captureLuminance(screen, region));
            l.debug("{} changed {}%", region, percent);
            if (percent >= minChangePercent) {
                return true;
            }
            if (guard.isExpired()) {
                l.debug("{} did not change by {}% within {}s", region, minChangePercent, timeoutSecs);
                return false;
            }
        }
    }

    // ---- polling plumbing ----

    private <T> Optional<T> poll(String operation, double timeoutSecs, CancellationToken token, Supplier<Optional<T>> attempt) {
        TimeoutGuard guard = new TimeoutGuard(toDuration(timeoutSecs));
        int attempts = 0;
        while (true) {
            if (token != null && token.isCancelled()) {
                l.warn("{} cancelled after {} attempts", operation, attempts);
                throw new CancelledException(operation);
            }
            attempts++;
            Optional<T> result = attempt.get();
            if (result.isPresent()) {
                l.debug("{} succeeded after {} attempts", operation, attempts);
                return result;
            }
            if (guard.isExpired()) {
                return Optional.empty();
            }
            sleep(operation);
        }
    }

    private Optional<Match> findOnScreen(ScreenCapture screen, Region region, Pattern pattern) {
        Optional<Match> match = find(captureLuminance(screen, region), pattern);
        if (region == null) {
            return match;
        }
        return match.map(m -> m.offset(region.getX(), region.getY()));
    }

    /**
     * Captures the region (or the whole screen for {@code null}) as luminance. Region captures must come back at
     * the region's size, otherwise local match coordinates could not be translated by the region origin.
     */
    static LuminanceImage captureLuminance(ScreenCapture screen, Region region) {
        Mat image = region == null ? screen.capture() : screen.captureRegion(region);
        try {
            if (region != null && (image.cols() != region.getWidth() || image.rows() != region.getHeight())) {
                throw new CaptureException(String.format("Capture of %s returned %dx%d",
                    region, image.cols(), image.rows()));
            }
            return LuminanceImage.of(image);
        } finally {
            image.release();
        }
    }

    private void sleep(String operation) {
        try {
            Thread.sleep(scanIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException(operation, e);
        }
    }

    private static Duration toDuration(double secs) {
        return Duration.ofNanos((long) (Math.max(0.0, secs) * 1_000_000_000L));
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        return "ImageMatcher(minSimilarity " + minSimilarity + ", scanInterval " + scanIntervalMs + "ms)";
    }
}
