package org.screenmatch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Watches a screen region and notifies handlers when a pattern appears, when a pattern vanishes, or when the
 * region's content changes.
 * <p>
 * Every iteration captures the region once and evaluates all handlers against that snapshot:
 * <ul>
 *   <li>appear handlers fire on every iteration in which their pattern is found;</li>
 *   <li>vanish handlers fire once when their pattern goes from found to not found;</li>
 *   <li>change handlers record a baseline on the first iteration and fire when a later snapshot differs from it
 *       by at least their threshold (see {@link ImageDifference#changedFraction}); the snapshot that fired becomes
 *       the new baseline.</li>
 * </ul>
 * Matches passed to appear handlers are in screen coordinates. A failed capture or a failing handler is logged and
 * the observation goes on.
 * <p>
 * Handlers should be registered before observation starts; registering while running is safe but takes effect on the
 * next iteration. Callbacks are invoked without any registry lock held, on the observing thread.
 * <pre>
 *   Observer observer = new Observer(new Region(0, 0, 800, 600), new RobotScreenCapture());
 *   observer.onAppear(button, m -&gt; l.info("Button at {}", m.getRegion()));
 *   CompletableFuture&lt;Void&gt; done = observer.observeInBackground();
 *   ...
 *   observer.stop();
 *   done.join();
 * </pre>
 */
public class Observer {
    private static final Logger l = LogManager.getLogger(Observer.class);

    public static final long DEFAULT_INTERVAL_MS = 500;
    public static final long MIN_INTERVAL_MS = 10;

    private final Region region;
    private final ScreenCapture screen;
    private final Object lifecycle = new Object();
    private Run currentRun; // guarded by lifecycle
    private volatile long intervalMs = DEFAULT_INTERVAL_MS;
    private volatile ImageMatcher matcher = new ImageMatcher();

    // each list is guarded by its own monitor
    private final List<AppearHandler> appearHandlers = new ArrayList<>();
    private final List<VanishHandler> vanishHandlers = new ArrayList<>();
    private final List<ChangeHandler> changeHandlers = new ArrayList<>();

    public Observer(Region region, ScreenCapture screen) {
        this.region = region;
        this.screen = screen;
    }

    public Region getRegion() {
        return region;
    }

    public long getInterval() {
        return intervalMs;
    }

    /** Pause between two iterations, at least {@value #MIN_INTERVAL_MS} ms. */
    public void setInterval(long intervalMs) {
        this.intervalMs = Math.max(MIN_INTERVAL_MS, intervalMs);
    }

    public double getMinSimilarity() {
        return matcher.getMinSimilarity();
    }

    public void setMinSimilarity(double similarity) {
        this.matcher = matcher.withMinSimilarity(similarity);
    }

    // ---- registration ----

    public void onAppear(Pattern pattern, Consumer<Match> callback) {
        synchronized (appearHandlers) {
            appearHandlers.add(new AppearHandler(pattern, callback));
        }
    }

    /** The pattern has to be seen at least once before its disappearance is reported. */
    public void onVanish(Pattern pattern, Runnable callback) {
        synchronized (vanishHandlers) {
            vanishHandlers.add(new VanishHandler(pattern, callback));
        }
    }

    /**
     * @param threshold fraction of changed pixels, clamped to [0, 1]
     * @param callback  receives the measured fraction
     */
    public void onChange(double threshold, DoubleConsumer callback) {
        synchronized (changeHandlers) {
            changeHandlers.add(new ChangeHandler(Math.max(0.0, Math.min(1.0, threshold)), callback));
        }
    }

    public int getAppearHandlerCount() {
        synchronized (appearHandlers) {
            return appearHandlers.size();
        }
    }

    public int getVanishHandlerCount() {
        synchronized (vanishHandlers) {
            return vanishHandlers.size();
        }
    }

    public int getChangeHandlerCount() {
        synchronized (changeHandlers) {
            return changeHandlers.size();
        }
    }

    // ---- lifecycle ----

    /**
     * Observes on the calling thread until {@link #stop()} is called or the timeout elapses.
     *
     * @param timeoutSecs zero or less observes until stopped
     * @throws IllegalStateException if this observer is already running
     */
    public void observe(double timeoutSecs) {
        Run run = start();
        l.info("Observer started for {}, timeout {}s", region, timeoutSecs);
        runLoop(run, timeoutSecs);
    }

    /**
     * Observes on a new daemon thread until {@link #stop()} is called. The observer reports as running as soon as
     * this method returns.
     *
     * @return completes once the background thread has finished
     * @throws IllegalStateException if this observer is already running
     */
    public CompletableFuture<Void> observeInBackground() {
        Run run = start();
        CompletableFuture<Void> done = new CompletableFuture<>();
        Thread worker = new Thread(() -> {
            l.info("Observer background thread started for {}", region);
            try {
                runLoop(run, 0);
                done.complete(null);
            } catch (Throwable t) {
                l.error("Observer for {} died", region, t);
                done.completeExceptionally(t);
            }
        }, "observer-" + region.getX() + "-" + region.getY());
        worker.setDaemon(true);
        worker.start();
        return done;
    }

    /**
     * Asks the current run to end; a sleeping loop wakes up immediately. Does nothing if not running.
     * A new run may be started right away, the stopped one finishes on its own.
     */
    public void stop() {
        synchronized (lifecycle) {
            if (currentRun != null) {
                l.debug("Observer stop requested");
                currentRun.requestStop();
            }
        }
    }

    public boolean isRunning() {
        synchronized (lifecycle) {
            return currentRun != null && currentRun.isLive();
        }
    }

    private Run start() {
        synchronized (lifecycle) {
            if (currentRun != null && currentRun.isLive()) {
                throw new IllegalStateException("Observer for " + region + " is already running");
            }
            currentRun = new Run();
            return currentRun;
        }
    }

    private void runLoop(Run run, double timeoutSecs) {
        TimeoutGuard guard = timeoutSecs > 0
            ? new TimeoutGuard(Duration.ofNanos((long) (timeoutSecs * 1_000_000_000L)))
            : null;
        try {
            while (run.isLive()) {
                if (guard != null && guard.isExpired()) {
                    l.debug("Observer timeout reached");
                    break;
                }
                observeOnce();
                try {
                    if (run.stopRequested.await(intervalMs, TimeUnit.MILLISECONDS)) {
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    l.debug("Observer interrupted");
                    break;
                }
            }
        } finally {
            run.active.set(false);
            l.info("Observer stopped for {}", region);
        }
    }

    // ---- one iteration ----

    void observeOnce() {
        LuminanceImage snapshot;
        try {
            snapshot = ImageMatcher.captureLuminance(screen, region);
        } catch (RuntimeException e) {
            l.error("Failed to capture {}: {}", region, e.getMessage(), e);
            return;
        }
        ImageMatcher currentMatcher = matcher;
        // callbacks run after the registries are unlocked
        List<Runnable> events = new ArrayList<>();
        collectAppear(currentMatcher, snapshot, events);
        collectVanish(currentMatcher, snapshot, events);
        collectChange(snapshot, events);
        for (Runnable event : events) {
            event.run();
        }
    }

    private void collectAppear(ImageMatcher currentMatcher, LuminanceImage snapshot, List<Runnable> events) {
        synchronized (appearHandlers) {
            for (AppearHandler handler : appearHandlers) {
                Optional<Match> found;
                try {
                    found = currentMatcher.find(snapshot, handler.pattern);
                } catch (ScreenMatchException e) {
                    l.warn("Appear detection error for {}: {}", handler.pattern.getName(), e.getMessage());
                    continue;
                }
                if (found.isPresent()) {
                    Match match = found.get().offset(region.getX(), region.getY());
                    l.debug("{} appeared at {}", handler.pattern.getName(), match);
                    events.add(() -> invoke("appear", handler.pattern, () -> handler.callback.accept(match)));
                }
            }
        }
    }

    private void collectVanish(ImageMatcher currentMatcher, LuminanceImage snapshot, List<Runnable> events) {
        synchronized (vanishHandlers) {
            for (VanishHandler handler : vanishHandlers) {
                boolean found;
                try {
                    found = currentMatcher.find(snapshot, handler.pattern).isPresent();
                } catch (ScreenMatchException e) {
                    l.warn("Vanish detection error for {}: {}", handler.pattern.getName(), e.getMessage());
                    continue;
                }
                if (found) {
                    handler.lastSeen = Instant.now();
                } else if (handler.lastSeen != null) {
                    l.debug("{} vanished, last seen {}", handler.pattern.getName(), handler.lastSeen);
                    handler.lastSeen = null;
                    events.add(() -> invoke("vanish", handler.pattern, handler.callback));
                }
            }
        }
    }

    private void collectChange(LuminanceImage snapshot, List<Runnable> events) {
        synchronized (changeHandlers) {
            for (ChangeHandler handler : changeHandlers) {
                if (handler.baseline == null) {
                    handler.baseline = snapshot;
                    continue;
                }
                double change = ImageDifference.changedFraction(handler.baseline, snapshot);
                if (change >= handler.threshold) {
                    l.debug("{} changed by {} (threshold {})", region, change, handler.threshold);
                    handler.baseline = snapshot;
                    events.add(() -> invoke("change", null, () -> handler.callback.accept(change)));
                }
            }
        }
    }

    private void invoke(String kind, Pattern pattern, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            l.warn("{} handler{} failed", kind, pattern == null ? "" : " for " + pattern.getName(), e);
        }
    }

    @Override
    public String toString() {
        return String.format("Observer(%s, interval %dms, appear %d, vanish %d, change %d)",
            region, intervalMs, getAppearHandlerCount(), getVanishHandlerCount(), getChangeHandlerCount());
    }

    private static final class AppearHandler {
        final Pattern pattern;
        final Consumer<Match> callback;

        AppearHandler(Pattern pattern, Consumer<Match> callback) {
            this.pattern = pattern;
            this.callback = callback;
        }
    }

    private static final class VanishHandler {
        final Pattern pattern;
        final Runnable callback;
        Instant lastSeen;

        VanishHandler(Pattern pattern, Runnable callback) {
            this.pattern = pattern;
            this.callback = callback;
        }
    }

    private static final class ChangeHandler {
        final double threshold;
        final DoubleConsumer callback;
        LuminanceImage baseline;

        ChangeHandler(double threshold, DoubleConsumer callback) {
            this.threshold = threshold;
            this.callback = callback;
        }
    }

    /** One observation run; a stopped run never becomes live again. */
    private static final class Run {
        final AtomicBoolean active = new AtomicBoolean(true);
        final CountDownLatch stopRequested = new CountDownLatch(1);

        void requestStop() {
            stopRequested.countDown();
        }

        boolean isLive() {
            return active.get() && stopRequested.getCount() > 0;
        }
    }
}
