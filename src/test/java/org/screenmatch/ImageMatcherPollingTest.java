package org.screenmatch;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

public class ImageMatcherPollingTest {
    private static Pattern button;
    private final ImageMatcher matcher = new ImageMatcher().withScanInterval(10);

    @BeforeAll
    static void loadOpenCv() {
        OpenCvLoader.load();
        button = Pattern.fromImage(TestImages.button()).named("button");
    }

    private static Mat withButton() {
        return TestImages.screenWith(TestImages.button(), 70, 50);
    }

    private static long millisSince(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }

    @Test
    void testWaitReturnsOnceThePatternAppears() {
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen(), TestImages.emptyScreen(), withButton());
        Match match = matcher.wait(screen, button, 5.0);
        assertEquals(new Region(70, 50, 40, 20), match.getRegion());
        assertEquals(3, screen.getCaptureCount());
    }

    @Test
    void testWaitFailsAfterTimeout() {
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen());
        long start = System.nanoTime();
        FindFailedException e = assertThrows(FindFailedException.class, () -> matcher.wait(screen, button, 0.2));
        assertTrue(millisSince(start) >= 200);
        assertEquals("button", e.getPatternName());
        assertEquals(0.2, e.getTimeoutSecs());
        assertTrue(e.getMessage().contains("button"));
        assertTrue(screen.getCaptureCount() > 1);
    }

    @Test
    void testWaitInRegionReportsScreenCoordinates() {
        ScriptedScreen screen = new ScriptedScreen(withButton());
        Match match = matcher.waitIn(screen, new Region(50, 40, 100, 80), button, 1.0);
        assertEquals(new Region(70, 50, 40, 20), match.getRegion());
    }

    @Test
    void testExistsWithZeroTimeoutSearchesOnce() {
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen(), withButton());
        assertEquals(Optional.empty(), matcher.exists(screen, button, 0));
        assertEquals(1, screen.getCaptureCount());
    }

    @Test
    void testExistsFindsPattern() {
        ScriptedScreen screen = new ScriptedScreen(withButton());
        assertEquals(new Region(70, 50, 40, 20), matcher.exists(screen, button, 0).orElseThrow().getRegion());
        assertTrue(matcher.existsIn(screen, new Region(60, 45, 60, 30), button, 0).isPresent());
        assertFalse(matcher.existsIn(screen, new Region(0, 0, 60, 40), button, 0).isPresent());
    }

    @Test
    void testExistsKeepsPollingUntilTimeout() {
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen(), TestImages.emptyScreen(), withButton());
        assertTrue(matcher.exists(screen, button, 5.0).isPresent());
        assertEquals(3, screen.getCaptureCount());
    }

    @Test
    void testWaitVanishReturnsTrueOnceGone() {
        ScriptedScreen screen = new ScriptedScreen(withButton(), withButton(), TestImages.emptyScreen());
        assertTrue(matcher.waitVanish(screen, button, 5.0));
        assertEquals(3, screen.getCaptureCount());
    }

    @Test
    void testWaitVanishReturnsFalseWhileStillVisible() {
        ScriptedScreen screen = new ScriptedScreen(withButton());
        long start = System.nanoTime();
        assertFalse(matcher.waitVanish(screen, button, 0.1));
        assertTrue(millisSince(start) >= 100);
    }

    @Test
    void testWaitVanishInRegion() {
        ScriptedScreen screen = new ScriptedScreen(withButton());
        assertTrue(matcher.waitVanishIn(screen, new Region(0, 0, 60, 40), button, 0));
        assertFalse(matcher.waitVanishIn(screen, new Region(60, 40, 60, 40), button, 0));
    }

    @Test
    void testOnChangeDetectsChange() {
        Mat changed = TestImages.emptyScreen();
        TestImages.fill(changed, 0, 0, 100, 150, TestImages.WHITE);
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen(), TestImages.emptyScreen(), changed);

        assertTrue(matcher.onChange(screen, new Region(0, 0, 200, 150), 5.0, 40.0));
        assertEquals(3, screen.getCaptureCount());
    }

    @Test
    void testOnChangeIgnoresSmallChanges() {
        Mat changed = TestImages.emptyScreen();
        TestImages.fill(changed, 0, 0, 10, 10, TestImages.WHITE);
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen(), changed);

        long start = System.nanoTime();
        assertFalse(matcher.onChange(screen, new Region(0, 0, 200, 150), 0.1, 10.0));
        assertTrue(millisSince(start) >= 100);
    }

    @Test
    void testOnChangeOnlyLooksAtItsRegion() {
        Mat changed = TestImages.emptyScreen();
        TestImages.fill(changed, 100, 0, 100, 150, TestImages.WHITE);
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen(), changed);
        assertFalse(matcher.onChange(screen, new Region(0, 0, 100, 150), 0.05, 1.0));
    }

    @Test
    void testCancelledTokenWinsOverVisiblePattern() {
        ScriptedScreen screen = new ScriptedScreen(withButton());
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(CancelledException.class, () -> matcher.wait(screen, button, 5.0, token));
        assertThrows(CancelledException.class, () -> matcher.exists(screen, button, 0, token));
        assertThrows(CancelledException.class, () -> matcher.waitVanish(screen, button, 5.0, token));
        assertEquals(0, screen.getCaptureCount());
    }

    @Test
    void testCancelStopsRunningWait() {
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen());
        CancellationToken token = new CancellationToken();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(token::cancel, 100, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();
            CancelledException e = assertThrows(CancelledException.class, () -> matcher.wait(screen, button, 30.0, token));
            assertTrue(millisSince(start) < 5000);
            assertTrue(e.getOperation().contains("button"));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void testCancelStopsOnChange() {
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen());
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertThrows(CancelledException.class,
            () -> matcher.onChange(screen, new Region(0, 0, 50, 50), 5.0, 10.0, token));
    }

    @Test
    void testCaptureFailurePropagates() {
        CaptureException failure = new CaptureException("display gone");
        ScriptedScreen screen = new ScriptedScreen(failure);
        assertSame(failure, assertThrows(CaptureException.class, () -> matcher.wait(screen, button, 1.0)));
        assertSame(failure, assertThrows(CaptureException.class, () -> matcher.exists(screen, button, 0)));
    }

    @Test
    void testUndecodablePatternPropagates() {
        ScriptedScreen screen = new ScriptedScreen(TestImages.emptyScreen());
        assertThrows(ImageLoadException.class, () -> matcher.exists(screen, new Pattern(new byte[]{7, 7, 7}), 1.0));
    }

    @Test
    void testPartiallyCapturedRegionIsACaptureFailure() {
        ClampingScreen screen = new ClampingScreen(withButton());
        Region leftOfScreen = new Region(-50, 0, 200, 100);
        assertThrows(CaptureException.class, () -> matcher.waitIn(screen, leftOfScreen, button, 1.0));
        assertThrows(CaptureException.class, () -> matcher.existsIn(screen, leftOfScreen, button, 0));
        assertThrows(CaptureException.class, () -> matcher.onChange(screen, leftOfScreen, 1.0, 10.0));
    }

    @Test
    void testRegionInsideScreenIsUnaffectedByClamping() {
        ClampingScreen screen = new ClampingScreen(withButton());
        Match match = matcher.waitIn(screen, new Region(50, 40, 100, 80), button, 1.0);
        assertEquals(new Region(70, 50, 40, 20), match.getRegion());
    }

    @Test
    void testOverloadsWithoutTimeoutUseConfiguredDefaults() {
        ImageMatcher configured = matcher.withTimeouts(new DefaultTimeouts()
            .withWait(Duration.ofMillis(100))
            .withVanish(Duration.ofMillis(100)));

        FindFailedException e = assertThrows(FindFailedException.class,
            () -> configured.wait(new ScriptedScreen(TestImages.emptyScreen()), button));
        assertEquals(0.1, e.getTimeoutSecs(), 1e-9);

        assertFalse(configured.waitVanish(new ScriptedScreen(withButton()), button));

        ScriptedScreen once = new ScriptedScreen(TestImages.emptyScreen(), withButton());
        assertEquals(Optional.empty(), configured.exists(once, button));
        assertEquals(1, once.getCaptureCount());
    }
}
