package org.screenmatch;

import java.util.concurrent.atomic.AtomicBoolean;
import nu.pattern.OpenCV;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads the bundled OpenCV native library once per JVM.
 */
public final class OpenCvLoader {
    private static final Logger l = LogManager.getLogger(OpenCvLoader.class);
    private static final AtomicBoolean loaded = new AtomicBoolean(false);

    private OpenCvLoader() {
    }

    public static void load() {
        if (loaded.get()) {
            return;
        }
        synchronized (OpenCvLoader.class) {
            if (!loaded.get()) {
                l.debug("Loading OpenCV");
                OpenCV.loadLocally();
                loaded.set(true);
            }
        }
    }
}
