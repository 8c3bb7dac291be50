package net.upcscan.util.image;

import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the bundled OpenCV native library once per JVM.
 */
public final class OpenCvLoader {

    private static final Logger logger = LoggerFactory.getLogger(OpenCvLoader.class);

    private static volatile boolean loaded;

    private OpenCvLoader() {
    }

    /**
     * Extracts and loads the platform native library shipped with the OpenCV jar.
     * Safe to call repeatedly.
     *
     * @throws IllegalStateException when no native build exists for this platform
     */
    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvLoader.class) {
            if (loaded) {
                return;
            }
            try {
                OpenCV.loadLocally();
            } catch (RuntimeException | LinkageError e) {
                logger.error("Failed to load OpenCV native library: {}", e.getMessage(), e);
                throw new IllegalStateException("OpenCV native library unavailable on this platform", e);
            }
            loaded = true;
            logger.info("OpenCV native library loaded (version {}).", Core.VERSION);
        }
    }
}
