package com.tnpds.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Small helpers shared by the services.
 *
 * @author PDS Scraper Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Replaces each character that is unsafe in a file name, and each whitespace, with an underscore.
     * @param name input name
     * @return sanitized name, empty for {@code null}
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/\\\\:\\s]", "_");
    }

    /**
     * Sleeps for {@code pause}. An interrupt cuts the pause short and stays set on the thread.
     */
    public static void pause(Duration pause) {
        if (pause == null || pause.isZero() || pause.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            logger.warn("Pause interrupted after less than {}ms", pause.toMillis());
            Thread.currentThread().interrupt();
        }
    }
}
