package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves a screenshot and the rendered markup of a failed attempt as
 * {@code <shopId>_attempt<n>.png} / {@code .html}. These files are for people debugging a
 * run; a capture problem is logged and never changes the shop's outcome.
 */
public class DebugArtifactService {
    private static final Logger logger = LoggerFactory.getLogger(DebugArtifactService.class);

    private final Path directory;

    public DebugArtifactService(Path directory) {
        this.directory = directory;
    }

    /**
     * @return the files actually written
     */
    public List<Path> capture(PortalSession session, String shopId, int attempt) {
        List<Path> written = new ArrayList<>();
        if (!session.isAlive()) {
            logger.warn("Session is gone; no debug artifacts for shop {} attempt {}", shopId, attempt);
            return written;
        }
        String base = Utils.sanitizeFilename(shopId) + "_attempt" + attempt;
        try {
            Files.createDirectories(directory);
            Path html = directory.resolve(base + ".html");
            Files.writeString(html, session.pageContent());
            written.add(html);
            Path png = directory.resolve(base + ".png");
            session.screenshot(png);
            written.add(png);
            logger.info("Saved debug artifacts for shop {} attempt {} to {}", shopId, attempt, directory);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to save debug artifacts for shop {} attempt {}: {}", shopId, attempt, e.getMessage());
        }
        return written;
    }
}
