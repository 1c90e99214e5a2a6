package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSession;
import com.tnpds.scraper.session.PortalSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the run's single live browser session. The batch runner creates it; only the
 * resilience layer replaces the session inside it.
 */
public final class SessionHolder implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SessionHolder.class);

    private final PortalSessionFactory factory;
    private final boolean headless;
    private PortalSession session;
    private int opened;

    public SessionHolder(PortalSessionFactory factory, boolean headless) {
        this.factory = factory;
        this.headless = headless;
    }

    /**
     * The live session, opening the first one on demand.
     * @throws PortalUnavailableException when it cannot be opened
     */
    public PortalSession current() {
        if (session == null) {
            session = factory.open(headless);
            opened++;
        }
        return session;
    }

    /**
     * Discards the current session and opens a fresh one.
     * @throws PortalUnavailableException when the new session cannot be opened
     */
    PortalSession replace() {
        closeQuietly();
        logger.info("Opening a replacement browser session.");
        return current();
    }

    /**
     * Number of sessions opened so far, replacements included.
     */
    public int sessionsOpened() {
        return opened;
    }

    @Override
    public void close() {
        closeQuietly();
    }

    private void closeQuietly() {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            logger.warn("Failed to close browser session: {}", e.getMessage());
        } finally {
            session = null;
        }
    }
}
