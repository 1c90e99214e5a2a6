package com.tnpds.scraper.session;

import com.tnpds.scraper.PortalUnavailableException;

/**
 * Opens browser sessions. Window size and browser flags are fixed policy of the
 * implementation; headless mode is the only choice a caller makes.
 */
public interface PortalSessionFactory {

    /**
     * @throws PortalUnavailableException when no session can be started
     */
    PortalSession open(boolean headless);
}
