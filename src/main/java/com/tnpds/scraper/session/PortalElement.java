package com.tnpds.scraper.session;

/**
 * Opaque handle to an element located by a {@link PortalSession}. Only the session that
 * produced a handle can act on it.
 */
public interface PortalElement {

    /**
     * The selector this element was located with, for logs and error messages.
     */
    String selector();
}
