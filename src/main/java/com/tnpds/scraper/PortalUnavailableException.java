package com.tnpds.scraper;

/**
 * No browser session could be opened. Fatal for the run.
 */
public class PortalUnavailableException extends PortalException {

    public PortalUnavailableException(String message, Throwable cause) {
        super(ErrorKind.SESSION_LOST, message, cause);
    }
}
