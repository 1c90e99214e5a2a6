package com.tnpds.scraper;

/**
 * The browser process or page is gone; the session cannot be used any more.
 */
public class SessionLostException extends PortalException {

    public SessionLostException(String message, Throwable cause) {
        super(ErrorKind.SESSION_LOST, message, cause);
    }
}
