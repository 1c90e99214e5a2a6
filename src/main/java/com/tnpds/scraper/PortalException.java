package com.tnpds.scraper;

/**
 * Base of every failure raised while driving the portal. Step functions throw these
 * and never catch them; {@link ResilienceService} is the only place they are turned into
 * an {@link ErrorInfo}.
 */
public class PortalException extends RuntimeException {
    private final ErrorKind kind;

    public PortalException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public PortalException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
