package com.tnpds.scraper;

import java.time.Duration;

/**
 * A wait condition never became true within its timeout.
 */
public class WaitTimeoutException extends PortalException {
    private final String condition;
    private final Duration timeout;

    public WaitTimeoutException(String condition, Duration timeout, Throwable cause) {
        this(ErrorKind.TIMEOUT_FAILURE, condition, timeout, cause);
    }

    protected WaitTimeoutException(ErrorKind kind, String condition, Duration timeout, Throwable cause) {
        super(kind, "Timed out after " + timeout.toMillis() + "ms waiting for " + condition, cause);
        this.condition = condition;
        this.timeout = timeout;
    }

    public String condition() {
        return condition;
    }

    public Duration timeout() {
        return timeout;
    }
}
