package com.tnpds.scraper;

import java.time.Duration;

/**
 * The last-transaction dialog opened but its content never loaded.
 */
public class ExtractionTimeoutException extends WaitTimeoutException {

    public ExtractionTimeoutException(String condition, Duration timeout, Throwable cause) {
        super(ErrorKind.EXTRACTION_TIMEOUT, condition, timeout, cause);
    }
}
