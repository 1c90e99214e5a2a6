package com.tnpds.scraper;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure categories recorded in {@link ErrorInfo#kind()}.
 * The JSON form is the label, e.g. {@code "ExtractionTimeout"}.
 */
public enum ErrorKind {
    ELEMENT_NOT_FOUND("ElementNotFound"),
    TIMEOUT_FAILURE("TimeoutFailure"),
    EXTRACTION_TIMEOUT("ExtractionTimeout"),
    SESSION_LOST("SessionLost"),
    NAVIGATION_FAILURE("NavigationFailure"),
    CLASSIFICATION_FAILURE("ClassificationFailure"),
    NOT_ATTEMPTED("NotAttempted"),
    UNKNOWN_FAILURE("UnknownFailure");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
