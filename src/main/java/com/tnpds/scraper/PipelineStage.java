package com.tnpds.scraper;

/**
 * Where in a shop's pipeline a failure happened; picks the error kind for failures that
 * do not carry one of their own.
 */
public enum PipelineStage {
    NAVIGATION(ErrorKind.NAVIGATION_FAILURE),
    CLASSIFICATION(ErrorKind.CLASSIFICATION_FAILURE),
    EXTRACTION(ErrorKind.UNKNOWN_FAILURE);

    private final ErrorKind fallbackKind;

    PipelineStage(ErrorKind fallbackKind) {
        this.fallbackKind = fallbackKind;
    }

    public ErrorKind fallbackKind() {
        return fallbackKind;
    }
}
