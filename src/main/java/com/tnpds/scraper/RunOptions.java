package com.tnpds.scraper;

/**
 * Per-run switches read from the registry's {@code options} block.
 */
public record RunOptions(boolean headless, boolean includeDetails) {
    public static final RunOptions DEFAULTS = new RunOptions(true, true);

    public RunOptions withHeadless(boolean value) {
        return new RunOptions(value, includeDetails);
    }
}
