package com.tnpds.scraper;

import java.time.Duration;

/**
 * Bounds for every wait the pipeline makes.
 *
 * @param dropdown  taluk/shop dropdown repopulation
 * @param page      page loads and the detail page marker
 * @param dialog    transaction dialog content
 * @param poll      first poll interval of a wait
 */
public record Timeouts(Duration dropdown, Duration page, Duration dialog, Duration poll) {}
