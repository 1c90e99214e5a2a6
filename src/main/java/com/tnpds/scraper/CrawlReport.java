package com.tnpds.scraper;

import java.time.Instant;
import java.util.List;

/**
 * Root of the output file. {@code shops} follows registry order.
 *
 * @param aborted true when the run stopped on a fatal session problem
 */
public record CrawlReport(Instant generatedAt, boolean aborted, RunSummary summary, List<ShopRecord> shops) {
    public CrawlReport {
        shops = List.copyOf(shops);
    }
}
