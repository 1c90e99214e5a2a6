package com.tnpds.scraper;

import java.time.Duration;
import java.util.List;

/**
 * Counts over a report's records. A shop counts as failed when it carries an error other
 * than {@link ErrorKind#NOT_ATTEMPTED}; it is still counted under its status as well.
 */
public record RunSummary(
    int totalShops,
    int online,
    int offline,
    int unknown,
    int failed,
    int notAttempted,
    double executionTimeSeconds
) {
    public static RunSummary of(List<ShopRecord> records, Duration elapsed) {
        int online = 0, offline = 0, unknown = 0, failed = 0, notAttempted = 0;
        for (ShopRecord record : records) {
            if (record.error() != null && record.error().kind() == ErrorKind.NOT_ATTEMPTED) {
                notAttempted++;
                continue;
            }
            if (record.error() != null) failed++;
            switch (record.status()) {
                case ONLINE -> online++;
                case OFFLINE -> offline++;
                default -> unknown++;
            }
        }
        double seconds = Math.round(elapsed.toMillis() / 10.0) / 100.0;
        return new RunSummary(records.size(), online, offline, unknown, failed, notAttempted, seconds);
    }
}
