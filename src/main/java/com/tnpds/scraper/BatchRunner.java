package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Processes the registry one shop at a time on a single browser session and assembles the
 * report in registry order.
 * <p>
 * Every registry entry yields exactly one record. Shops not reached because the stop signal
 * fired are recorded as {@link ErrorKind#NOT_ATTEMPTED}. If no browser session can be had
 * (at start, or when replacing a lost one) the run is aborted: the shop in flight is
 * recorded as {@link ErrorKind#SESSION_LOST}, the rest as not attempted, and the report is
 * flagged {@code aborted}.
 *
 * @author PDS Scraper Team
 * @since 1.0
 */
public class BatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

    private final ResilienceService resilience;
    private final PortalSessionFactory sessionFactory;
    private final Clock clock;

    public BatchRunner(ResilienceService resilience, PortalSessionFactory sessionFactory, Clock clock) {
        this.resilience = resilience;
        this.sessionFactory = sessionFactory;
        this.clock = clock;
    }

    public CrawlReport run(ShopRegistry registry, StopSignal stop) {
        return run(registry, stop, report -> {});
    }

    /**
     * @param checkpoint receives the partial report (records so far) after every shop
     */
    public CrawlReport run(ShopRegistry registry, StopSignal stop, Consumer<CrawlReport> checkpoint) {
        Instant started = clock.instant();
        List<ShopQuery> shops = registry.shops();
        RunOptions options = registry.options();
        List<ShopRecord> records = new ArrayList<>(shops.size());
        boolean aborted = false;
        logger.info("Starting run over {} shops (includeDetails={}, headless={})",
            shops.size(), options.includeDetails(), options.headless());

        try (SessionHolder sessions = new SessionHolder(sessionFactory, options.headless())) {
            sessions.current();
            for (ShopQuery query : shops) {
                if (stop.shouldStop()) {
                    logger.warn("Stop requested; {} shops will not be attempted", shops.size() - records.size());
                    break;
                }
                logger.info("[{}/{}] Processing shop {} ({} / {})",
                    records.size() + 1, shops.size(), query.id(), query.district(), query.taluk());
                try {
                    records.add(resilience.process(sessions, query, options));
                } catch (RunAbortedException e) {
                    records.add(e.record());
                    throw e;
                }
                checkpoint.accept(report(started, false, records));
            }
        } catch (PortalUnavailableException e) {
            logger.error("Aborting run, no browser session available: {}", e.getMessage());
            aborted = true;
        }

        for (int i = records.size(); i < shops.size(); i++) {
            records.add(ShopRecord.notAttempted(shops.get(i), clock.instant()));
        }
        CrawlReport report = report(started, aborted, records);
        RunSummary summary = report.summary();
        logger.info("Run finished: {} shops, {} online, {} offline, {} unknown, {} failed, {} not attempted in {}s",
            summary.totalShops(), summary.online(), summary.offline(), summary.unknown(),
            summary.failed(), summary.notAttempted(), summary.executionTimeSeconds());
        return report;
    }

    private CrawlReport report(Instant started, boolean aborted, List<ShopRecord> records) {
        Instant now = clock.instant();
        return new CrawlReport(now, aborted, RunSummary.of(records, Duration.between(started, now)), records);
    }
}
