package com.tnpds.scraper;

import com.tnpds.scraper.session.PlaywrightSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command-line entry point: reads a shop registry, checks every shop on the PDS portal and
 * writes the JSON report (plus an optional CSV summary).
 * <pre>
 * --shop-list-json FILE   registry to process (required)
 * --output-json FILE      report path (default shop_status_results.json)
 * --output-csv FILE       also write a CSV summary
 * --headless | --headed   override the registry's headless option
 * --max-retries N         attempts per shop (default from scraper.properties)
 * --screenshots-dir DIR   where failed attempts leave screenshots and HTML
 * --deadline-minutes N    stop starting new shops after N minutes (0 = no limit)
 * </pre>
 * Exit status: 0 for a completed run, 1 for an aborted run, 2 for bad arguments or registry.
 *
 * @author PDS Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_OUTPUT = "shop_status_results.json";
    static final int EXIT_OK = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Parsed command line. {@code headless} and {@code maxRetries} are {@code null} when not given.
     */
    record Arguments(Path registry, Path outputJson, Path outputCsv, Boolean headless,
                     Integer maxRetries, Path screenshotsDir, Duration deadline) {}

    static Arguments parseArgs(String[] args) {
        Path registry = null;
        Path outputJson = Paths.get(DEFAULT_OUTPUT);
        Path outputCsv = null;
        Boolean headless = null;
        Integer maxRetries = null;
        Path screenshotsDir = null;
        Duration deadline = Duration.ZERO;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--shop-list-json" -> registry = Paths.get(value(args, ++i, arg));
                case "--output-json" -> outputJson = Paths.get(value(args, ++i, arg));
                case "--output-csv" -> outputCsv = Paths.get(value(args, ++i, arg));
                case "--headless" -> headless = Boolean.TRUE;
                case "--headed" -> headless = Boolean.FALSE;
                case "--max-retries" -> maxRetries = positiveInt(value(args, ++i, arg), arg);
                case "--screenshots-dir" -> screenshotsDir = Paths.get(value(args, ++i, arg));
                case "--deadline-minutes" -> deadline = Duration.ofMinutes(Integer.parseInt(value(args, ++i, arg)));
                default -> throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        if (registry == null) {
            throw new IllegalArgumentException("--shop-list-json is required");
        }
        return new Arguments(registry, outputJson, outputCsv, headless, maxRetries, screenshotsDir, deadline);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    private static int positiveInt(String raw, String option) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) throw new IllegalArgumentException(option + " must be at least 1");
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be a number: " + raw, e);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Arguments arguments;
        ShopRegistry registry;
        try {
            arguments = parseArgs(args);
            registry = new RegistryService().read(arguments.registry());
        } catch (IllegalArgumentException | IOException e) {
            logger.error("Cannot start: {}", e.getMessage());
            System.err.println("Usage: --shop-list-json FILE [--output-json FILE] [--output-csv FILE] "
                + "[--headless|--headed] [--max-retries N] [--screenshots-dir DIR] [--deadline-minutes N]");
            return EXIT_USAGE;
        }
        if (arguments.headless() != null) {
            registry = new ShopRegistry(registry.shops(), registry.options().withHeadless(arguments.headless()));
        }

        ScraperConfig config = ScraperConfig.load();
        Clock clock = Clock.systemUTC();
        BatchRunner runner = createRunner(config, arguments, clock);
        ReportServiceInterface reports = new ReportService();

        AtomicBoolean stopRequested = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            logger.warn("Shutdown requested; finishing the current shop before stopping.");
            stopRequested.set(true);
            try {
                finished.await(5, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "scraper-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            StopSignal stop = StopSignal.flag(stopRequested).or(StopSignal.deadline(clock, arguments.deadline()));
            CrawlReport report = runner.run(registry, stop, partial -> checkpoint(reports, partial, arguments.outputJson()));
            reports.writeReport(report, arguments.outputJson());
            logger.info("Results saved to {}", arguments.outputJson().toAbsolutePath());
            if (arguments.outputCsv() != null) {
                new CsvService().writeReportToCsv(report, arguments.outputCsv());
            }
            return report.aborted() ? EXIT_ABORTED : EXIT_OK;
        } catch (IOException e) {
            logger.error("Failed to write results: {}", e.getMessage());
            return EXIT_ABORTED;
        } finally {
            finished.countDown();
            if (!stopRequested.get()) {
                Runtime.getRuntime().removeShutdownHook(hook);
            }
        }
    }

    static BatchRunner createRunner(ScraperConfig config, Arguments arguments, Clock clock) {
        PortalSelectors selectors = config.selectors();
        Timeouts timeouts = config.timeouts();
        RetryPolicy policy = config.retryPolicy();
        if (arguments.maxRetries() != null) {
            policy = policy.withMaxAttempts(arguments.maxRetries());
        }
        Path artifactsDir = arguments.screenshotsDir() != null ? arguments.screenshotsDir() : config.artifactsDir();

        ShopPipeline pipeline = new ShopPipeline(
            new NavigationService(config.searchUrl(), selectors, timeouts),
            new StatusClassifier(selectors.statusIndicator(), config.statusVocabulary()),
            new DetailPageReader(selectors),
            new TransactionExtractor(selectors, config.billColumns(), timeouts.dialog())
        );
        ResilienceService resilience = new ResilienceService(pipeline, new DebugArtifactService(artifactsDir), policy, clock);
        return new BatchRunner(resilience, new PlaywrightSessionFactory(timeouts.page(), timeouts.poll()), clock);
    }

    private static void checkpoint(ReportServiceInterface reports, CrawlReport partial, Path file) {
        try {
            reports.writeReport(partial, file);
        } catch (IOException e) {
            logger.warn("Failed to write progress checkpoint to {}: {}", file, e.getMessage());
        }
    }
}
