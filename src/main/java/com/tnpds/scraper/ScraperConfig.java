package com.tnpds.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Scraper settings: portal URL, selectors, status vocabulary, timeouts and retry budget.
 * <p>
 * Values come from {@code scraper.properties} on the classpath. Any key can be overridden by
 * an environment variable (upper-cased, dots and dashes as underscores, e.g.
 * {@code RETRY_MAX_ATTEMPTS}) or a JVM system property of the same key; the environment wins.
 * The portal markup changes without notice, so selectors and status tokens are meant to be
 * edited here rather than in code.
 */
public final class ScraperConfig {
    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);
    private static final String RESOURCE = "scraper.properties";

    public static final String KEY_SEARCH_URL = "portal.search.url";
    public static final String KEY_STATUS_ONLINE = "status.online.tokens";
    public static final String KEY_STATUS_OFFLINE = "status.offline.tokens";
    public static final String KEY_TIMEOUT_DROPDOWN = "timeout.dropdown.ms";
    public static final String KEY_TIMEOUT_PAGE = "timeout.page.ms";
    public static final String KEY_TIMEOUT_DIALOG = "timeout.dialog.ms";
    public static final String KEY_WAIT_POLL = "wait.poll.ms";
    public static final String KEY_RETRY_ATTEMPTS = "retry.max.attempts";
    public static final String KEY_RETRY_PAUSE = "retry.pause.ms";
    public static final String KEY_ARTIFACTS_DIR = "artifacts.dir";

    private final Properties properties;
    private final Map<String, String> environment;

    private ScraperConfig(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    /**
     * Loads the bundled defaults with environment and system-property overrides.
     */
    public static ScraperConfig load() {
        Properties merged = new Properties();
        try (InputStream input = ScraperConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Missing " + RESOURCE + " on the classpath");
            }
            merged.load(input);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE + ": " + e.getMessage(), e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (merged.containsKey(key)) {
                merged.setProperty(key, System.getProperty(key));
            }
        }
        return new ScraperConfig(merged, System.getenv());
    }

    /**
     * Config over explicit properties only; no environment lookups. Used by tests.
     */
    public static ScraperConfig of(Properties properties) {
        return new ScraperConfig(properties, Map.of());
    }

    public String get(String key) {
        String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
        String fromEnv = environment.get(envKey);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("Missing configuration key: " + key);
        }
        return value.trim();
    }

    public int getInt(String key) {
        String value = get(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration key " + key + " is not an integer: " + value, e);
        }
    }

    public Duration getMillis(String key) {
        return Duration.ofMillis(getInt(key));
    }

    public String searchUrl() {
        return get(KEY_SEARCH_URL);
    }

    public PortalSelectors selectors() {
        return new PortalSelectors(
            get("selector.district"),
            get("selector.taluk"),
            get("selector.shop"),
            get("selector.option"),
            get("selector.search"),
            get("selector.detail.root"),
            get("selector.status"),
            get("selector.details.row"),
            get("selector.details.label"),
            get("selector.details.value"),
            get("selector.transaction.trigger"),
            get("selector.dialog.content"),
            get("selector.dialog.date"),
            get("selector.dialog.amount"),
            get("selector.dialog.reference"),
            get("selector.dialog.bill-number"),
            get("selector.bill.row"),
            get("selector.bill.cell"),
            get("selector.dialog.close"),
            get("selector.language.english-marker"),
            get("selector.language.toggle")
        );
    }

    public BillColumns billColumns() {
        return new BillColumns(
            getInt("bill.column.item-name"),
            getInt("bill.column.quantity"),
            getInt("bill.column.unit-price"),
            getInt("bill.column.total")
        );
    }

    public StatusVocabulary statusVocabulary() {
        StatusVocabulary vocabulary = StatusVocabulary.parse(get(KEY_STATUS_ONLINE), get(KEY_STATUS_OFFLINE));
        logger.debug("Status vocabulary: online={} offline={}", vocabulary.onlineTokens(), vocabulary.offlineTokens());
        return vocabulary;
    }

    public Timeouts timeouts() {
        return new Timeouts(
            getMillis(KEY_TIMEOUT_DROPDOWN),
            getMillis(KEY_TIMEOUT_PAGE),
            getMillis(KEY_TIMEOUT_DIALOG),
            getMillis(KEY_WAIT_POLL)
        );
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(getInt(KEY_RETRY_ATTEMPTS), getMillis(KEY_RETRY_PAUSE));
    }

    public Path artifactsDir() {
        return Paths.get(get(KEY_ARTIFACTS_DIR));
    }
}
