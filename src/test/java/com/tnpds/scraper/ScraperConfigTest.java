package com.tnpds.scraper;

import org.junit.jupiter.api.*;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ScraperConfigTest {

    private static Properties minimal() {
        Properties properties = new Properties();
        properties.setProperty(ScraperConfig.KEY_STATUS_ONLINE, "Online, Active");
        properties.setProperty(ScraperConfig.KEY_STATUS_OFFLINE, "Offline");
        properties.setProperty(ScraperConfig.KEY_RETRY_ATTEMPTS, "5");
        properties.setProperty(ScraperConfig.KEY_RETRY_PAUSE, "100");
        return properties;
    }

    @Test
    void testBundledDefaultsLoad() {
        ScraperConfig config = ScraperConfig.load();

        assertTrue(config.searchUrl().startsWith("https://"));
        assertEquals(new BillColumns(1, 2, 3, 4), config.billColumns());
        assertEquals("option", config.selectors().option());
        assertEquals(ShopStatus.ONLINE, config.statusVocabulary().classify("Online"));
        assertTrue(config.retryPolicy().maxAttempts() >= 1);
        assertFalse(config.timeouts().dialog().isZero());
    }

    @Test
    void testExplicitProperties() {
        ScraperConfig config = ScraperConfig.of(minimal());

        assertEquals(new RetryPolicy(5, Duration.ofMillis(100)), config.retryPolicy());
        assertEquals(ShopStatus.ONLINE, config.statusVocabulary().classify("active"));
        assertEquals(ShopStatus.OFFLINE, config.statusVocabulary().classify("offline"));
    }

    @Test
    void testMissingKeyFails() {
        ScraperConfig config = ScraperConfig.of(minimal());
        IllegalStateException e = assertThrows(IllegalStateException.class, config::searchUrl);
        assertTrue(e.getMessage().contains(ScraperConfig.KEY_SEARCH_URL));
    }

    @Test
    void testNonNumericValueFails() {
        Properties properties = minimal();
        properties.setProperty(ScraperConfig.KEY_RETRY_ATTEMPTS, "three");
        assertThrows(IllegalStateException.class, () -> ScraperConfig.of(properties).retryPolicy());
    }

    @Test
    void testZeroAttemptsRejected() {
        Properties properties = minimal();
        properties.setProperty(ScraperConfig.KEY_RETRY_ATTEMPTS, "0");
        assertThrows(IllegalArgumentException.class, () -> ScraperConfig.of(properties).retryPolicy());
    }

    @Test
    void testArtifactsDir() {
        Properties properties = minimal();
        properties.setProperty(ScraperConfig.KEY_ARTIFACTS_DIR, "target/debug");
        assertEquals(Paths.get("target/debug"), ScraperConfig.of(properties).artifactsDir());
    }
}
