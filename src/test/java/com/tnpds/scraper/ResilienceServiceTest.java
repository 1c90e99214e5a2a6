package com.tnpds.scraper;

import com.tnpds.scraper.session.FakePortalSession;
import com.tnpds.scraper.session.FakeSessionFactory;
import com.tnpds.scraper.session.PortalSession;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Retry, session replacement and error recording around the shop pipeline.
 */
public class ResilienceServiceTest {
    private static final ShopQuery KARAIKUDI = new ShopQuery("21EB028P1", "Sivagangai", "Karaikudi (Tk)");

    @TempDir
    Path artifactsDir;

    /** Counts calls before delegating to the real extractor. */
    private static final class CountingExtractor implements TransactionExtractorInterface {
        final AtomicInteger calls = new AtomicInteger();
        private final TransactionExtractor delegate = PortalFixtures.extractor();

        @Override
        public TransactionDetails extract(PortalSession session) {
            calls.incrementAndGet();
            return delegate.extract(session);
        }
    }

    private ResilienceService service(ShopPipeline pipeline, int attempts) {
        return new ResilienceService(pipeline, new DebugArtifactService(artifactsDir),
            new RetryPolicy(attempts, Duration.ZERO), PortalFixtures.CLOCK);
    }

    private List<String> artifactNames() throws IOException {
        if (!Files.exists(artifactsDir)) return List.of();
        try (Stream<Path> files = Files.list(artifactsDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    void testOnlineShopIsReadOnFirstAttempt() throws IOException {
        FakeSessionFactory factory = new FakeSessionFactory(n -> PortalFixtures.karaikudiPortal());
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ShopRecord record = service(PortalFixtures.pipeline(), 3).process(sessions, KARAIKUDI, RunOptions.DEFAULTS);

            assertNull(record.error());
            assertEquals(ShopStatus.ONLINE, record.status());
            assertEquals("KARAIKUDI CO-OP STORE", record.shopDetails().get("Shop Name"));
            assertEquals("TXN000417", record.lastTransaction().reference());
            assertEquals(List.of(new BillItem("Rice", "5", "3.00", "15.00")), record.billItems());
            assertEquals(PortalFixtures.CLOCK.instant(), record.capturedAt());
        }
        assertEquals(List.of(), artifactNames());
    }

    @Test
    void testTransientFailureRecoversOnRetry() {
        FakePortalSession portal = PortalFixtures.karaikudiPortal()
            .failNextNavigation(new PortalException(ErrorKind.UNKNOWN_FAILURE, "net::ERR_CONNECTION_RESET"));
        FakeSessionFactory factory = new FakeSessionFactory(n -> portal);
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ShopRecord record = service(PortalFixtures.pipeline(), 3).process(sessions, KARAIKUDI, RunOptions.DEFAULTS);

            assertNull(record.error());
            assertEquals(ShopStatus.ONLINE, record.status());
            assertEquals(2, portal.navigations());
            assertEquals(1, sessions.sessionsOpened());
        }
    }

    @Test
    void testPersistentTimeoutIsRecordedAfterAllAttempts() throws IOException {
        FakePortalSession portal = PortalFixtures.karaikudiPortal().talukNeverRepopulates();
        FakeSessionFactory factory = new FakeSessionFactory(n -> portal);
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ShopRecord record = service(PortalFixtures.pipeline(), 3).process(sessions, KARAIKUDI, RunOptions.DEFAULTS);

            assertEquals(ErrorKind.TIMEOUT_FAILURE, record.error().kind());
            assertEquals(3, record.error().attempts());
            assertEquals(ShopStatus.UNKNOWN, record.status());
            assertNull(record.lastTransaction());
            assertTrue(record.billItems().isEmpty());
            assertEquals(3, portal.navigations());
        }
        assertEquals(List.of(
            "21EB028P1_attempt1.html", "21EB028P1_attempt1.png",
            "21EB028P1_attempt2.html", "21EB028P1_attempt2.png",
            "21EB028P1_attempt3.html", "21EB028P1_attempt3.png"
        ), artifactNames());
    }

    @Test
    void testExtractionTimeoutKeepsStatusAndDetails() {
        FakeSessionFactory factory = new FakeSessionFactory(n -> {
            FakePortalSession portal = new FakePortalSession();
            portal.shop("Sivagangai", "Karaikudi (Tk)", "21EB028P1")
                .status("Online")
                .detail("Shop Name", "KARAIKUDI CO-OP STORE")
                .bill("Rice", "5", "3.00", "15.00")
                .dialogNeverLoads();
            return portal;
        });
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ShopRecord record = service(PortalFixtures.pipeline(), 2).process(sessions, KARAIKUDI, RunOptions.DEFAULTS);

            assertEquals(ErrorKind.EXTRACTION_TIMEOUT, record.error().kind());
            assertEquals(2, record.error().attempts());
            assertEquals(ShopStatus.ONLINE, record.status());
            assertEquals("KARAIKUDI CO-OP STORE", record.shopDetails().get("Shop Name"));
            assertNull(record.lastTransaction());
            assertTrue(record.billItems().isEmpty());
            assertEquals(2, factory.opened().get(0).dialogOpens());
            assertEquals(0, factory.opened().get(0).navigationsWithDialogOpen());
        }
    }

    @Test
    void testSessionLossReplacesSessionOnce() {
        FakeSessionFactory factory = new FakeSessionFactory(n -> n == 0
            ? PortalFixtures.karaikudiPortal().loseSessionOnNextNavigation()
            : PortalFixtures.karaikudiPortal());
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ShopRecord record = service(PortalFixtures.pipeline(), 3).process(sessions, KARAIKUDI, RunOptions.DEFAULTS);

            assertNull(record.error());
            assertEquals(ShopStatus.ONLINE, record.status());
            assertEquals(2, sessions.sessionsOpened());
            assertFalse(factory.opened().get(0).isAlive());
        }
    }

    @Test
    void testDeadSessionIsReplacedBeforeAttempt() {
        FakeSessionFactory factory = new FakeSessionFactory(n -> PortalFixtures.karaikudiPortal());
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ((FakePortalSession) sessions.current()).kill();
            ShopRecord record = service(PortalFixtures.pipeline(), 1).process(sessions, KARAIKUDI, RunOptions.DEFAULTS);

            assertNull(record.error());
            assertEquals(2, sessions.sessionsOpened());
        }
    }

    @Test
    void testFailedReplacementAbortsWithShopRecord() {
        FakeSessionFactory factory = new FakeSessionFactory(n -> PortalFixtures.karaikudiPortal().loseSessionOnNextNavigation())
            .failAfter(1);
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            RunAbortedException e = assertThrows(RunAbortedException.class,
                () -> service(PortalFixtures.pipeline(), 3).process(sessions, KARAIKUDI, RunOptions.DEFAULTS));

            assertEquals(KARAIKUDI, e.record().query());
            assertEquals(ErrorKind.SESSION_LOST, e.record().error().kind());
            assertEquals(1, e.record().error().attempts());
        }
    }

    @Test
    void testAbortedShopReportsAttemptsActuallyMade() {
        FakeSessionFactory factory = new FakeSessionFactory(n -> PortalFixtures.karaikudiPortal()
            .failNextNavigation(new PortalException(ErrorKind.UNKNOWN_FAILURE, "net::ERR_CONNECTION_RESET"))
            .loseSessionOnNavigation(2))
            .failAfter(1);
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            RunAbortedException e = assertThrows(RunAbortedException.class,
                () -> service(PortalFixtures.pipeline(), 3).process(sessions, KARAIKUDI, RunOptions.DEFAULTS));

            assertEquals(2, e.record().error().attempts());
            assertEquals(ErrorKind.SESSION_LOST, e.record().error().kind());
        }
    }

    @Test
    void testOfflineShopSkipsExtraction() {
        CountingExtractor extractor = new CountingExtractor();
        FakeSessionFactory factory = new FakeSessionFactory(n -> {
            FakePortalSession portal = new FakePortalSession();
            portal.shop("Sivagangai", "Karaikudi (Tk)", "21EB028P1").status("Offline").bill("Rice", "5", "3.00", "15.00");
            return portal;
        });
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ShopRecord record = service(PortalFixtures.pipeline(extractor), 3).process(sessions, KARAIKUDI, RunOptions.DEFAULTS);

            assertEquals(ShopStatus.OFFLINE, record.status());
            assertNull(record.error());
            assertNull(record.lastTransaction());
            assertEquals(0, extractor.calls.get());
        }
    }

    @Test
    void testIncludeDetailsFalseNeverOpensDialog() {
        CountingExtractor extractor = new CountingExtractor();
        FakeSessionFactory factory = new FakeSessionFactory(n -> PortalFixtures.karaikudiPortal());
        try (SessionHolder sessions = new SessionHolder(factory, true)) {
            ShopRecord record = service(PortalFixtures.pipeline(extractor), 3)
                .process(sessions, KARAIKUDI, new RunOptions(true, false));

            assertEquals(ShopStatus.ONLINE, record.status());
            assertNull(record.shopDetails());
            assertNull(record.lastTransaction());
            assertEquals(0, extractor.calls.get());
            assertEquals(0, factory.opened().get(0).dialogOpens());
        }
    }

    @Test
    void testKindOfPrefersSpecificPortalKind() {
        assertEquals(ErrorKind.ELEMENT_NOT_FOUND,
            ResilienceService.kindOf(new ElementNotFoundException("#view"), PipelineStage.EXTRACTION));
        assertEquals(ErrorKind.SESSION_LOST,
            ResilienceService.kindOf(new SessionLostException("gone", null), PipelineStage.NAVIGATION));
        assertEquals(ErrorKind.NAVIGATION_FAILURE,
            ResilienceService.kindOf(new IllegalStateException("boom"), PipelineStage.NAVIGATION));
        assertEquals(ErrorKind.CLASSIFICATION_FAILURE,
            ResilienceService.kindOf(new PortalException(ErrorKind.UNKNOWN_FAILURE, "odd"), PipelineStage.CLASSIFICATION));
        assertEquals(ErrorKind.UNKNOWN_FAILURE,
            ResilienceService.kindOf(new IllegalStateException("boom"), PipelineStage.EXTRACTION));
    }
}
