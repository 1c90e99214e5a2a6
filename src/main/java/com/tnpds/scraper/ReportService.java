package com.tnpds.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the report as pretty-printed JSON through a temporary sibling file and a move, so
 * readers never see a half-written report.
 */
public class ReportService implements ReportServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(ReportService.class);

    @Override
    public void writeReport(CrawlReport report, Path file) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("Report cannot be null");
        }
        Path target = file.toAbsolutePath();
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, ObjectMapperFactory.getPrettyPrintMapper().writeValueAsString(report));
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.debug("Wrote report with {} shops to {}", report.shops().size(), target);
    }
}
