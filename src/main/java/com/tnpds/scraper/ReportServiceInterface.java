package com.tnpds.scraper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for the JSON report file.
 */
public interface ReportServiceInterface {

    /**
     * Writes the report, replacing any previous file in one step.
     * @param report report to write
     * @param file target path; parent directories are created
     * @throws IOException if the file cannot be written
     */
    void writeReport(CrawlReport report, Path file) throws IOException;
}
