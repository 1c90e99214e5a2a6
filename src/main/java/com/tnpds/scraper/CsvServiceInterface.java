package com.tnpds.scraper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for the CSV summary export.
 */
public interface CsvServiceInterface {

    /**
     * Writes one row per shop of the report.
     * @param report report to export
     * @param file output CSV path; parent directories are created
     * @throws IOException if file writing fails
     */
    void writeReportToCsv(CrawlReport report, Path file) throws IOException;
}
