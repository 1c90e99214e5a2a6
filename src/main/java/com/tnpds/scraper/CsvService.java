package com.tnpds.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Flat CSV view of a report, one row per shop in report order, using OpenCSV.
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final List<String> CSV_FIELDS = List.of(
        "Shop ID",
        "District",
        "Taluk",
        "Status",
        "Last Transaction Date",
        "Amount",
        "Reference",
        "Bill Items",
        "Error Kind",
        "Error Message"
    );

    @Override
    public void writeReportToCsv(CrawlReport report, Path file) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("Report cannot be null");
        }
        Path target = file.toAbsolutePath();
        Files.createDirectories(target.getParent());
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_FIELDS.toArray(String[]::new));
            for (ShopRecord record : report.shops()) {
                TransactionSummary tx = record.lastTransaction();
                ErrorInfo error = record.error();
                writer.writeNext(new String[]{
                    safe(record.query().id()),
                    safe(record.query().district()),
                    safe(record.query().taluk()),
                    record.status().value(),
                    tx == null ? "" : safe(tx.date()),
                    tx == null ? "" : safe(tx.amount()),
                    tx == null ? "" : safe(tx.reference()),
                    Integer.toString(record.billItems().size()),
                    error == null ? "" : error.kind().label(),
                    error == null ? "" : safe(error.message())
                });
            }
        }
        logger.info("Wrote {} shops to CSV file: {}", report.shops().size(), target);
    }

    /**
     * Collapses line breaks so each shop stays on one physical line.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
