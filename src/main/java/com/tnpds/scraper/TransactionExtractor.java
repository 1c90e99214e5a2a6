package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalElement;
import com.tnpds.scraper.session.PortalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Opens the "View" dialog of the last transaction and parses it.
 * <p>
 * The dialog is shown before its data arrives; it counts as ready once its content region
 * has text and at least one bill row. The dialog is closed again before returning, also
 * after a failure, so the next shop starts from a clean page. A row with fewer cells than
 * expected is kept with empty strings for the missing cells; rows without any cell (header
 * rows) are skipped.
 *
 * @author PDS Scraper Team
 * @since 1.0
 */
public class TransactionExtractor implements TransactionExtractorInterface {
    private static final Logger logger = LoggerFactory.getLogger(TransactionExtractor.class);

    private final PortalSelectors selectors;
    private final BillColumns columns;
    private final Duration dialogTimeout;

    public TransactionExtractor(PortalSelectors selectors, BillColumns columns, Duration dialogTimeout) {
        this.selectors = selectors;
        this.columns = columns;
        this.dialogTimeout = dialogTimeout;
    }

    @Override
    public TransactionDetails extract(PortalSession session) {
        session.click(session.findElement(selectors.transactionTrigger()));
        TransactionDetails details;
        try {
            details = readDialog(session);
        } catch (RuntimeException e) {
            closeAfterFailure(session, e);
            throw e;
        }
        closeDialog(session);
        logger.debug("Read transaction {} with {} bill items", details.summary().reference(), details.items().size());
        return details;
    }

    private TransactionDetails readDialog(PortalSession session) {
        PortalElement content = awaitContent(session);
        TransactionSummary summary = new TransactionSummary(
            optionalText(session, selectors.dialogDate(), content),
            optionalText(session, selectors.dialogAmount(), content),
            optionalText(session, selectors.dialogReference(), content),
            optionalText(session, selectors.dialogBillNumber(), content)
        );
        List<BillItem> items = new ArrayList<>();
        for (PortalElement row : session.findElements(selectors.billRow(), content)) {
            List<String> cells = session.readTexts(selectors.billCell(), row);
            if (cells.isEmpty()) {
                continue;
            }
            items.add(new BillItem(
                cell(cells, columns.itemName()),
                cell(cells, columns.quantity()),
                cell(cells, columns.unitPrice()),
                cell(cells, columns.total())
            ));
        }
        return new TransactionDetails(summary, items);
    }

    private PortalElement awaitContent(PortalSession session) {
        try {
            return session.waitUntil("transaction dialog content", () -> {
                PortalElement content = session.findElement(selectors.dialogContent());
                if (session.readText(content).isEmpty()) {
                    return null;
                }
                return session.findElements(selectors.billRow(), content).isEmpty() ? null : content;
            }, dialogTimeout);
        } catch (WaitTimeoutException e) {
            throw new ExtractionTimeoutException("transaction dialog content", dialogTimeout, e);
        }
    }

    private void closeDialog(PortalSession session) {
        session.click(session.findElement(selectors.dialogClose()));
    }

    private void closeAfterFailure(PortalSession session, RuntimeException failure) {
        if (failure instanceof SessionLostException) {
            return;
        }
        try {
            closeDialog(session);
        } catch (RuntimeException closeFailure) {
            logger.warn("Could not close transaction dialog after failure: {}", closeFailure.getMessage());
            failure.addSuppressed(closeFailure);
        }
    }

    private static String optionalText(PortalSession session, String selector, PortalElement within) {
        List<PortalElement> matches = session.findElements(selector, within);
        return matches.isEmpty() ? "" : session.readText(matches.get(0));
    }

    private static String cell(List<String> cells, int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : "";
    }
}
