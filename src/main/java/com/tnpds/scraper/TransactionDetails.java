package com.tnpds.scraper;

import java.util.List;

/**
 * What the transaction dialog yielded: its summary and the bill rows in table order.
 */
public record TransactionDetails(TransactionSummary summary, List<BillItem> items) {
    public TransactionDetails {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
