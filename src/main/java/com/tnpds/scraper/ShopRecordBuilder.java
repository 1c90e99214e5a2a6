package com.tnpds.scraper;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Collects a shop's record as the pipeline progresses, so whatever was captured before a
 * failure still ends up in the report.
 */
public final class ShopRecordBuilder {
    private final ShopQuery query;
    private ShopStatus status = ShopStatus.UNKNOWN;
    private Map<String, String> shopDetails;
    private TransactionSummary lastTransaction;
    private List<BillItem> billItems = List.of();
    private ErrorInfo error;

    public ShopRecordBuilder(ShopQuery query) {
        this.query = query;
    }

    public ShopRecordBuilder status(ShopStatus status) {
        this.status = status;
        return this;
    }

    public ShopRecordBuilder shopDetails(Map<String, String> shopDetails) {
        this.shopDetails = shopDetails;
        return this;
    }

    public ShopRecordBuilder transaction(TransactionDetails details) {
        this.lastTransaction = details.summary();
        this.billItems = details.items();
        return this;
    }

    public ShopRecordBuilder error(ErrorInfo error) {
        this.error = error;
        return this;
    }

    public ShopQuery query() {
        return query;
    }

    public ShopRecord build(Instant capturedAt) {
        return new ShopRecord(query, status, shopDetails, lastTransaction, billItems, error, capturedAt);
    }
}
