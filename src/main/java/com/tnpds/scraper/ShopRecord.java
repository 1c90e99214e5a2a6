package com.tnpds.scraper;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of the output report. Built once per shop by {@link ShopRecordBuilder} or the
 * static factories and never changed afterwards. Absent optional parts are left out of
 * the JSON; {@code billItems} is always written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShopRecord(
    ShopQuery query,
    ShopStatus status,
    Map<String, String> shopDetails,
    TransactionSummary lastTransaction,
    List<BillItem> billItems,
    ErrorInfo error,
    Instant capturedAt
) {
    public ShopRecord {
        status = status == null ? ShopStatus.UNKNOWN : status;
        shopDetails = shopDetails == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(shopDetails));
        billItems = billItems == null ? List.of() : List.copyOf(billItems);
    }

    public static ShopRecord notAttempted(ShopQuery query, Instant capturedAt) {
        return failed(query, new ErrorInfo(ErrorKind.NOT_ATTEMPTED, "Shop was not reached before the run stopped", 0), capturedAt);
    }

    public static ShopRecord failed(ShopQuery query, ErrorInfo error, Instant capturedAt) {
        return new ShopRecord(query, ShopStatus.UNKNOWN, null, null, List.of(), error, capturedAt);
    }
}
