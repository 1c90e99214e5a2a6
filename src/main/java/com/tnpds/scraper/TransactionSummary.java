package com.tnpds.scraper;

/**
 * Header fields of the last-transaction dialog, as rendered by the portal.
 * Missing fields are empty strings so the report schema stays flat.
 *
 * @param reference the portal's transaction number
 */
public record TransactionSummary(String date, String amount, String reference, String billNumber) {
    public TransactionSummary {
        date = date == null ? "" : date;
        amount = amount == null ? "" : amount;
        reference = reference == null ? "" : reference;
        billNumber = billNumber == null ? "" : billNumber;
    }
}
