package com.tnpds.scraper;

/**
 * One row of the bill-items table. Cells the row did not have are empty strings.
 */
public record BillItem(String itemName, String quantity, String unitPrice, String total) {
    public BillItem {
        itemName = itemName == null ? "" : itemName;
        quantity = quantity == null ? "" : quantity;
        unitPrice = unitPrice == null ? "" : unitPrice;
        total = total == null ? "" : total;
    }
}
