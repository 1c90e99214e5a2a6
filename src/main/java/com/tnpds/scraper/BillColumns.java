package com.tnpds.scraper;

/**
 * Zero-based cell positions of the bill-items table.
 */
public record BillColumns(int itemName, int quantity, int unitPrice, int total) {}
