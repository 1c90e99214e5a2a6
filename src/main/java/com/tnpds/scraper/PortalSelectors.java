package com.tnpds.scraper;

/**
 * CSS selectors for every portal element the scraper touches. Scoped selectors
 * ({@code option}, {@code detailsLabel}, {@code dialog*}, {@code billRow}, {@code billCell})
 * are resolved inside their parent element. A blank {@code englishMarker} turns the language
 * check off.
 */
public record PortalSelectors(
    String districtSelect,
    String talukSelect,
    String shopSelect,
    String option,
    String searchButton,
    String detailRoot,
    String statusIndicator,
    String detailsRow,
    String detailsLabel,
    String detailsValue,
    String transactionTrigger,
    String dialogContent,
    String dialogDate,
    String dialogAmount,
    String dialogReference,
    String dialogBillNumber,
    String billRow,
    String billCell,
    String dialogClose,
    String englishMarker,
    String languageToggle
) {}
