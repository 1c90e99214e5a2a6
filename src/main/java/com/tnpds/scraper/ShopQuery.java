package com.tnpds.scraper;

/**
 * Identity of one shop in the registry. The id is the government shop code and is
 * treated as an opaque string.
 */
public record ShopQuery(String id, String district, String taluk) {}
