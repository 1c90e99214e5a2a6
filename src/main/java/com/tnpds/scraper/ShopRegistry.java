package com.tnpds.scraper;

import java.util.List;

/**
 * The parsed input file: shops in registry order plus run options.
 */
public record ShopRegistry(List<ShopQuery> shops, RunOptions options) {
    public ShopRegistry {
        shops = List.copyOf(shops);
        options = options == null ? RunOptions.DEFAULTS : options;
    }
}
