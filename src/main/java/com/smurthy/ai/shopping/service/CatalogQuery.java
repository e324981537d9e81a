package com.smurthy.ai.shopping.service;

/**
 * Catalog search criteria. Null fields are unconstrained.
 */
public record CatalogQuery(String text, String category, Double minPrice, Double maxPrice, int limit) {

    public static final int DEFAULT_LIMIT = 10;

    public CatalogQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        if (minPrice != null && maxPrice != null && minPrice > maxPrice) {
            throw new IllegalArgumentException("min_price " + minPrice + " exceeds max_price " + maxPrice);
        }
    }

    public static CatalogQuery text(String text) {
        return new CatalogQuery(text, null, null, null, DEFAULT_LIMIT);
    }
}
