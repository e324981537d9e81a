package com.smurthy.ai.shopping.service;

import java.util.List;

/**
 * Catalog product record as returned by the catalog service.
 */
public record Product(
        String id,
        String name,
        String description,
        String picture,
        double priceUsd,
        List<String> categories,
        List<String> materials
) {
    public Product {
        categories = categories == null ? List.of() : List.copyOf(categories);
        materials = materials == null ? List.of() : List.copyOf(materials);
    }

    public String primaryCategory() {
        return categories.isEmpty() ? "general" : categories.get(0);
    }

    public boolean inCategory(String category) {
        return categories.stream().anyMatch(c -> c.equalsIgnoreCase(category));
    }
}
