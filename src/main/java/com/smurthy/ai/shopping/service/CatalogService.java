package com.smurthy.ai.shopping.service;

import java.util.List;
import java.util.Optional;

/**
 * Read-only product catalog.
 */
public interface CatalogService {

    List<Product> search(CatalogQuery query);

    Optional<Product> findById(String productId);

    List<String> categories();
}
