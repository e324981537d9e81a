package com.smurthy.ai.shopping.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Catalog backed by a JSON seed file (the Online Boutique product set).
 *
 * Text matching is token based: a product matches if any query token of three or more
 * characters appears in its name, description or categories. Results are ordered by number
 * of matching tokens, then by price.
 */
@Service
public class InMemoryCatalogService implements CatalogService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogService.class);

    private final Map<String, Product> products = new LinkedHashMap<>();

    @Autowired
    public InMemoryCatalogService(@Value("${shopping.catalog.seed:classpath:catalog/products.json}") Resource seed,
                                  ObjectMapper objectMapper) {
        try (InputStream in = seed.getInputStream()) {
            List<Product> loaded = objectMapper.readValue(in, new TypeReference<List<Product>>() {});
            loaded.forEach(p -> products.put(p.id(), p));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load catalog seed " + seed.getDescription(), e);
        }
        log.info("Catalog loaded with {} products in categories {}", products.size(), categories());
    }

    public InMemoryCatalogService(List<Product> seed) {
        seed.forEach(p -> products.put(p.id(), p));
    }

    @Override
    public List<Product> search(CatalogQuery query) {
        List<String> tokens = tokens(query.text());
        return products.values().stream()
                .filter(p -> query.category() == null || p.inCategory(query.category()))
                .filter(p -> query.minPrice() == null || p.priceUsd() >= query.minPrice())
                .filter(p -> query.maxPrice() == null || p.priceUsd() <= query.maxPrice())
                .filter(p -> tokens.isEmpty() || score(p, tokens) > 0)
                .sorted(Comparator.comparingInt((Product p) -> -score(p, tokens))
                        .thenComparingDouble(Product::priceUsd))
                .limit(query.limit())
                .toList();
    }

    @Override
    public Optional<Product> findById(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public List<String> categories() {
        TreeSet<String> all = new TreeSet<>();
        products.values().forEach(p -> all.addAll(p.categories()));
        return List.copyOf(all);
    }

    private static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9&]+"))
                .filter(t -> t.length() >= 3)
                .map(InMemoryCatalogService::singular)
                .toList();
    }

    private static String singular(String token) {
        return token.length() > 4 && token.endsWith("s") && !token.endsWith("ss")
                ? token.substring(0, token.length() - 1)
                : token;
    }

    private static int score(Product product, List<String> tokens) {
        String haystack = (product.name() + " " + product.description() + " "
                + String.join(" ", product.categories())).toLowerCase(Locale.ROOT);
        int score = 0;
        for (String token : tokens) {
            if (haystack.contains(token)) {
                score++;
            }
        }
        return score;
    }
}
