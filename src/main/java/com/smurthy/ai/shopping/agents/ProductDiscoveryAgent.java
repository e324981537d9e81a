package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.mcp.ToolTransport;
import com.smurthy.ai.shopping.mcp.endpoints.CatalogToolEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Specialized Agent for Product Discovery
 *
 * Searches the boutique catalog by the product words, category and price limits extracted
 * from the request. Its {@code product_ids} output feeds the comparison agent in a
 * sequential chain.
 */
@Component
public class ProductDiscoveryAgent implements ShoppingAgent {

    public static final String NAME = "ProductDiscoveryAgent";

    private static final Logger log = LoggerFactory.getLogger(ProductDiscoveryAgent.class);
    private static final int MAX_RESULTS = 5;

    private final ToolTransport transport;

    public ProductDiscoveryAgent(ToolTransport transport) {
        this.transport = transport;
        log.info("{} initialized", NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Finds boutique products by description, category and price range";
    }

    @Override
    public Set<String> capabilities() {
        return Set.of(Intent.PRODUCT_SEARCH.capability(), Intent.COMPARE.capability());
    }

    @Override
    public AgentResult handle(AgentRequest request) {
        TaskDescriptor task = request.task();
        log.debug("[{}] Processing: {}", NAME, task.originText());
        long startTime = System.currentTimeMillis();

        JsonNode output = transport.invoke(CatalogToolEndpoint.ENDPOINT_ID, "search_products",
                searchArguments(task, MAX_RESULTS), request.context());

        List<Map<String, Object>> products = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (JsonNode product : output.path("products")) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("id", product.path("id").asText());
            summary.put("name", product.path("name").asText());
            summary.put("price_usd", product.path("price_usd").asDouble());
            summary.put("category", product.path("category").asText());
            products.add(summary);
            ids.add(product.path("id").asText());
            text.append("\n- ").append(product.path("name").asText())
                    .append(" (").append(Formats.usd(product.path("price_usd").asDouble())).append(")")
                    .append(" [").append(product.path("id").asText()).append("]");
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("[{}] Found {} products in {}ms", NAME, products.size(), elapsed);

        String result = products.isEmpty()
                ? "I couldn't find any products matching that. Try a different description or category."
                : "Here's what I found:" + text;
        return AgentResult.success(NAME, result, elapsed, Map.of("products", products, "product_ids", ids));
    }

    static Map<String, Object> searchArguments(TaskDescriptor task, int limit) {
        Map<String, Object> args = new LinkedHashMap<>();
        if (task.stringParam("product_query") != null) {
            args.put("query", task.stringParam("product_query"));
        }
        if (task.stringParam("category") != null) {
            args.put("category", task.stringParam("category"));
        }
        if (task.doubleParam("min_price") != null) {
            args.put("min_price", task.doubleParam("min_price"));
        }
        if (task.doubleParam("max_price") != null) {
            args.put("max_price", task.doubleParam("max_price"));
        }
        args.put("limit", limit);
        return args;
    }
}
