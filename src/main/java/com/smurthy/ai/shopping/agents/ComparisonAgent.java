package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.mcp.ToolTransport;
import com.smurthy.ai.shopping.mcp.endpoints.ComparisonToolEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Specialized Agent for Product Comparison
 *
 * Compares the products found earlier in the chain (or named by id in the request) by
 * footprint and points out the greenest choice.
 */
@Component
public class ComparisonAgent implements ShoppingAgent {

    public static final String NAME = "ComparisonAgent";

    private static final Logger log = LoggerFactory.getLogger(ComparisonAgent.class);
    private static final int MAX_COMPARED = 5;

    private final ToolTransport transport;

    public ComparisonAgent(ToolTransport transport) {
        this.transport = transport;
        log.info("{} initialized", NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Compares products by price and carbon footprint";
    }

    @Override
    public Set<String> capabilities() {
        return Set.of(Intent.COMPARE.capability());
    }

    @Override
    public AgentResult handle(AgentRequest request) {
        log.debug("[{}] Processing: {}", NAME, request.task().originText());
        long startTime = System.currentTimeMillis();

        List<String> ids = productIds(request);
        if (ids.size() < 2) {
            return AgentResult.failure(NAME, "I need at least two products to compare.",
                    System.currentTimeMillis() - startTime, ErrorKind.INVALID_REQUEST);
        }

        JsonNode out = transport.invoke(ComparisonToolEndpoint.ENDPOINT_ID, "compare_products",
                Map.of("product_ids", ids), request.context());

        StringBuilder text = new StringBuilder();
        JsonNode greenest = out.path("greenest");
        text.append(String.format(Locale.ROOT, "Greenest choice: %s at %s (%s).",
                greenest.path("name").asText(), Formats.kg(greenest.path("footprint_kg").asDouble()),
                Formats.usd(greenest.path("price_usd").asDouble())));
        for (JsonNode product : out.path("products")) {
            text.append(String.format(Locale.ROOT, "%n- %s: %s, %s", product.path("name").asText(),
                    Formats.kg(product.path("footprint_kg").asDouble()), Formats.usd(product.path("price_usd").asDouble())));
        }
        double savings = out.path("savings_kg").asDouble();
        if (savings > 0) {
            text.append(String.format(Locale.ROOT, "%nPicking it over the highest-footprint option saves %s.",
                    Formats.kg(savings)));
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("[{}] Compared {} products in {}ms", NAME, ids.size(), elapsed);
        return AgentResult.success(NAME, text.toString(), elapsed,
                Map.of("greenest_id", greenest.path("id").asText(), "savings_kg", savings));
    }

    private static List<String> productIds(AgentRequest request) {
        List<String> ids = new ArrayList<>();
        Object fromChain = request.priorData("product_ids").orElse(request.task().parameters().get("product_ids"));
        if (fromChain instanceof List<?> list) {
            list.stream().map(Object::toString).distinct().limit(MAX_COMPARED).forEach(ids::add);
        }
        return ids;
    }
}
