package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.mcp.ToolTransport;
import com.smurthy.ai.shopping.mcp.endpoints.CatalogToolEndpoint;
import com.smurthy.ai.shopping.mcp.endpoints.EmissionsToolEndpoint;
import com.smurthy.ai.shopping.session.SessionState;
import com.smurthy.ai.shopping.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Specialized Agent for Carbon Footprint Questions
 *
 * Answers three kinds of question:
 * - the running footprint of the shopper's cart (also the follow-up after every cart change)
 * - the footprint of a specific product
 * - the shipping options and what each costs in CO2
 *
 * Alongside product discovery it ranks the matching products by footprint.
 */
@Component
public class Co2CalculatorAgent implements ShoppingAgent {

    public static final String NAME = "Co2CalculatorAgent";

    private static final Logger log = LoggerFactory.getLogger(Co2CalculatorAgent.class);
    private static final int MAX_RANKED = 5;

    private final ToolTransport transport;
    private final SessionStore sessionStore;

    public Co2CalculatorAgent(ToolTransport transport, SessionStore sessionStore) {
        this.transport = transport;
        this.sessionStore = sessionStore;
        log.info("{} initialized", NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Calculates product, shipping and cart carbon footprints";
    }

    @Override
    public Set<String> capabilities() {
        return Set.of(Intent.FOOTPRINT.capability(), Intent.PRODUCT_SEARCH.capability());
    }

    @Override
    public AgentResult handle(AgentRequest request) {
        TaskDescriptor task = request.task();
        log.debug("[{}] Processing {}: {}", NAME, task.intent(), task.originText());
        long startTime = System.currentTimeMillis();

        AgentResult result;
        if (task.intent() == Intent.PRODUCT_SEARCH) {
            result = rankSearchResults(request, startTime);
        } else if (asksForShippingOptions(task)) {
            result = shippingOptions(request, startTime);
        } else if (task.depth() == 0 && task.stringParam("product_id") != null) {
            result = productFootprint(request, task.stringParam("product_id"), startTime);
        } else if (task.depth() == 0 && task.stringParam("product_query") != null && !mentionsCart(task)) {
            result = queryFootprint(request, startTime);
        } else {
            result = cartFootprint(task.sessionId(), startTime);
        }

        log.info("[{}] Completed in {}ms", NAME, result.executionTimeMs());
        return result;
    }

    private AgentResult cartFootprint(String sessionId, long startTime) {
        SessionState state = sessionStore.viewCart(sessionId);
        String text;
        if (state.isCartEmpty()) {
            text = "Your cart is empty, so its footprint is " + Formats.kg(0) + ".";
        } else {
            String shipping = state.selectedShippingMethod() == null
                    ? "no shipping selected yet"
                    : state.selectedShippingMethod() + " shipping " + Formats.kg(state.shippingFootprintKg());
            text = String.format(Locale.ROOT, "Cart footprint: %s from %d item(s) + %s = %s total (%s).",
                    Formats.kg(state.productFootprintKg()), state.itemCount(), shipping,
                    Formats.kg(state.totalFootprintKg()), state.ecoRating());
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("product_footprint_kg", state.productFootprintKg());
        data.put("shipping_footprint_kg", state.shippingFootprintKg());
        data.put("total_footprint_kg", state.totalFootprintKg());
        data.put("eco_rating", state.ecoRating());
        return AgentResult.success(NAME, text, System.currentTimeMillis() - startTime, data);
    }

    private AgentResult productFootprint(AgentRequest request, String productId, long startTime) {
        JsonNode out = transport.invoke(EmissionsToolEndpoint.ENDPOINT_ID, "calculate_product_co2",
                Map.of("product_id", productId), request.context());
        String text = String.format(Locale.ROOT, "%s has an estimated footprint of %s (%s).",
                out.path("name").asText(), Formats.kg(out.path("footprint_kg").asDouble()),
                out.path("eco_rating").asText());
        return AgentResult.success(NAME, text, System.currentTimeMillis() - startTime,
                Map.of("product_id", productId, "footprint_kg", out.path("footprint_kg").asDouble()));
    }

    private AgentResult queryFootprint(AgentRequest request, long startTime) {
        JsonNode found = transport.invoke(CatalogToolEndpoint.ENDPOINT_ID, "search_products",
                ProductDiscoveryAgent.searchArguments(request.task(), 1), request.context());
        JsonNode first = found.path("products").path(0);
        if (first.isMissingNode()) {
            return cartFootprint(request.sessionId(), startTime);
        }
        return productFootprint(request, first.path("id").asText(), startTime);
    }

    private AgentResult shippingOptions(AgentRequest request, long startTime) {
        JsonNode out = transport.invoke(EmissionsToolEndpoint.ENDPOINT_ID, "shipping_options",
                Map.of(), request.context());
        StringBuilder text = new StringBuilder("Shipping options, greenest first:");
        List<Map<String, Object>> options = new ArrayList<>();
        for (JsonNode option : out.path("options")) {
            text.append(String.format(Locale.ROOT, "%n- %s (%s): %s, %s, %s days",
                    option.path("name").asText(), option.path("method").asText(),
                    Formats.usd(option.path("cost_usd").asDouble()), Formats.kg(option.path("footprint_kg").asDouble()),
                    option.path("delivery_days").asText()));
            options.add(Map.of("method", option.path("method").asText(),
                    "footprint_kg", option.path("footprint_kg").asDouble(),
                    "cost_usd", option.path("cost_usd").asDouble()));
        }
        return AgentResult.success(NAME, text.toString(), System.currentTimeMillis() - startTime,
                Map.of("shipping_options", options));
    }

    private AgentResult rankSearchResults(AgentRequest request, long startTime) {
        JsonNode found = transport.invoke(CatalogToolEndpoint.ENDPOINT_ID, "search_products",
                ProductDiscoveryAgent.searchArguments(request.task(), MAX_RANKED), request.context());

        List<Map<String, Object>> ranked = new ArrayList<>();
        for (JsonNode product : found.path("products")) {
            request.context().cancellationToken().throwIfCancelled();
            JsonNode co2 = transport.invoke(EmissionsToolEndpoint.ENDPOINT_ID, "calculate_product_co2",
                    Map.of("product_id", product.path("id").asText()), request.context());
            ranked.add(Map.of("id", product.path("id").asText(),
                    "name", product.path("name").asText(),
                    "footprint_kg", co2.path("footprint_kg").asDouble()));
        }
        ranked.sort(Comparator.comparingDouble(m -> (Double) m.get("footprint_kg")));

        if (ranked.isEmpty()) {
            return AgentResult.success(NAME, "No matching products to rate for footprint.",
                    System.currentTimeMillis() - startTime, Map.of("footprints", ranked));
        }
        StringBuilder text = new StringBuilder("Lowest-footprint matches:");
        ranked.forEach(m -> text.append("\n- ").append(m.get("name")).append(": ")
                .append(Formats.kg((Double) m.get("footprint_kg"))));
        return AgentResult.success(NAME, text.toString(), System.currentTimeMillis() - startTime,
                Map.of("footprints", ranked));
    }

    private static boolean asksForShippingOptions(TaskDescriptor task) {
        String text = task.originText() == null ? "" : task.originText().toLowerCase(Locale.ROOT);
        return task.depth() == 0 && text.contains("shipping option");
    }

    private static boolean mentionsCart(TaskDescriptor task) {
        String text = task.originText() == null ? "" : task.originText().toLowerCase(Locale.ROOT);
        return text.contains("cart") || text.contains("basket") || text.contains("order") || text.contains("total");
    }
}
