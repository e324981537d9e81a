package com.smurthy.ai.shopping.mcp.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smurthy.ai.shopping.mcp.InputSchema;
import com.smurthy.ai.shopping.mcp.PromptTemplate;
import com.smurthy.ai.shopping.mcp.ToolDescriptor;
import com.smurthy.ai.shopping.mcp.ToolEndpoint;
import com.smurthy.ai.shopping.mcp.ToolErrorCode;
import com.smurthy.ai.shopping.mcp.ToolInvocationException;
import com.smurthy.ai.shopping.service.CatalogService;
import com.smurthy.ai.shopping.service.EmissionsDataProvider;
import com.smurthy.ai.shopping.service.Product;
import com.smurthy.ai.shopping.session.EcoRating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks a set of products by footprint and names the greenest one.
 */
@Component
public class ComparisonToolEndpoint extends ToolEndpoint {

    public static final String ENDPOINT_ID = "comparison";

    private static final Logger log = LoggerFactory.getLogger(ComparisonToolEndpoint.class);

    private record Scored(Product product, double footprintKg) {}

    private final CatalogService catalogService;
    private final EmissionsDataProvider emissions;

    public ComparisonToolEndpoint(CatalogService catalogService,
                                  EmissionsDataProvider emissions,
                                  ObjectMapper objectMapper) {
        super(ENDPOINT_ID, "1.0.0", objectMapper);
        this.catalogService = catalogService;
        this.emissions = emissions;

        registerTool(new ToolDescriptor("compare_products",
                        "Compare two or more catalog products by price and footprint, greenest first.",
                        InputSchema.object(objectMapper)
                                .stringArray("product_ids", "Catalog ids of the products to compare", true)
                                .build()),
                this::compareProducts);

        registerPrompt(new PromptTemplate("comparison_summary",
                "Summarize a product comparison for the shopper",
                List.of(new PromptTemplate.Argument("products", "Names of the compared products", true),
                        new PromptTemplate.Argument("greenest", "Name of the lowest-footprint product", false)),
                """
                        Compare {{products}} for the shopper. {{greenest}} has the lowest footprint.
                        Explain the price and carbon trade-off in two sentences."""));
    }

    private JsonNode compareProducts(JsonNode args) {
        List<String> ids = requireTextList(args, "product_ids");
        log.info("[TOOL] compare_products: {}", ids);

        List<Scored> scored = new ArrayList<>();
        for (String id : ids) {
            Product product = catalogService.findById(id)
                    .orElseThrow(() -> new ToolInvocationException(ToolErrorCode.NOT_FOUND,
                            "Product '" + id + "' not found"));
            scored.add(new Scored(product, emissions.productFootprintKg(product)));
        }
        scored.sort(Comparator.comparingDouble(Scored::footprintKg)
                .thenComparingDouble(s -> s.product().priceUsd()));

        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode ranked = result.putArray("products");
        scored.forEach(s -> ranked.add(scoredNode(s)));

        Scored greenest = scored.get(0);
        Scored worst = scored.get(scored.size() - 1);
        result.set("greenest", scoredNode(greenest));
        result.put("savings_kg", Math.round((worst.footprintKg() - greenest.footprintKg()) * 100.0) / 100.0);
        return result;
    }

    private ObjectNode scoredNode(Scored scored) {
        return objectMapper.createObjectNode()
                .put("id", scored.product().id())
                .put("name", scored.product().name())
                .put("price_usd", scored.product().priceUsd())
                .put("footprint_kg", scored.footprintKg())
                .put("eco_rating", EcoRating.of(scored.footprintKg()).label());
    }
}
