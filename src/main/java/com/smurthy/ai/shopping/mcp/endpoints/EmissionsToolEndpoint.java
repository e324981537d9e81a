package com.smurthy.ai.shopping.mcp.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smurthy.ai.shopping.config.EmissionsProperties;
import com.smurthy.ai.shopping.mcp.InputSchema;
import com.smurthy.ai.shopping.mcp.PromptTemplate;
import com.smurthy.ai.shopping.mcp.ResourceDescriptor;
import com.smurthy.ai.shopping.mcp.ToolDescriptor;
import com.smurthy.ai.shopping.mcp.ToolEndpoint;
import com.smurthy.ai.shopping.mcp.ToolErrorCode;
import com.smurthy.ai.shopping.mcp.ToolInvocationException;
import com.smurthy.ai.shopping.service.CatalogService;
import com.smurthy.ai.shopping.service.EmissionsDataProvider;
import com.smurthy.ai.shopping.service.Product;
import com.smurthy.ai.shopping.service.ShippingOption;
import com.smurthy.ai.shopping.session.EcoRating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CO2 Calculator Tools
 *
 * Footprint estimates for catalog products and shipping methods. Products are looked up in
 * the catalog by id; shipping is computed for the configured delivery distance.
 */
@Component
public class EmissionsToolEndpoint extends ToolEndpoint {

    public static final String ENDPOINT_ID = "co2";

    private static final Logger log = LoggerFactory.getLogger(EmissionsToolEndpoint.class);

    private final CatalogService catalogService;
    private final EmissionsDataProvider emissions;
    private final EmissionsProperties properties;

    public EmissionsToolEndpoint(CatalogService catalogService,
                                 EmissionsDataProvider emissions,
                                 EmissionsProperties properties,
                                 ObjectMapper objectMapper) {
        super(ENDPOINT_ID, "1.0.0", objectMapper);
        this.catalogService = catalogService;
        this.emissions = emissions;
        this.properties = properties;

        registerTool(new ToolDescriptor("calculate_product_co2",
                        "Estimate the manufacturing footprint (kg CO2e) of one unit of a catalog product.",
                        InputSchema.object(objectMapper)
                                .property("product_id", "string", "Catalog product id", true)
                                .property("quantity", "integer", "Number of units (default 1)", false)
                                .build()),
                this::calculateProductCo2);
        registerTool(new ToolDescriptor("calculate_shipping_co2",
                        "Estimate the delivery footprint (kg CO2e) for a shipping method.",
                        InputSchema.object(objectMapper)
                                .property("method", "string", "One of eco, ground, express", true)
                                .build()),
                this::calculateShippingCo2);
        registerTool(new ToolDescriptor("shipping_options",
                        "List available shipping methods with cost, footprint and delivery time, greenest first.",
                        InputSchema.object(objectMapper).build()),
                args -> shippingOptionsNode());

        registerResource(new ResourceDescriptor("co2://emission-factors", "Emission factors",
                "Factors used for product and shipping footprint estimates", "application/json"),
                () -> toJson(emissionFactors()));

        registerPrompt(new PromptTemplate("sustainability_tips",
                "Practical tips for lowering the footprint of an order",
                List.of(new PromptTemplate.Argument("category", "Product category the shopper is browsing", false),
                        new PromptTemplate.Argument("footprint_kg", "Current cart footprint in kg CO2e", false)),
                """
                        The shopper's cart currently has a footprint of {{footprint_kg}} kg CO2e \
                        and they are browsing {{category}}.
                        Suggest three practical ways to lower it: greener shipping, fewer separate \
                        orders, and lower-impact alternatives in the same category."""));
    }

    private JsonNode calculateProductCo2(JsonNode args) {
        String productId = requireText(args, "product_id");
        Double quantity = optionalNumber(args, "quantity");
        int units = quantity == null ? 1 : quantity.intValue();
        if (units <= 0) {
            throw new IllegalArgumentException("quantity must be positive");
        }
        log.info("[TOOL] calculate_product_co2: {} x{}", productId, units);

        Product product = catalogService.findById(productId)
                .orElseThrow(() -> new ToolInvocationException(ToolErrorCode.NOT_FOUND,
                        "Product '" + productId + "' not found"));
        double perUnit = emissions.productFootprintKg(product);
        double total = Math.round(perUnit * units * 100.0) / 100.0;

        return objectMapper.createObjectNode()
                .put("product_id", product.id())
                .put("name", product.name())
                .put("price_usd", product.priceUsd())
                .put("quantity", units)
                .put("footprint_kg_per_unit", perUnit)
                .put("footprint_kg", total)
                .put("eco_rating", EcoRating.of(total).label());
    }

    private JsonNode calculateShippingCo2(JsonNode args) {
        String method = requireText(args, "method");
        log.info("[TOOL] calculate_shipping_co2: {}", method);
        double kg = emissions.shippingFootprintKg(method);
        return objectMapper.createObjectNode()
                .put("method", method.trim().toLowerCase(Locale.ROOT))
                .put("distance_miles", properties.shippingDistanceMiles())
                .put("footprint_kg", kg)
                .put("eco_rating", EcoRating.of(kg).label());
    }

    private JsonNode shippingOptionsNode() {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode options = result.putArray("options");
        for (ShippingOption option : emissions.shippingOptions()) {
            options.addObject()
                    .put("method", option.method())
                    .put("name", option.name())
                    .put("cost_usd", option.costUsd())
                    .put("footprint_kg", option.footprintKg())
                    .put("eco_rating", option.ecoRating())
                    .put("delivery_days", option.deliveryDays());
        }
        return result;
    }

    private Map<String, Object> emissionFactors() {
        Map<String, Object> factors = new LinkedHashMap<>();
        factors.put("base_product_kg", properties.baseProductKg());
        factors.put("price_ceiling_usd", properties.priceCeilingUsd());
        factors.put("min_product_factor", properties.minProductFactor());
        factors.put("shipping_distance_miles", properties.shippingDistanceMiles());
        Map<String, Double> shipping = new LinkedHashMap<>();
        emissions.shippingOptions().forEach(o ->
                shipping.put(o.method(), o.footprintKg() / properties.shippingDistanceMiles()));
        factors.put("shipping_kg_per_mile", shipping);
        return factors;
    }
}
