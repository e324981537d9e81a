package com.smurthy.ai.shopping.mcp.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smurthy.ai.shopping.mcp.InputSchema;
import com.smurthy.ai.shopping.mcp.PromptTemplate;
import com.smurthy.ai.shopping.mcp.ResourceDescriptor;
import com.smurthy.ai.shopping.mcp.ToolDescriptor;
import com.smurthy.ai.shopping.mcp.ToolEndpoint;
import com.smurthy.ai.shopping.mcp.ToolErrorCode;
import com.smurthy.ai.shopping.mcp.ToolInvocationException;
import com.smurthy.ai.shopping.service.CatalogQuery;
import com.smurthy.ai.shopping.service.CatalogService;
import com.smurthy.ai.shopping.service.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Boutique Catalog Tools
 *
 * Exposes the product catalog over the tool transport: product search, lookup by id and the
 * category list, plus the catalog itself as readable resources.
 */
@Component
public class CatalogToolEndpoint extends ToolEndpoint {

    public static final String ENDPOINT_ID = "boutique";

    private static final Logger log = LoggerFactory.getLogger(CatalogToolEndpoint.class);

    private final CatalogService catalogService;

    public CatalogToolEndpoint(CatalogService catalogService, ObjectMapper objectMapper) {
        super(ENDPOINT_ID, "1.0.0", objectMapper);
        this.catalogService = catalogService;

        registerTool(new ToolDescriptor("search_products",
                        "Search the boutique catalog by free text, category and price range.",
                        InputSchema.object(objectMapper)
                                .property("query", "string", "Free-text search, e.g. 'sunglasses'", false)
                                .property("category", "string", "Category filter, e.g. 'kitchen'", false)
                                .property("min_price", "number", "Minimum price in USD", false)
                                .property("max_price", "number", "Maximum price in USD", false)
                                .property("limit", "integer", "Maximum number of results (default 10)", false)
                                .build()),
                this::searchProducts);
        registerTool(new ToolDescriptor("get_product",
                        "Get full details for one product by its catalog id.",
                        InputSchema.object(objectMapper)
                                .property("product_id", "string", "Catalog product id, e.g. 'OLJCESPC7Z'", true)
                                .build()),
                this::getProduct);
        registerTool(new ToolDescriptor("list_categories",
                        "List every product category in the catalog.",
                        InputSchema.object(objectMapper).build()),
                args -> categoriesNode());

        registerResource(new ResourceDescriptor("catalog://categories", "Product categories",
                "All categories in the boutique catalog", "application/json"),
                () -> toJson(catalogService.categories()));
        registerResource(new ResourceDescriptor("catalog://products", "Product catalog",
                "Every product with price and materials", "application/json"),
                () -> toJson(catalogService.search(new CatalogQuery(null, null, null, null, Integer.MAX_VALUE))));

        registerPrompt(new PromptTemplate("product_recommendation",
                "Recommend boutique products for a shopper's stated preferences",
                List.of(new PromptTemplate.Argument("preferences", "What the shopper is looking for", true),
                        new PromptTemplate.Argument("budget", "Maximum spend in USD", false)),
                """
                        Recommend products from the boutique catalog for a shopper who wants: {{preferences}}.
                        Budget: {{budget}}.
                        Prefer items with a lower carbon footprint when two items serve the same need, \
                        and mention the footprint of each recommendation."""));
    }

    private JsonNode searchProducts(JsonNode args) {
        Double minPrice = optionalNumber(args, "min_price");
        Double maxPrice = optionalNumber(args, "max_price");
        Double limit = optionalNumber(args, "limit");
        CatalogQuery query = new CatalogQuery(optionalText(args, "query"), optionalText(args, "category"),
                minPrice, maxPrice, limit == null ? CatalogQuery.DEFAULT_LIMIT : limit.intValue());

        log.info("[TOOL] search_products: {}", query);
        List<Product> products = catalogService.search(query);

        ObjectNode result = objectMapper.createObjectNode();
        result.put("count", products.size());
        ArrayNode list = result.putArray("products");
        products.forEach(p -> list.add(productNode(objectMapper, p)));
        return result;
    }

    private JsonNode getProduct(JsonNode args) {
        String productId = requireText(args, "product_id");
        log.info("[TOOL] get_product: {}", productId);
        Product product = catalogService.findById(productId)
                .orElseThrow(() -> new ToolInvocationException(ToolErrorCode.NOT_FOUND,
                        "Product '" + productId + "' not found"));
        return productNode(objectMapper, product);
    }

    private JsonNode categoriesNode() {
        ObjectNode result = objectMapper.createObjectNode();
        catalogService.categories().forEach(result.putArray("categories")::add);
        return result;
    }

    static ObjectNode productNode(ObjectMapper mapper, Product product) {
        ObjectNode node = mapper.createObjectNode()
                .put("id", product.id())
                .put("name", product.name())
                .put("description", product.description())
                .put("price_usd", product.priceUsd())
                .put("category", product.primaryCategory())
                .put("picture", product.picture());
        product.categories().forEach(node.putArray("categories")::add);
        product.materials().forEach(node.putArray("materials")::add);
        return node;
    }
}
