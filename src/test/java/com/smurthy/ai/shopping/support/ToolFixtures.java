package com.smurthy.ai.shopping.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.shopping.config.EmissionsProperties;
import com.smurthy.ai.shopping.mcp.InProcessToolTransport;
import com.smurthy.ai.shopping.mcp.endpoints.CatalogToolEndpoint;
import com.smurthy.ai.shopping.mcp.endpoints.ComparisonToolEndpoint;
import com.smurthy.ai.shopping.mcp.endpoints.EmissionsToolEndpoint;
import com.smurthy.ai.shopping.observability.AssistantMetrics;
import com.smurthy.ai.shopping.service.CatalogService;
import com.smurthy.ai.shopping.service.EmissionsDataProvider;
import com.smurthy.ai.shopping.service.FactorEmissionsDataProvider;
import com.smurthy.ai.shopping.service.InMemoryCatalogService;
import org.springframework.core.io.ClassPathResource;

import java.time.Clock;
import java.util.List;

/**
 * Real catalog, emissions and tool endpoints wired without Spring.
 */
public final class ToolFixtures {

    public static final String SUNGLASSES = "OLJCESPC7Z";
    public static final String WATCH = "1YMWWN1N4O";
    public static final String MUG = "6E92ZMYYFZ";

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final EmissionsProperties emissionsProperties = EmissionsProperties.defaults();
    public final CatalogService catalog =
            new InMemoryCatalogService(new ClassPathResource("catalog/products.json"), objectMapper);
    public final EmissionsDataProvider emissions = new FactorEmissionsDataProvider(emissionsProperties);
    public final CatalogToolEndpoint catalogEndpoint = new CatalogToolEndpoint(catalog, objectMapper);
    public final EmissionsToolEndpoint emissionsEndpoint =
            new EmissionsToolEndpoint(catalog, emissions, emissionsProperties, objectMapper);
    public final ComparisonToolEndpoint comparisonEndpoint =
            new ComparisonToolEndpoint(catalog, emissions, objectMapper);
    public final AssistantMetrics metrics = new AssistantMetrics(Clock.systemUTC());
    public final InProcessToolTransport transport = new InProcessToolTransport(
            List.of(catalogEndpoint, emissionsEndpoint, comparisonEndpoint), objectMapper, metrics);
}
