package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.mcp.ToolInvocationException;
import com.smurthy.ai.shopping.mcp.ToolTransport;
import com.smurthy.ai.shopping.mcp.endpoints.CatalogToolEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default handler for greetings, help and anything the classifier could not place.
 */
@Component
public class GeneralAssistantAgent implements ShoppingAgent {

    public static final String NAME = "GeneralAssistantAgent";

    private static final Logger log = LoggerFactory.getLogger(GeneralAssistantAgent.class);

    private static final String CAPABILITIES_TEXT = """
            I can help you shop with a lower carbon footprint:
            - find products ("find eco-friendly kitchen items under $20")
            - compare them ("compare sunglasses and watch")
            - manage your cart ("add sunglasses to my cart", "show my cart")
            - pick shipping ("use eco shipping") and check out ("checkout", "pay")
            - check footprints ("what's my cart footprint?")""";

    private final ToolTransport transport;

    public GeneralAssistantAgent(ToolTransport transport) {
        this.transport = transport;
        log.info("{} initialized", NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Greets the shopper and explains what the assistant can do";
    }

    @Override
    public Set<String> capabilities() {
        return Set.of(Intent.GENERAL.capability());
    }

    @Override
    public AgentResult handle(AgentRequest request) {
        TaskDescriptor task = request.task();
        long startTime = System.currentTimeMillis();

        StringBuilder text = new StringBuilder();
        if (task.isAmbiguous()) {
            text.append("I'm not sure what you meant by \"").append(task.originText()).append("\". ");
        } else {
            text.append("Hi! ");
        }
        text.append(CAPABILITIES_TEXT);

        List<String> categories = categories(request);
        if (!categories.isEmpty()) {
            text.append("\nCategories: ").append(String.join(", ", categories)).append('.');
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("[{}] Completed in {}ms (ambiguous: {})", NAME, elapsed, task.isAmbiguous());
        return AgentResult.success(NAME, text.toString(), elapsed, Map.of("categories", categories));
    }

    private List<String> categories(AgentRequest request) {
        try {
            JsonNode out = transport.invoke(CatalogToolEndpoint.ENDPOINT_ID, "list_categories", Map.of(),
                    request.context());
            List<String> categories = new ArrayList<>();
            out.path("categories").forEach(c -> categories.add(c.asText()));
            return categories;
        } catch (ToolInvocationException e) {
            // help text is still useful without the category list
            log.warn("[{}] Category lookup failed: {}", NAME, e.getMessage());
            return List.of();
        }
    }
}
