package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.InvalidSessionStateException;
import com.smurthy.ai.shopping.mcp.ToolTransport;
import com.smurthy.ai.shopping.mcp.endpoints.CatalogToolEndpoint;
import com.smurthy.ai.shopping.mcp.endpoints.EmissionsToolEndpoint;
import com.smurthy.ai.shopping.session.CartItem;
import com.smurthy.ai.shopping.session.SessionState;
import com.smurthy.ai.shopping.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Specialized Agent for Cart Operations
 *
 * Adds, removes, clears and lists cart lines. Products are resolved through the catalog tools
 * and priced for footprint through the CO2 tools before they reach the session store.
 * Every change that leaves items in the cart asks for a footprint follow-up.
 */
@Component
public class CartManagementAgent implements ShoppingAgent {

    public static final String NAME = "CartManagementAgent";

    private static final Logger log = LoggerFactory.getLogger(CartManagementAgent.class);

    private final ToolTransport transport;
    private final SessionStore sessionStore;

    public CartManagementAgent(ToolTransport transport, SessionStore sessionStore) {
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
        return "Adds, removes and lists items in the shopper's cart";
    }

    @Override
    public Set<String> capabilities() {
        return Set.of(Intent.CART_ADD.capability(), Intent.CART_REMOVE.capability(),
                Intent.CART_CLEAR.capability(), Intent.CART_VIEW.capability());
    }

    @Override
    public AgentResult handle(AgentRequest request) {
        TaskDescriptor task = request.task();
        log.debug("[{}] Processing {} for session {}", NAME, task.intent(), task.sessionId());
        long startTime = System.currentTimeMillis();

        try {
            AgentResult result = switch (task.intent()) {
                case CART_ADD -> add(request, startTime);
                case CART_REMOVE -> remove(request, startTime);
                case CART_CLEAR -> clear(request, startTime);
                default -> view(task.sessionId(), startTime);
            };
            log.info("[{}] {} completed in {}ms", NAME, task.intent(), result.executionTimeMs());
            return result;
        } catch (InvalidSessionStateException e) {
            long elapsed = System.currentTimeMillis() - startTime;
            log.warn("[{}] {} rejected for session {}: {}", NAME, task.intent(), task.sessionId(), e.getMessage());
            return AgentResult.failure(NAME, e.getMessage(), elapsed, ErrorKind.INVALID_SESSION_STATE);
        }
    }

    private AgentResult add(AgentRequest request, long startTime) {
        TaskDescriptor task = request.task();
        Optional<JsonNode> product = resolveProduct(request);
        if (product.isEmpty()) {
            return AgentResult.failure(NAME, "Which product would you like to add? I couldn't find a match.",
                    System.currentTimeMillis() - startTime, ErrorKind.INVALID_REQUEST);
        }
        String productId = product.get().path("id").asText();
        int quantity = Math.max(1, task.intParam("quantity", 1));

        JsonNode co2 = transport.invoke(EmissionsToolEndpoint.ENDPOINT_ID, "calculate_product_co2",
                Map.of("product_id", productId), request.context());
        CartItem item = CartItem.of(productId, product.get().path("name").asText(),
                product.get().path("price_usd").asDouble(), quantity, co2.path("footprint_kg_per_unit").asDouble());

        // the task id is stable across router retries, so a retried add is applied once
        SessionState state = sessionStore.addToCart(task.sessionId(), item, task.id() + ":add:" + productId,
                request.context());

        String text = String.format(Locale.ROOT, "Added %d x %s to your cart (%s). Cart now has %d item(s).",
                quantity, item.name(), Formats.kg(item.lineFootprintKg()), state.itemCount());
        return AgentResult.success(NAME, text, System.currentTimeMillis() - startTime,
                        Map.of("product_id", productId, "item_count", state.itemCount(),
                                "product_footprint_kg", state.productFootprintKg()))
                .withFollowUps(List.of(FollowUp.of(Intent.FOOTPRINT, Co2CalculatorAgent.NAME, "cart changed")));
    }

    private AgentResult remove(AgentRequest request, long startTime) {
        TaskDescriptor task = request.task();
        SessionState current = sessionStore.viewCart(task.sessionId());
        Optional<CartItem> line = findLine(current, task);
        if (line.isEmpty()) {
            return AgentResult.success(NAME, "That item isn't in your cart, so nothing changed.",
                    System.currentTimeMillis() - startTime);
        }
        SessionState state = sessionStore.removeFromCart(task.sessionId(), line.get().itemId(), request.context());
        AgentResult result = AgentResult.success(NAME,
                "Removed " + line.get().name() + " from your cart.",
                System.currentTimeMillis() - startTime,
                Map.of("item_count", state.itemCount(), "product_footprint_kg", state.productFootprintKg()));
        return state.isCartEmpty() ? result
                : result.withFollowUps(List.of(FollowUp.of(Intent.FOOTPRINT, Co2CalculatorAgent.NAME, "cart changed")));
    }

    private AgentResult clear(AgentRequest request, long startTime) {
        sessionStore.clearCart(request.sessionId(), request.context());
        return AgentResult.success(NAME, "Your cart is now empty.", System.currentTimeMillis() - startTime,
                Map.of("item_count", 0));
    }

    private AgentResult view(String sessionId, long startTime) {
        SessionState state = sessionStore.viewCart(sessionId);
        if (state.isCartEmpty()) {
            return AgentResult.success(NAME, "Your cart is empty.", System.currentTimeMillis() - startTime,
                    Map.of("item_count", 0));
        }
        StringBuilder text = new StringBuilder("Your cart:");
        for (CartItem line : state.cartItems()) {
            text.append(String.format(Locale.ROOT, "%n- %d x %s %s (%s)", line.quantity(), line.name(),
                    Formats.usd(line.linePriceUsd()), Formats.kg(line.lineFootprintKg())));
        }
        text.append(String.format(Locale.ROOT, "%nSubtotal %s, total footprint %s (%s).",
                Formats.usd(state.subtotalUsd()), Formats.kg(state.totalFootprintKg()), state.ecoRating()));
        return AgentResult.success(NAME, text.toString(), System.currentTimeMillis() - startTime,
                Map.of("item_count", state.itemCount(), "total_footprint_kg", state.totalFootprintKg()));
    }

    private Optional<JsonNode> resolveProduct(AgentRequest request) {
        TaskDescriptor task = request.task();
        String productId = task.stringParam("product_id");
        if (productId != null) {
            return Optional.of(transport.invoke(CatalogToolEndpoint.ENDPOINT_ID, "get_product",
                    Map.of("product_id", productId), request.context()));
        }
        if (task.stringParam("product_query") == null && task.stringParam("category") == null) {
            return Optional.empty();
        }
        JsonNode found = transport.invoke(CatalogToolEndpoint.ENDPOINT_ID, "search_products",
                ProductDiscoveryAgent.searchArguments(task, 1), request.context());
        JsonNode first = found.path("products").path(0);
        return first.isMissingNode() ? Optional.empty() : Optional.of(first);
    }

    private static Optional<CartItem> findLine(SessionState state, TaskDescriptor task) {
        String productId = task.stringParam("product_id");
        if (productId != null) {
            return state.cartItems().stream().filter(l -> l.productId().equals(productId)).findFirst();
        }
        String query = task.stringParam("product_query");
        if (query == null) {
            return Optional.empty();
        }
        List<String> words = Arrays.asList(query.toLowerCase(Locale.ROOT).split("\\s+"));
        return state.cartItems().stream()
                .filter(l -> words.stream().anyMatch(w -> matchesName(l.name(), w)))
                .findFirst();
    }

    private static boolean matchesName(String name, String word) {
        String lower = name.toLowerCase(Locale.ROOT);
        String singular = word.length() > 4 && word.endsWith("s") ? word.substring(0, word.length() - 1) : word;
        return lower.contains(word) || lower.contains(singular);
    }
}
