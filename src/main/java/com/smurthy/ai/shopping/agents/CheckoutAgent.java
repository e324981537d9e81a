package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.errors.InvalidSessionStateException;
import com.smurthy.ai.shopping.mcp.ToolTransport;
import com.smurthy.ai.shopping.mcp.endpoints.EmissionsToolEndpoint;
import com.smurthy.ai.shopping.service.PaymentGateway;
import com.smurthy.ai.shopping.service.PaymentOutcome;
import com.smurthy.ai.shopping.session.Lifecycle;
import com.smurthy.ai.shopping.session.OrderConfirmation;
import com.smurthy.ai.shopping.session.SessionState;
import com.smurthy.ai.shopping.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Specialized Agent for Shipping, Checkout and Payment
 *
 * Shipping footprints come from the CO2 tools and replace whatever was selected before.
 * Payment moves a session through Checkout to Completed and back to a fresh Active cart;
 * a declined charge leaves the session in Checkout so the shopper can try again.
 */
@Component
public class CheckoutAgent implements ShoppingAgent {

    public static final String NAME = "CheckoutAgent";

    private static final Logger log = LoggerFactory.getLogger(CheckoutAgent.class);

    private final ToolTransport transport;
    private final SessionStore sessionStore;
    private final PaymentGateway paymentGateway;

    public CheckoutAgent(ToolTransport transport, SessionStore sessionStore, PaymentGateway paymentGateway) {
        this.transport = transport;
        this.sessionStore = sessionStore;
        this.paymentGateway = paymentGateway;
        log.info("{} initialized", NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Selects shipping, starts checkout and takes payment";
    }

    @Override
    public Set<String> capabilities() {
        return Set.of(Intent.SHIPPING_SELECT.capability(), Intent.CHECKOUT.capability(),
                Intent.PAYMENT.capability());
    }

    @Override
    public AgentResult handle(AgentRequest request) {
        TaskDescriptor task = request.task();
        log.debug("[{}] Processing {} for session {}", NAME, task.intent(), task.sessionId());
        long startTime = System.currentTimeMillis();

        try {
            AgentResult result = switch (task.intent()) {
                case SHIPPING_SELECT -> selectShipping(request, startTime);
                case PAYMENT -> pay(request, startTime);
                default -> checkout(request, startTime);
            };
            log.info("[{}] {} completed in {}ms", NAME, task.intent(), result.executionTimeMs());
            return result;
        } catch (InvalidSessionStateException e) {
            long elapsed = System.currentTimeMillis() - startTime;
            log.warn("[{}] {} rejected for session {}: {}", NAME, task.intent(), task.sessionId(), e.getMessage());
            return AgentResult.failure(NAME, e.getMessage(), elapsed, ErrorKind.INVALID_SESSION_STATE);
        }
    }

    private AgentResult selectShipping(AgentRequest request, long startTime) {
        String method = request.task().stringParam("shipping_method");
        if (method == null) {
            return AgentResult.failure(NAME, "Which shipping method would you like: eco, ground or express?",
                    System.currentTimeMillis() - startTime, ErrorKind.INVALID_REQUEST);
        }
        JsonNode co2 = transport.invoke(EmissionsToolEndpoint.ENDPOINT_ID, "calculate_shipping_co2",
                Map.of("method", method), request.context());
        double kg = co2.path("footprint_kg").asDouble();

        SessionState state = sessionStore.selectShipping(request.sessionId(), method, kg, request.context());
        String text = String.format(Locale.ROOT, "Selected %s shipping (%s). Your order's total footprint is now %s (%s).",
                method, Formats.kg(kg), Formats.kg(state.totalFootprintKg()), state.ecoRating());
        return AgentResult.success(NAME, text, System.currentTimeMillis() - startTime,
                Map.of("shipping_method", method, "shipping_footprint_kg", kg,
                        "total_footprint_kg", state.totalFootprintKg()));
    }

    private AgentResult checkout(AgentRequest request, long startTime) {
        SessionState state = sessionStore.checkout(request.sessionId(), request.context());
        StringBuilder text = new StringBuilder(String.format(Locale.ROOT,
                "Ready to check out: %d item(s), subtotal %s, total footprint %s (%s).",
                state.itemCount(), Formats.usd(state.subtotalUsd()), Formats.kg(state.totalFootprintKg()),
                state.ecoRating()));
        if (state.selectedShippingMethod() == null) {
            text.append(" You haven't picked shipping yet; eco shipping has the lowest footprint.");
        }
        text.append(" Say \"pay\" to place the order.");
        return AgentResult.success(NAME, text.toString(), System.currentTimeMillis() - startTime,
                Map.of("lifecycle", state.lifecycle().name(), "total_footprint_kg", state.totalFootprintKg()));
    }

    private AgentResult pay(AgentRequest request, long startTime) {
        String sessionId = request.sessionId();
        SessionState state = sessionStore.viewCart(sessionId);
        if (state.lifecycle() == Lifecycle.ACTIVE && !state.isCartEmpty()) {
            state = sessionStore.checkout(sessionId, request.context());
        }
        if (state.lifecycle() != Lifecycle.CHECKOUT) {
            throw new InvalidSessionStateException(sessionId, state.lifecycle(),
                    "Your cart is empty; add something before paying");
        }

        double amount = state.subtotalUsd() + shippingCost(request, state.selectedShippingMethod());
        request.context().cancellationToken().throwIfCancelled();
        PaymentOutcome outcome = paymentGateway.charge(sessionId, amount);
        if (!outcome.approved()) {
            return AgentResult.failure(NAME, "Payment was not approved: " + outcome.message(),
                    System.currentTimeMillis() - startTime, ErrorKind.UPSTREAM_INVOCATION_ERROR);
        }

        OrderConfirmation order = sessionStore.paymentSuccess(sessionId, outcome.reference(), request.context());
        String text = String.format(Locale.ROOT,
                "Order %s confirmed: %s charged, total footprint %s. Your cart has been reset.",
                order.orderId(), Formats.usd(amount), Formats.kg(order.totalFootprintKg()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", order.orderId());
        data.put("payment_reference", order.paymentReference());
        data.put("amount_usd", amount);
        data.put("total_footprint_kg", order.totalFootprintKg());
        return AgentResult.success(NAME, text, System.currentTimeMillis() - startTime, data);
    }

    private double shippingCost(AgentRequest request, String method) {
        if (method == null) {
            return 0.0;
        }
        JsonNode options = transport.invoke(EmissionsToolEndpoint.ENDPOINT_ID, "shipping_options",
                Map.of(), request.context());
        for (JsonNode option : options.path("options")) {
            if (option.path("method").asText().equalsIgnoreCase(method)) {
                return option.path("cost_usd").asDouble();
            }
        }
        return 0.0;
    }
}
