package com.smurthy.ai.shopping.agents;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.smurthy.ai.shopping.config.SessionProperties;
import com.smurthy.ai.shopping.errors.ErrorKind;
import com.smurthy.ai.shopping.mcp.ToolTransport;
import com.smurthy.ai.shopping.service.PaymentGateway;
import com.smurthy.ai.shopping.service.PaymentOutcome;
import com.smurthy.ai.shopping.session.CartItem;
import com.smurthy.ai.shopping.session.Lifecycle;
import com.smurthy.ai.shopping.session.SessionState;
import com.smurthy.ai.shopping.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.AdditionalMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CheckoutAgent with the tool transport and payment gateway mocked.
 *
 * Tests:
 * - Shipping selection folds the tool's footprint into the session
 * - Payment charges subtotal plus shipping and resets the session
 * - Declined payments and empty carts leave the session untouched
 */
@ExtendWith(MockitoExtension.class)
class CheckoutAgentTest {

    private static final String SESSION = "checkout-session";

    @Mock
    private ToolTransport transport;

    @Mock
    private PaymentGateway paymentGateway;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IntentClassifier classifier = new IntentClassifier();

    private SessionStore sessionStore;
    private CheckoutAgent agent;

    @BeforeEach
    void setUp() {
        sessionStore = new SessionStore(SessionProperties.defaults(), Clock.systemUTC());
        agent = new CheckoutAgent(transport, sessionStore, paymentGateway);
    }

    private AgentResult ask(String text) {
        return agent.handle(AgentRequest.of(classifier.classify(text, SESSION)));
    }

    private void cartWithSunglasses() {
        sessionStore.addToCart(SESSION, CartItem.of("OLJCESPC7Z", "Sunglasses", 19.99, 1, 49.0), "seed");
    }

    private ObjectNode ecoOption() {
        ObjectNode out = objectMapper.createObjectNode();
        out.putArray("options").addObject()
                .put("method", "eco")
                .put("cost_usd", 7.99)
                .put("footprint_kg", 150.0);
        return out;
    }

    @Test
    @DisplayName("Selecting shipping stores the footprint returned by the emissions tool")
    void selectsShipping() {
        cartWithSunglasses();
        when(transport.invoke(eq("co2"), eq("calculate_shipping_co2"), anyMap(), any()))
                .thenReturn(objectMapper.createObjectNode().put("method", "eco").put("footprint_kg", 150.0));

        AgentResult result = ask("use eco shipping");

        assertThat(result.success()).isTrue();
        assertThat(result.result()).contains("eco").contains("199.00 kg CO2e");
        SessionState state = sessionStore.viewCart(SESSION);
        assertThat(state.selectedShippingMethod()).isEqualTo("eco");
        assertThat(state.totalFootprintKg()).isCloseTo(199.0, within(1e-9));
    }

    @Test
    @DisplayName("Shipping selection without a method asks which one")
    void asksForShippingMethod() {
        cartWithSunglasses();

        AgentResult result = ask("choose my shipping");

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.INVALID_REQUEST);
        verifyNoInteractions(transport);
    }

    @Test
    @DisplayName("Payment charges subtotal plus shipping cost and completes the order")
    void paysAndResets() {
        cartWithSunglasses();
        sessionStore.selectShipping(SESSION, "eco", 150.0);
        when(transport.invoke(eq("co2"), eq("shipping_options"), anyMap(), any())).thenReturn(ecoOption());
        when(paymentGateway.charge(eq(SESSION), AdditionalMatchers.eq(27.98, 1e-9))).thenReturn(PaymentOutcome.approved("PAY-1"));

        AgentResult result = ask("pay now");

        assertThat(result.success()).isTrue();
        assertThat(result.data()).containsEntry("payment_reference", "PAY-1");
        assertThat((Double) result.data().get("total_footprint_kg")).isCloseTo(199.0, within(1e-9));
        SessionState state = sessionStore.viewCart(SESSION);
        assertThat(state.lifecycle()).isEqualTo(Lifecycle.ACTIVE);
        assertThat(state.isCartEmpty()).isTrue();
        assertThat(state.totalFootprintKg()).isZero();
    }

    @Test
    @DisplayName("A declined charge leaves the cart in checkout")
    void declinedCharge() {
        cartWithSunglasses();
        when(paymentGateway.charge(eq(SESSION), AdditionalMatchers.eq(19.99, 1e-9))).thenReturn(PaymentOutcome.declined("insufficient funds"));

        AgentResult result = ask("pay now");

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.UPSTREAM_INVOCATION_ERROR);
        assertThat(result.result()).contains("insufficient funds");
        SessionState state = sessionStore.viewCart(SESSION);
        assertThat(state.lifecycle()).isEqualTo(Lifecycle.CHECKOUT);
        assertThat(state.productFootprintKg()).isCloseTo(49.0, within(1e-9));
    }

    @Test
    @DisplayName("Paying with an empty cart is an invalid session state")
    void emptyCartPayment() {
        AgentResult result = ask("pay now");

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.INVALID_SESSION_STATE);
        verifyNoInteractions(paymentGateway, transport);
    }

    @Test
    @DisplayName("Checkout moves the session forward and nudges toward eco shipping")
    void checkout() {
        cartWithSunglasses();

        AgentResult result = ask("checkout");

        assertThat(result.success()).isTrue();
        assertThat(result.result()).contains("eco shipping");
        assertThat(sessionStore.viewCart(SESSION).lifecycle()).isEqualTo(Lifecycle.CHECKOUT);
        verify(paymentGateway, never()).charge(any(), anyDouble());
    }
}
