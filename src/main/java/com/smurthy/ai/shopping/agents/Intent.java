package com.smurthy.ai.shopping.agents;

/**
 * What the shopper asked for. Declaration order is classification precedence.
 * Each intent maps to the capability name handlers declare in the registry.
 */
public enum Intent {
    PAYMENT("payment"),
    CART_ADD("cart_add"),
    CART_REMOVE("cart_remove"),
    CART_CLEAR("cart_clear"),
    CART_VIEW("cart_view"),
    SHIPPING_SELECT("shipping_select"),
    CHECKOUT("checkout"),
    COMPARE("compare"),
    FOOTPRINT("footprint"),
    PRODUCT_SEARCH("product_search"),
    GENERAL("general");

    private final String capability;

    Intent(String capability) {
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
