package com.smurthy.ai.shopping.service;

import java.util.List;

/**
 * Pure mapping from product attributes and shipping methods to kg CO2e.
 */
public interface EmissionsDataProvider {

    double productFootprintKg(Product product);

    /**
     * @throws IllegalArgumentException if the method is not a known shipping method
     */
    double shippingFootprintKg(String method);

    /**
     * Known shipping options, greenest first.
     */
    List<ShippingOption> shippingOptions();
}
