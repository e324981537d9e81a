package com.smurthy.ai.shopping.service;

public record ShippingOption(
        String method,
        String name,
        double costUsd,
        double footprintKg,
        String ecoRating,
        String deliveryDays
) {
}
