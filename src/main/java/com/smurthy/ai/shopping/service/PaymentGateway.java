package com.smurthy.ai.shopping.service;

public interface PaymentGateway {

    PaymentOutcome charge(String sessionId, double amountUsd);
}
