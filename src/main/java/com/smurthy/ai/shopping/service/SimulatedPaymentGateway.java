package com.smurthy.ai.shopping.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Stand-in for the real payment backend: approves every positive charge unless configured to decline.
 */
@Service
public class SimulatedPaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPaymentGateway.class);

    private final boolean declineAll;

    public SimulatedPaymentGateway(@Value("${shopping.payment.decline-all:false}") boolean declineAll) {
        this.declineAll = declineAll;
    }

    @Override
    public PaymentOutcome charge(String sessionId, double amountUsd) {
        if (declineAll) {
            log.warn("Declining payment of ${} for session {} (decline-all enabled)", amountUsd, sessionId);
            return PaymentOutcome.declined("Payment declined by gateway");
        }
        if (amountUsd <= 0) {
            return PaymentOutcome.declined("Nothing to charge");
        }
        String reference = "PAY-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        log.info("Approved payment {} of ${} for session {}", reference, String.format("%.2f", amountUsd), sessionId);
        return PaymentOutcome.approved(reference);
    }
}
