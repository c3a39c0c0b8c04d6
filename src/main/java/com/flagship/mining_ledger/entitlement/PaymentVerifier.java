package com.flagship.mining_ledger.entitlement;

import java.math.BigDecimal;

/**
 * Checks a payment proof against the amount a purchase costs.
 *
 * Implementations may call out to a chain explorer or payment processor; a
 * thrown exception is treated as an infrastructure failure, not as a rejected
 * payment.
 */
public interface PaymentVerifier {

    boolean verify(String paymentProof, BigDecimal expectedAmount);
}
