package com.flagship.mining_ledger.entitlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Accepts any transaction hash longer than 10 characters. No chain is queried.
 */
@Component
@Slf4j
public class StubPaymentVerifier implements PaymentVerifier {

    static final int MIN_PROOF_LENGTH = 11;

    @Override
    public boolean verify(String paymentProof, BigDecimal expectedAmount) {
        boolean accepted = paymentProof != null && paymentProof.length() >= MIN_PROOF_LENGTH;
        log.debug("Stub payment verification: accepted={}, expectedAmount={}", accepted, expectedAmount);
        return accepted;
    }
}
