package com.flagship.mining_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.purchases: purchases by tier and outcome
 * - ledger.settlements / ledger.payout.amount: matured entitlements and credited payouts
 * - ledger.referrals.validated: referral rewards granted
 * - ledger.withdrawals / ledger.withdrawal.amount: withdrawals by balance type and outcome
 * - ledger.latency: operation latency
 * - idempotency.cache: withdrawal replay lookups
 */
@Component
public class LedgerMetrics {

    /**
     * Tag value for request input that did not resolve to a known tier or
     * balance type. Raw client strings are never used as tag values.
     */
    public static final String UNKNOWN_TAG = "unknown";

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPurchase(String tierId, String outcome) {
        registry.counter("ledger.purchases",
                "tier", sanitizeTag(tierId),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordSettlement(String tierId, BigDecimal payout) {
        registry.counter("ledger.settlements", "tier", sanitizeTag(tierId)).increment();
        registry.summary("ledger.payout.amount", "tier", sanitizeTag(tierId)).record(payout.doubleValue());
    }

    public void recordReferralValidated() {
        registry.counter("ledger.referrals.validated").increment();
    }

    public void recordWithdrawal(String balanceType, String outcome) {
        registry.counter("ledger.withdrawals",
                "balance_type", sanitizeTag(balanceType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordWithdrawalAmount(String balanceType, BigDecimal amount) {
        registry.summary("ledger.withdrawal.amount", "balance_type", sanitizeTag(balanceType))
                .record(amount.doubleValue());
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Normalizes characters and length. Cardinality is bounded by callers,
     * which pass only catalog tier ids, balance type wire values or {@link #UNKNOWN_TAG}.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return UNKNOWN_TAG;
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
