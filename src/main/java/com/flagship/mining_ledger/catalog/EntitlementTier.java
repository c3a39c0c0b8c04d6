package com.flagship.mining_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * One purchasable tier: what it costs, what it pays out and how long it takes
 * to mature.
 */
@Value
public class EntitlementTier {
    String id;
    String name;
    BigDecimal cost;
    BigDecimal payout;
    Duration duration;
    int capacityGb;
}
