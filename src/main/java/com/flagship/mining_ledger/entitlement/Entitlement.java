package com.flagship.mining_ledger.entitlement;

import com.flagship.mining_ledger.catalog.EntitlementTier;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One purchased entitlement.
 *
 * Tier economics (cost, payout, duration) are copied from the catalog at
 * purchase time, so a later catalog change never alters what an existing
 * instance pays out.
 *
 * Transitions return a new instance; {@link #complete(Instant)} is the only
 * way from ACTIVE to COMPLETED and is rejected for an instance that has not
 * matured yet or has already been settled.
 */
@Value
public class Entitlement {
    UUID id;
    UUID accountId;
    String tierId;
    BigDecimal cost;
    BigDecimal payout;
    Duration duration;
    Instant purchasedAt;
    String paymentProof;
    EntitlementStatus status;
    boolean settled;
    Instant completedAt;

    public static Entitlement purchase(UUID id, UUID accountId, EntitlementTier tier,
                                       String paymentProof, Instant purchasedAt) {
        return new Entitlement(
            id,
            accountId,
            tier.getId(),
            tier.getCost(),
            tier.getPayout(),
            tier.getDuration(),
            purchasedAt,
            paymentProof,
            EntitlementStatus.ACTIVE,
            false,
            null
        );
    }

    public Instant maturesAt() {
        return purchasedAt.plus(duration);
    }

    /**
     * True once the full duration has elapsed, measured against {@code now}.
     */
    public boolean isMaturedAt(Instant now) {
        return !now.isBefore(maturesAt());
    }

    /**
     * Percentage of the duration elapsed at {@code now}, capped at 100.
     * A completed instance always reports 100.
     */
    public double progressAt(Instant now) {
        if (status == EntitlementStatus.COMPLETED) {
            return 100.0;
        }
        long total = duration.toMillis();
        long elapsed = Duration.between(purchasedAt, now).toMillis();
        if (elapsed <= 0) {
            return 0.0;
        }
        return Math.min(100.0, elapsed * 100.0 / total);
    }

    public boolean isActive() {
        return status == EntitlementStatus.ACTIVE;
    }

    /**
     * Completes a matured instance.
     *
     * @throws IllegalStateException if the instance is not ACTIVE, was already
     *                               settled, or has not matured at {@code now}
     */
    public Entitlement complete(Instant now) {
        if (status != EntitlementStatus.ACTIVE || settled) {
            throw new IllegalStateException(
                String.format("Cannot complete entitlement %s in %s status (settled=%s)", id, status, settled));
        }
        if (!isMaturedAt(now)) {
            throw new IllegalStateException(
                String.format("Entitlement %s matures at %s, cannot complete at %s", id, maturesAt(), now));
        }
        return new Entitlement(
            id,
            accountId,
            tierId,
            cost,
            payout,
            duration,
            purchasedAt,
            paymentProof,
            EntitlementStatus.COMPLETED,
            true,
            now
        );
    }
}
