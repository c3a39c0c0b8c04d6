package com.flagship.mining_ledger.entitlement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for an entitlement instance.
 *
 * Rows are never deleted. Only status, settled and completed_at change, and
 * only through {@link #applySettlement(Entitlement)}, which refuses to run
 * twice for the same row.
 */
@Entity
@Table(
    name = "entitlements",
    indexes = {
        @Index(name = "idx_entitlements_account_status", columnList = "account_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EntitlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "tier_id", nullable = false, updatable = false, length = 32)
    private String tierId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal cost;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal payout;

    @Column(name = "duration_seconds", nullable = false, updatable = false)
    private long durationSeconds;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private Instant purchasedAt;

    @Column(name = "payment_proof", nullable = false, updatable = false)
    private String paymentProof;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntitlementStatus status;

    @Column(nullable = false)
    private boolean settled;

    @Column(name = "completed_at")
    private Instant completedAt;

    static EntitlementEntity fromDomain(Entitlement entitlement) {
        return new EntitlementEntity(
            entitlement.getId(),
            entitlement.getAccountId(),
            entitlement.getTierId(),
            entitlement.getCost(),
            entitlement.getPayout(),
            entitlement.getDuration().getSeconds(),
            entitlement.getPurchasedAt(),
            entitlement.getPaymentProof(),
            entitlement.getStatus(),
            entitlement.isSettled(),
            entitlement.getCompletedAt()
        );
    }

    public Entitlement toDomain() {
        return new Entitlement(
            id,
            accountId,
            tierId,
            cost,
            payout,
            Duration.ofSeconds(durationSeconds),
            purchasedAt,
            paymentProof,
            status,
            settled,
            completedAt
        );
    }

    /**
     * Copies a completed state onto this row. Can only be called once: the
     * settled marker is what keeps a payout from being credited twice.
     */
    void applySettlement(Entitlement completed) {
        if (this.settled) {
            throw new IllegalStateException(
                "Entitlement " + this.id + " is already settled. Cannot settle twice.");
        }
        if (!completed.getId().equals(this.id) || completed.getStatus() != EntitlementStatus.COMPLETED) {
            throw new IllegalStateException(
                "Settlement for entitlement " + this.id + " must carry a COMPLETED state of the same instance");
        }
        this.status = EntitlementStatus.COMPLETED;
        this.settled = true;
        this.completedAt = completed.getCompletedAt();
    }
}
