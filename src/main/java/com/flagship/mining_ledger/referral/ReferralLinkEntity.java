package com.flagship.mining_ledger.referral;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per referred account (referred_id is unique). Only the valid flag
 * and its timestamp ever change.
 */
@Entity
@Table(
    name = "referral_links",
    indexes = {
        @Index(name = "idx_referral_links_referrer", columnList = "referrer_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReferralLinkEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "referrer_id", nullable = false, updatable = false)
    private UUID referrerId;

    @Column(name = "referred_id", nullable = false, updatable = false, unique = true)
    private UUID referredId;

    @Column(nullable = false)
    private boolean valid;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "validated_at")
    private Instant validatedAt;

    static ReferralLinkEntity fromDomain(ReferralLink link) {
        return new ReferralLinkEntity(
            link.getId(),
            link.getReferrerId(),
            link.getReferredId(),
            link.isValid(),
            link.getCreatedAt(),
            link.getValidatedAt()
        );
    }

    public ReferralLink toDomain() {
        return new ReferralLink(id, referrerId, referredId, valid, createdAt, validatedAt);
    }

    void markValidated(ReferralLink validated) {
        if (this.valid) {
            throw new IllegalStateException("Referral link " + this.id + " is already validated");
        }
        this.valid = true;
        this.validatedAt = validated.getValidatedAt();
    }
}
