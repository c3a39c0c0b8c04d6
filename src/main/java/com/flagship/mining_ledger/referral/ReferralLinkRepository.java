package com.flagship.mining_ledger.referral;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReferralLinkRepository extends JpaRepository<ReferralLinkEntity, UUID> {

    Optional<ReferralLinkEntity> findByReferredId(UUID referredId);

    List<ReferralLinkEntity> findByReferrerIdOrderByCreatedAtAsc(UUID referrerId);
}
