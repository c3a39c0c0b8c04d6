package com.flagship.mining_ledger.entitlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EntitlementRepository extends JpaRepository<EntitlementEntity, UUID> {

    List<EntitlementEntity> findByAccountIdAndStatus(UUID accountId, EntitlementStatus status);

    boolean existsByAccountIdAndTierIdAndStatus(UUID accountId, String tierId, EntitlementStatus status);
}
