package com.flagship.mining_ledger.withdrawal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WithdrawalRepository extends JpaRepository<WithdrawalEntity, UUID> {

    Optional<WithdrawalEntity> findByAccountIdAndIdempotencyKey(UUID accountId, String idempotencyKey);

    List<WithdrawalEntity> findByAccountIdOrderByCreatedAtDesc(UUID accountId);
}
