package com.flagship.mining_ledger.withdrawal;

import com.flagship.mining_ledger.account.BalanceType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Withdrawal rows are written once and never updated. Every column is
 * {@code updatable = false}.
 */
@Entity
@Table(
    name = "withdrawals",
    indexes = {
        @Index(name = "idx_withdrawals_account_created", columnList = "account_id, created_at")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_withdrawals_account_idempotency_key",
            columnNames = {"account_id", "idempotency_key"})
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WithdrawalEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "balance_type", nullable = false, updatable = false, length = 16)
    private BalanceType balanceType;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static WithdrawalEntity fromDomain(WithdrawalRecord record) {
        return new WithdrawalEntity(
            record.getId(),
            record.getAccountId(),
            record.getBalanceType(),
            record.getAmount(),
            record.getIdempotencyKey(),
            record.getCreatedAt()
        );
    }

    public WithdrawalRecord toDomain() {
        return new WithdrawalRecord(id, accountId, balanceType, amount, idempotencyKey, createdAt);
    }
}
