package com.flagship.mining_ledger.withdrawal;

import com.flagship.mining_ledger.account.BalanceType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only log entry for a completed withdrawal.
 */
@Value
public class WithdrawalRecord {
    UUID id;
    UUID accountId;
    BalanceType balanceType;
    BigDecimal amount;
    String idempotencyKey;
    Instant createdAt;
}
