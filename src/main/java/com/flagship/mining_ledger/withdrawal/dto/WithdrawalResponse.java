package com.flagship.mining_ledger.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.withdrawal.WithdrawalRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WithdrawalResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("balance_type")
    String balanceType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("created_at")
    Instant createdAt;

    public static WithdrawalResponse from(WithdrawalRecord record) {
        return WithdrawalResponse.builder()
            .id(record.getId())
            .balanceType(record.getBalanceType().wireValue())
            .amount(record.getAmount())
            .createdAt(record.getCreatedAt())
            .build();
    }
}
