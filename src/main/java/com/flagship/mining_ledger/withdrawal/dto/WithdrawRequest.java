package com.flagship.mining_ledger.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Balance type and minimum are checked by the service, so that an unknown
 * type or a too small amount is reported with its own error kind.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawRequest {

    @NotBlank(message = "Balance type is required")
    @JsonProperty("balance_type")
    private String balanceType;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;
}
