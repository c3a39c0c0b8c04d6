package com.flagship.mining_ledger.withdrawal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mining_ledger.withdrawal.WithdrawalOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class WithdrawConfirmation {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("message")
    String message;

    @JsonProperty("withdrawal")
    WithdrawalResponse withdrawal;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    public static WithdrawConfirmation from(WithdrawalOutcome outcome) {
        var record = outcome.getRecord();
        return WithdrawConfirmation.builder()
            .success(true)
            .message(String.format("Withdrawal of %s TRX from %s balance processed successfully",
                record.getAmount().toPlainString(), record.getBalanceType().wireValue()))
            .withdrawal(WithdrawalResponse.from(record))
            .remainingBalance(outcome.getAccount().balanceOf(record.getBalanceType()))
            .build();
    }
}
