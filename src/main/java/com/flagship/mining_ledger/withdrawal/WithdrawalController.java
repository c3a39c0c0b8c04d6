package com.flagship.mining_ledger.withdrawal;

import com.flagship.mining_ledger.withdrawal.dto.WithdrawConfirmation;
import com.flagship.mining_ledger.withdrawal.dto.WithdrawRequest;
import com.flagship.mining_ledger.withdrawal.dto.WithdrawalResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Withdrawals. The Idempotency-Key header is optional; when present, a
 * repeated request returns the original withdrawal with 200 instead of 201.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WithdrawalController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WithdrawalService withdrawalService;

    @PostMapping("/api/withdraw")
    public ResponseEntity<WithdrawConfirmation> withdraw(
            @AuthenticationPrincipal UUID accountId,
            @Valid @RequestBody WithdrawRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received withdrawal request: balanceType={}, amount={}, idempotencyKey={}",
                request.getBalanceType(), request.getAmount(), idempotencyKey);

        WithdrawalOutcome outcome = withdrawalService.withdraw(accountId, request.getBalanceType(),
                request.getAmount(), idempotencyKey);

        HttpStatus status = outcome.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(WithdrawConfirmation.from(outcome));
    }

    @GetMapping("/api/withdrawals")
    public List<WithdrawalResponse> history(@AuthenticationPrincipal UUID accountId) {
        return withdrawalService.history(accountId).stream()
                .map(WithdrawalResponse::from)
                .toList();
    }
}
