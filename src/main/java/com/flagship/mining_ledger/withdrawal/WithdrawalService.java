package com.flagship.mining_ledger.withdrawal;

import com.flagship.mining_ledger.account.Account;
import com.flagship.mining_ledger.account.AccountLedgerService;
import com.flagship.mining_ledger.account.BalanceType;
import com.flagship.mining_ledger.account.EligibilityFlag;
import com.flagship.mining_ledger.config.LedgerProperties;
import com.flagship.mining_ledger.entitlement.EntitlementService;
import com.flagship.mining_ledger.event.WithdrawalCompletedEvent;
import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import com.flagship.mining_ledger.observability.LedgerMetrics;
import com.flagship.mining_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Gates and executes withdrawals.
 *
 * Checks run in a fixed order: balance type, minimum amount, eligibility
 * flag, available balance. The flag and balance checks read the account
 * under its row lock, after matured entitlements have been settled, and the
 * debit happens under the same lock, so concurrent withdrawals can never
 * overdraw a balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalService {

    private final WithdrawalRepository withdrawalRepository;
    private final WithdrawalIdempotencyService idempotencyService;
    private final AccountLedgerService ledger;
    private final EntitlementService entitlementService;
    private final OutboxService outboxService;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * @param balanceType    wire value, {@code mine} or {@code referral}
     * @param idempotencyKey optional; a repeated key returns the original
     *                       withdrawal without debiting again
     * @throws LedgerException UNKNOWN_BALANCE_TYPE, BELOW_MINIMUM, NOT_ELIGIBLE,
     *                         INSUFFICIENT_FUNDS or ACCOUNT_NOT_FOUND
     */
    @Transactional
    public WithdrawalOutcome withdraw(UUID accountId, String balanceType, BigDecimal amount,
                                      String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();

        if (keyed) {
            Optional<WithdrawalOutcome> replay = idempotencyService.checkIdempotencyKey(accountId, idempotencyKey)
                    .flatMap(withdrawalRepository::findById)
                    .map(entity -> replay(accountId, entity));
            if (replay.isPresent()) {
                return replay.get();
            }
            metrics.recordIdempotencyMiss();
        }

        try {
            BalanceType type = BalanceType.fromWireValue(balanceType)
                    .orElseThrow(() -> new LedgerException(ErrorKind.UNKNOWN_BALANCE_TYPE,
                            "Invalid balance type: " + balanceType));

            if (amount == null) {
                throw new LedgerException(ErrorKind.INVALID_AMOUNT, "Withdrawal amount is required");
            }
            if (!Account.fitsAmountScale(amount)) {
                throw new LedgerException(ErrorKind.INVALID_AMOUNT,
                        "Withdrawal amount supports at most " + Account.AMOUNT_SCALE + " decimal places");
            }

            BigDecimal minimum = minimumFor(type);
            if (amount.compareTo(minimum) < 0) {
                throw new LedgerException(ErrorKind.BELOW_MINIMUM,
                        String.format("Minimum withdrawal for %s balance is %s", type.wireValue(),
                                minimum.toPlainString()));
            }

            Account account = ledger.read(accountId);
            entitlementService.settleMatured(accountId);

            // a concurrent request with the same key may have committed while we waited for the lock
            if (keyed) {
                Optional<WithdrawalEntity> raced = withdrawalRepository
                        .findByAccountIdAndIdempotencyKey(accountId, idempotencyKey);
                if (raced.isPresent()) {
                    return replay(accountId, raced.get());
                }
            }

            EligibilityFlag required = requiredFlagFor(type);
            if (!account.hasFlag(required)) {
                throw new LedgerException(ErrorKind.NOT_ELIGIBLE, notEligibleMessage(type));
            }

            Account after = ledger.debit(accountId, type, amount);

            Instant now = Instant.now(clock);
            WithdrawalRecord record = new WithdrawalRecord(UUID.randomUUID(), accountId, type, amount,
                    keyed ? idempotencyKey : null, now);
            withdrawalRepository.save(WithdrawalEntity.fromDomain(record));

            outboxService.record(WithdrawalCompletedEvent.of(accountId, record.getId(), type.wireValue(),
                    amount, now));

            if (keyed) {
                idempotencyService.storeIdempotencyKey(accountId, idempotencyKey, record.getId());
            }

            metrics.recordWithdrawal(type.wireValue(), "success");
            metrics.recordWithdrawalAmount(type.wireValue(), amount);
            metrics.recordLatency("withdraw", System.currentTimeMillis() - startTime);
            log.info("Withdrawal completed: accountId={}, withdrawalId={}, balanceType={}, amount={}",
                    accountId, record.getId(), type.wireValue(), amount);

            return new WithdrawalOutcome(record, after, false);

        } catch (LedgerException e) {
            String typeTag = BalanceType.fromWireValue(balanceType)
                    .map(BalanceType::wireValue)
                    .orElse(LedgerMetrics.UNKNOWN_TAG);
            metrics.recordWithdrawal(typeTag, e.getKind().name().toLowerCase());
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public List<WithdrawalRecord> history(UUID accountId) {
        return withdrawalRepository.findByAccountIdOrderByCreatedAtDesc(accountId).stream()
                .map(WithdrawalEntity::toDomain)
                .toList();
    }

    private WithdrawalOutcome replay(UUID accountId, WithdrawalEntity entity) {
        if (!entity.getAccountId().equals(accountId)) {
            throw new IllegalStateException("Withdrawal " + entity.getId() + " does not belong to account " + accountId);
        }
        metrics.recordIdempotencyHit();
        log.info("Idempotency key already used, returning existing withdrawal: withdrawalId={}", entity.getId());
        return new WithdrawalOutcome(entity.toDomain(), ledger.read(accountId), true);
    }

    private BigDecimal minimumFor(BalanceType type) {
        return switch (type) {
            case EARNED -> properties.getWithdrawal().getEarnedMinimum();
            case REFERRAL -> properties.getWithdrawal().getReferralMinimum();
        };
    }

    private static EligibilityFlag requiredFlagFor(BalanceType type) {
        return switch (type) {
            case EARNED -> EligibilityFlag.ANY_ENTITLEMENT;
            case REFERRAL -> EligibilityFlag.TOP_TIER_ENTITLEMENT;
        };
    }

    private static String notEligibleMessage(BalanceType type) {
        return switch (type) {
            case EARNED -> "You must purchase any node first to withdraw from mine balance";
            case REFERRAL -> "You must purchase the top tier node to withdraw from referral balance";
        };
    }
}
