package com.flagship.mining_ledger.account;

import com.flagship.mining_ledger.event.AccountOpenedEvent;
import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import com.flagship.mining_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The only writer of account balances and eligibility flags.
 *
 * Every operation loads the account with a row lock that lives until the
 * surrounding transaction ends. Callers that chain several ledger operations in
 * one {@code @Transactional} method therefore see and mutate one account
 * strictly one request at a time, while other accounts are never blocked.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountLedgerService {

    private static final int REFERRAL_CODE_LENGTH = 8;
    private static final int REFERRAL_CODE_ATTEMPTS = 5;

    private final AccountRepository accountRepository;
    private final OutboxService outboxService;
    private final Clock clock;

    /**
     * Opens an account with zero balances and a fresh referral code, then
     * credits the signup bonus to the earned balance.
     */
    @Transactional
    public Account openAccount(String username, String passwordHash, BigDecimal signupBonus) {
        if (accountRepository.existsByUsername(username)) {
            throw new LedgerException(ErrorKind.DUPLICATE_ACCOUNT, "Username already exists: " + username);
        }

        Instant now = Instant.now(clock);
        AccountEntity entity = AccountEntity.open(UUID.randomUUID(), username, passwordHash,
                generateReferralCode(), now);
        if (signupBonus != null && signupBonus.compareTo(BigDecimal.ZERO) > 0) {
            entity.credit(BalanceType.EARNED, signupBonus, now);
        }
        AccountEntity saved = accountRepository.save(entity);

        outboxService.record(AccountOpenedEvent.of(saved.getId(), saved.getUsername(),
                saved.getReferralCode(), signupBonus, now));

        log.info("Opened account: accountId={}, referralCode={}", saved.getId(), saved.getReferralCode());
        return saved.toDomain();
    }

    /**
     * Locks the account and returns a consistent snapshot of it.
     */
    @Transactional
    public Account read(UUID accountId) {
        return lock(accountId).toDomain();
    }

    @Transactional
    public Account credit(UUID accountId, BalanceType type, BigDecimal amount) {
        AccountEntity account = lock(accountId);
        account.credit(type, amount, Instant.now(clock));
        log.debug("Credited account: accountId={}, balanceType={}, amount={}", accountId, type, amount);
        return account.toDomain();
    }

    @Transactional
    public Account debit(UUID accountId, BalanceType type, BigDecimal amount) {
        AccountEntity account = lock(accountId);
        account.debit(type, amount, Instant.now(clock));
        log.debug("Debited account: accountId={}, balanceType={}, amount={}", accountId, type, amount);
        return account.toDomain();
    }

    /**
     * Raises a monotonic flag. Raising an already raised flag is a no-op.
     */
    @Transactional
    public Account setFlag(UUID accountId, EligibilityFlag flag) {
        AccountEntity account = lock(accountId);
        if (account.raise(flag, Instant.now(clock))) {
            log.info("Raised eligibility flag: accountId={}, flag={}", accountId, flag);
        }
        return account.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Account> findByReferralCode(String referralCode) {
        if (referralCode == null || referralCode.isBlank()) {
            return Optional.empty();
        }
        return accountRepository.findByReferralCode(referralCode.trim().toUpperCase())
                .map(AccountEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID accountId) {
        return accountRepository.findById(accountId).map(AccountEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<AccountCredentials> findCredentials(String username) {
        return accountRepository.findByUsername(username)
                .map(entity -> new AccountCredentials(entity.getId(), entity.getPasswordHash()));
    }

    @Transactional(readOnly = true)
    public List<Account> findAllById(Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return List.of();
        }
        return accountRepository.findAllById(accountIds).stream()
                .map(AccountEntity::toDomain)
                .toList();
    }

    private AccountEntity lock(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> LedgerException.accountNotFound(accountId));
    }

    private String generateReferralCode() {
        for (int attempt = 0; attempt < REFERRAL_CODE_ATTEMPTS; attempt++) {
            String code = UUID.randomUUID().toString()
                    .replace("-", "")
                    .substring(0, REFERRAL_CODE_LENGTH)
                    .toUpperCase();
            if (!accountRepository.existsByReferralCode(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not allocate a unique referral code");
    }
}
