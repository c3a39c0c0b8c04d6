package com.flagship.mining_ledger.account;

import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for an account and its two balances.
 *
 * No setters: balances and flags change only through the package-private
 * mutators below, which only {@link AccountLedgerService} calls. The mutators
 * enforce the non-negative balance and monotonic flag invariants; the schema
 * repeats the balance check as a constraint.
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_username", columnList = "username", unique = true),
        @Index(name = "idx_accounts_referral_code", columnList = "referral_code", unique = true)
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, unique = true, length = 64)
    private String username;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "referral_code", nullable = false, updatable = false, unique = true, length = 16)
    private String referralCode;

    @Column(name = "earned_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal earnedBalance;

    @Column(name = "referral_balance", nullable = false, precision = 19, scale = 4)
    private BigDecimal referralBalance;

    @Column(name = "has_any_entitlement", nullable = false)
    private boolean anyEntitlementPurchased;

    @Column(name = "has_top_tier_entitlement", nullable = false)
    private boolean topTierEntitlementPurchased;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    static AccountEntity open(UUID id, String username, String passwordHash, String referralCode, Instant now) {
        return new AccountEntity(
            id,
            username,
            passwordHash,
            referralCode,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            false,
            false,
            now,
            now,
            null
        );
    }

    void credit(BalanceType type, BigDecimal amount, Instant now) {
        requirePositive(amount);
        switch (type) {
            case EARNED -> this.earnedBalance = this.earnedBalance.add(amount);
            case REFERRAL -> this.referralBalance = this.referralBalance.add(amount);
        }
        this.updatedAt = now;
    }

    void debit(BalanceType type, BigDecimal amount, Instant now) {
        requirePositive(amount);
        BigDecimal current = balanceOf(type);
        if (amount.compareTo(current) > 0) {
            throw new LedgerException(ErrorKind.INSUFFICIENT_FUNDS,
                String.format("Insufficient %s balance: requested=%s, available=%s",
                    type.wireValue(), amount.toPlainString(), current.toPlainString()));
        }
        switch (type) {
            case EARNED -> this.earnedBalance = current.subtract(amount);
            case REFERRAL -> this.referralBalance = current.subtract(amount);
        }
        this.updatedAt = now;
    }

    /**
     * Raises a flag. Returns true when the flag was not set before.
     */
    boolean raise(EligibilityFlag flag, Instant now) {
        boolean changed = switch (flag) {
            case ANY_ENTITLEMENT -> !this.anyEntitlementPurchased;
            case TOP_TIER_ENTITLEMENT -> !this.topTierEntitlementPurchased;
        };
        if (changed) {
            switch (flag) {
                case ANY_ENTITLEMENT -> this.anyEntitlementPurchased = true;
                case TOP_TIER_ENTITLEMENT -> this.topTierEntitlementPurchased = true;
            }
            this.updatedAt = now;
        }
        return changed;
    }

    BigDecimal balanceOf(BalanceType type) {
        return switch (type) {
            case EARNED -> earnedBalance;
            case REFERRAL -> referralBalance;
        };
    }

    public Account toDomain() {
        return new Account(
            id,
            username,
            referralCode,
            earnedBalance,
            referralBalance,
            anyEntitlementPurchased,
            topTierEntitlementPurchased,
            createdAt
        );
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new LedgerException(ErrorKind.INVALID_AMOUNT,
                "Amount must be positive: " + (amount == null ? "null" : amount.toPlainString()));
        }
        if (!Account.fitsAmountScale(amount)) {
            throw new LedgerException(ErrorKind.INVALID_AMOUNT,
                "Amount has more than " + Account.AMOUNT_SCALE + " decimal places: " + amount.toPlainString());
        }
    }
}
