package com.flagship.mining_ledger.account;

import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Balance and flag rules enforced by the account entity itself.
 */
class AccountEntityTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private AccountEntity account;

    @BeforeEach
    void setUp() {
        account = AccountEntity.open(UUID.randomUUID(), "alice", "hash", "ABCD1234", NOW);
    }

    @Test
    @DisplayName("New account starts with zero balances and no flags")
    void newAccount_IsEmpty() {
        Account snapshot = account.toDomain();

        assertEquals(0, snapshot.getEarnedBalance().compareTo(BigDecimal.ZERO));
        assertEquals(0, snapshot.getReferralBalance().compareTo(BigDecimal.ZERO));
        assertFalse(snapshot.isAnyEntitlementPurchased());
        assertFalse(snapshot.isTopTierEntitlementPurchased());
    }

    @Test
    @DisplayName("Credit adds to the named balance only")
    void credit_AddsToNamedBalance() {
        account.credit(BalanceType.EARNED, new BigDecimal("25"), NOW);
        account.credit(BalanceType.REFERRAL, new BigDecimal("50"), NOW);
        account.credit(BalanceType.EARNED, new BigDecimal("500"), NOW);

        assertEquals(0, account.balanceOf(BalanceType.EARNED).compareTo(new BigDecimal("525")));
        assertEquals(0, account.balanceOf(BalanceType.REFERRAL).compareTo(new BigDecimal("50")));
    }

    @Test
    @DisplayName("Credit of zero or a negative amount is rejected")
    void credit_NonPositive_Rejected() {
        LedgerException zero = assertThrows(LedgerException.class,
                () -> account.credit(BalanceType.EARNED, BigDecimal.ZERO, NOW));
        LedgerException negative = assertThrows(LedgerException.class,
                () -> account.credit(BalanceType.EARNED, new BigDecimal("-1"), NOW));

        assertEquals(ErrorKind.INVALID_AMOUNT, zero.getKind());
        assertEquals(ErrorKind.INVALID_AMOUNT, negative.getKind());
        assertEquals(0, account.balanceOf(BalanceType.EARNED).compareTo(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Debit of the whole balance leaves exactly zero")
    void debit_WholeBalance_LeavesZero() {
        account.credit(BalanceType.EARNED, new BigDecimal("25"), NOW);

        account.debit(BalanceType.EARNED, new BigDecimal("25"), NOW);

        assertEquals(0, account.balanceOf(BalanceType.EARNED).compareTo(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Debit above the balance is rejected and changes nothing")
    void debit_AboveBalance_Rejected() {
        account.credit(BalanceType.REFERRAL, new BigDecimal("50"), NOW);

        LedgerException e = assertThrows(LedgerException.class,
                () -> account.debit(BalanceType.REFERRAL, new BigDecimal("50.0001"), NOW));

        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, e.getKind());
        assertEquals(0, account.balanceOf(BalanceType.REFERRAL).compareTo(new BigDecimal("50")));
    }

    @Test
    @DisplayName("Flags are monotonic and raising twice reports no change")
    void raise_IsMonotonic() {
        assertTrue(account.raise(EligibilityFlag.ANY_ENTITLEMENT, NOW));
        assertFalse(account.raise(EligibilityFlag.ANY_ENTITLEMENT, NOW));

        Account snapshot = account.toDomain();
        assertTrue(snapshot.hasFlag(EligibilityFlag.ANY_ENTITLEMENT));
        assertFalse(snapshot.hasFlag(EligibilityFlag.TOP_TIER_ENTITLEMENT));
    }

    @Test
    @DisplayName("Amounts finer than the stored scale are rejected instead of rounded")
    void debit_BeyondStoredScale_Rejected() {
        account.credit(BalanceType.EARNED, new BigDecimal("100"), NOW);

        LedgerException e = assertThrows(LedgerException.class,
                () -> account.debit(BalanceType.EARNED, new BigDecimal("25.00004"), NOW));

        assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
        assertEquals(0, account.balanceOf(BalanceType.EARNED).compareTo(new BigDecimal("100")));
        assertThrows(LedgerException.class,
                () -> account.credit(BalanceType.REFERRAL, new BigDecimal("0.00001"), NOW));
    }

    @Test
    @DisplayName("Trailing zeros beyond the stored scale are harmless")
    void debit_TrailingZeros_Accepted() {
        account.credit(BalanceType.EARNED, new BigDecimal("100"), NOW);

        account.debit(BalanceType.EARNED, new BigDecimal("25.500000"), NOW);

        assertEquals(0, account.balanceOf(BalanceType.EARNED).compareTo(new BigDecimal("74.5")));
        assertTrue(account.balanceOf(BalanceType.EARNED).stripTrailingZeros().scale() <= Account.AMOUNT_SCALE);
    }
}
