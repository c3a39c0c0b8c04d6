package com.flagship.mining_ledger.account;

import com.flagship.mining_ledger.event.AccountOpenedEvent;
import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import com.flagship.mining_ledger.outbox.OutboxService;
import com.flagship.mining_ledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AccountLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T00:00:00Z");

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private OutboxService outboxService;

    private AccountLedgerService ledger;

    @BeforeEach
    void setUp() {
        ledger = new AccountLedgerService(accountRepository, outboxService, new MutableClock(NOW));
    }

    private AccountEntity stored(String earned) {
        AccountEntity entity = AccountEntity.open(UUID.randomUUID(), "alice", "hash", "ALICE123", NOW);
        entity.credit(BalanceType.EARNED, new BigDecimal(earned), NOW);
        return entity;
    }

    @Test
    @DisplayName("New account gets the signup bonus, a referral code and an AccountOpened event")
    void openAccount_CreditsSignupBonus() {
        when(accountRepository.existsByUsername("alice")).thenReturn(false);
        when(accountRepository.existsByReferralCode(anyString())).thenReturn(false);
        when(accountRepository.save(any(AccountEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Account account = ledger.openAccount("alice", "hash", new BigDecimal("25"));

        assertEquals("alice", account.getUsername());
        assertEquals(8, account.getReferralCode().length());
        assertEquals(account.getReferralCode(), account.getReferralCode().toUpperCase());
        assertEquals(0, account.getEarnedBalance().compareTo(new BigDecimal("25")));
        assertEquals(0, account.getReferralBalance().compareTo(BigDecimal.ZERO));
        assertFalse(account.isAnyEntitlementPurchased());
        assertFalse(account.isTopTierEntitlementPurchased());
        assertEquals(NOW, account.getCreatedAt());

        ArgumentCaptor<AccountOpenedEvent> event = ArgumentCaptor.forClass(AccountOpenedEvent.class);
        verify(outboxService).record(event.capture());
        assertEquals(account.getId(), event.getValue().getAccountId());
    }

    @Test
    @DisplayName("Taken username is rejected without writing anything")
    void openAccount_DuplicateUsername() {
        when(accountRepository.existsByUsername("alice")).thenReturn(true);

        LedgerException e = assertThrows(LedgerException.class,
                () -> ledger.openAccount("alice", "hash", new BigDecimal("25")));

        assertEquals(ErrorKind.DUPLICATE_ACCOUNT, e.getKind());
        verify(accountRepository, never()).save(any());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("Debit larger than the balance fails and leaves the balance unchanged")
    void debit_InsufficientFunds() {
        AccountEntity entity = stored("25");
        when(accountRepository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));

        LedgerException e = assertThrows(LedgerException.class,
                () -> ledger.debit(entity.getId(), BalanceType.EARNED, new BigDecimal("25.01")));

        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, e.getKind());
        assertEquals(0, entity.getEarnedBalance().compareTo(new BigDecimal("25")));
    }

    @Test
    @DisplayName("Debit of the whole balance leaves exactly zero")
    void debit_WholeBalance() {
        AccountEntity entity = stored("25");
        when(accountRepository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));

        Account after = ledger.debit(entity.getId(), BalanceType.EARNED, new BigDecimal("25"));

        assertEquals(0, after.getEarnedBalance().compareTo(BigDecimal.ZERO));
    }

    @Test
    @DisplayName("Raising a flag twice keeps it raised")
    void setFlag_Idempotent() {
        AccountEntity entity = stored("25");
        when(accountRepository.findByIdForUpdate(entity.getId())).thenReturn(Optional.of(entity));

        ledger.setFlag(entity.getId(), EligibilityFlag.TOP_TIER_ENTITLEMENT);
        Account after = ledger.setFlag(entity.getId(), EligibilityFlag.TOP_TIER_ENTITLEMENT);

        assertTrue(after.isTopTierEntitlementPurchased());
        assertFalse(after.isAnyEntitlementPurchased());
    }

    @Test
    @DisplayName("Operations on a missing account fail with ACCOUNT_NOT_FOUND")
    void read_UnknownAccount() {
        UUID missing = UUID.randomUUID();
        when(accountRepository.findByIdForUpdate(missing)).thenReturn(Optional.empty());

        LedgerException e = assertThrows(LedgerException.class, () -> ledger.read(missing));

        assertEquals(ErrorKind.ACCOUNT_NOT_FOUND, e.getKind());
    }

    @Test
    @DisplayName("Referral code lookup ignores case and surrounding whitespace")
    void findByReferralCode_Normalizes() {
        AccountEntity entity = stored("25");
        when(accountRepository.findByReferralCode("ALICE123")).thenReturn(Optional.of(entity));

        Optional<Account> found = ledger.findByReferralCode("  alice123 ");

        assertTrue(found.isPresent());
        assertEquals(entity.getId(), found.get().getId());
        assertTrue(ledger.findByReferralCode(" ").isEmpty());
    }

    @Test
    @DisplayName("Bulk lookup with no ids does not hit the repository")
    void findAllById_Empty() {
        assertEquals(List.of(), ledger.findAllById(List.of()));
        verifyNoInteractions(accountRepository);
    }
}
