package com.flagship.mining_ledger.entitlement;

import com.flagship.mining_ledger.account.Account;
import com.flagship.mining_ledger.account.AccountLedgerService;
import com.flagship.mining_ledger.account.BalanceType;
import com.flagship.mining_ledger.account.EligibilityFlag;
import com.flagship.mining_ledger.catalog.EntitlementCatalog;
import com.flagship.mining_ledger.catalog.EntitlementTier;
import com.flagship.mining_ledger.event.EntitlementPurchasedEvent;
import com.flagship.mining_ledger.event.EntitlementSettledEvent;
import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import com.flagship.mining_ledger.observability.LedgerMetrics;
import com.flagship.mining_ledger.outbox.OutboxService;
import com.flagship.mining_ledger.referral.ReferralService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Purchases, settles and reports entitlement instances.
 *
 * Every public operation starts by locking the owning account through
 * {@link AccountLedgerService#read(UUID)}, so purchases, settlements and
 * withdrawals of one account never interleave.
 *
 * Settlement is lazy: matured instances are completed and paid out whenever
 * the account is next touched by a balance-facing operation. The persisted
 * settled marker, not the clock, decides whether a payout happens.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntitlementService {

    private final EntitlementRepository entitlementRepository;
    private final EntitlementCatalog catalog;
    private final AccountLedgerService ledger;
    private final PaymentVerificationService paymentVerification;
    private final ReferralService referralService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Buys one instance of a tier.
     *
     * @throws LedgerException UNKNOWN_TIER, DUPLICATE_ACTIVE_ENTITLEMENT,
     *                         PAYMENT_UNVERIFIED or ACCOUNT_NOT_FOUND
     */
    @Transactional
    public Entitlement purchase(UUID accountId, String tierId, String paymentProof) {
        long startTime = System.currentTimeMillis();

        EntitlementTier tier = catalog.find(tierId).orElseThrow(() -> {
            metrics.recordPurchase(LedgerMetrics.UNKNOWN_TAG, "unknown_tier");
            return new LedgerException(ErrorKind.UNKNOWN_TIER, "Unknown node: " + tierId);
        });

        try {
            Account account = ledger.read(accountId);
            settle(accountId);

            if (entitlementRepository.existsByAccountIdAndTierIdAndStatus(accountId, tier.getId(),
                    EntitlementStatus.ACTIVE)) {
                throw new LedgerException(ErrorKind.DUPLICATE_ACTIVE_ENTITLEMENT,
                    "You already have an active " + tier.getName());
            }

            if (!paymentVerification.verify(paymentProof, tier.getCost())) {
                throw new LedgerException(ErrorKind.PAYMENT_UNVERIFIED, "Payment could not be verified");
            }

            // read from the locked row before any flag is raised
            boolean firstPurchase = !account.isAnyEntitlementPurchased();

            Instant now = Instant.now(clock);
            Entitlement entitlement = Entitlement.purchase(UUID.randomUUID(), accountId, tier, paymentProof, now);
            entitlementRepository.save(EntitlementEntity.fromDomain(entitlement));

            ledger.setFlag(accountId, EligibilityFlag.ANY_ENTITLEMENT);
            if (catalog.isTopTier(tier.getId())) {
                ledger.setFlag(accountId, EligibilityFlag.TOP_TIER_ENTITLEMENT);
            }

            outboxService.record(EntitlementPurchasedEvent.of(accountId, entitlement.getId(), tier.getId(),
                    tier.getCost(), firstPurchase, now));

            if (firstPurchase) {
                referralService.onFirstPurchase(accountId);
            }

            metrics.recordPurchase(tier.getId(), "success");
            metrics.recordLatency("purchase", System.currentTimeMillis() - startTime);
            log.info("Entitlement purchased: accountId={}, entitlementId={}, tier={}, firstPurchase={}",
                    accountId, entitlement.getId(), tier.getId(), firstPurchase);

            return entitlement;

        } catch (LedgerException e) {
            metrics.recordPurchase(tier.getId(), e.getKind().name().toLowerCase());
            throw e;
        }
    }

    /**
     * Completes and pays out every matured instance of the account.
     * Safe to call any number of times; an instance pays out at most once.
     *
     * @return the instances completed by this call
     */
    @Transactional
    public List<Entitlement> settleMatured(UUID accountId) {
        ledger.read(accountId);
        return settle(accountId);
    }

    /**
     * Settles, then returns the account, so the balances already include every
     * payout that is due.
     */
    @Transactional
    public Account settledAccount(UUID accountId) {
        ledger.read(accountId);
        settle(accountId);
        return ledger.read(accountId);
    }

    /**
     * Settles, then reports every catalog tier for the account.
     */
    @Transactional
    public List<TierStatus> status(UUID accountId) {
        ledger.read(accountId);
        settle(accountId);

        Instant now = Instant.now(clock);
        Map<String, Entitlement> activeByTier = entitlementRepository
                .findByAccountIdAndStatus(accountId, EntitlementStatus.ACTIVE).stream()
                .map(EntitlementEntity::toDomain)
                .collect(Collectors.toMap(Entitlement::getTierId, Function.identity(), (a, b) -> a));

        List<TierStatus> report = new ArrayList<>();
        for (EntitlementTier tier : catalog.tiers()) {
            Entitlement active = activeByTier.get(tier.getId());
            report.add(active != null
                    ? TierStatus.running(tier, active, now)
                    : TierStatus.idle(tier));
        }
        return report;
    }

    /**
     * Caller must already hold the account lock.
     */
    private List<Entitlement> settle(UUID accountId) {
        Instant now = Instant.now(clock);
        List<Entitlement> completed = new ArrayList<>();

        for (EntitlementEntity entity : entitlementRepository.findByAccountIdAndStatus(accountId,
                EntitlementStatus.ACTIVE)) {
            Entitlement entitlement = entity.toDomain();
            if (entitlement.isSettled() || !entitlement.isMaturedAt(now)) {
                continue;
            }

            Entitlement done = entitlement.complete(now);
            entity.applySettlement(done);
            entitlementRepository.save(entity);

            ledger.credit(accountId, BalanceType.EARNED, done.getPayout());
            outboxService.record(EntitlementSettledEvent.of(accountId, done.getId(), done.getTierId(),
                    done.getPayout(), now));
            recordSettlementAfterCommit(done);

            log.info("Entitlement settled: accountId={}, entitlementId={}, tier={}, payout={}",
                    accountId, done.getId(), done.getTierId(), done.getPayout());
            completed.add(done);
        }
        return completed;
    }

    // a purchase that fails after settling rolls the payout back, so count only committed ones
    private void recordSettlementAfterCommit(Entitlement done) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            metrics.recordSettlement(done.getTierId(), done.getPayout());
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                metrics.recordSettlement(done.getTierId(), done.getPayout());
            }
        });
    }
}
