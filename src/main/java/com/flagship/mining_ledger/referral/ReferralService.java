package com.flagship.mining_ledger.referral;

import com.flagship.mining_ledger.account.Account;
import com.flagship.mining_ledger.account.AccountLedgerService;
import com.flagship.mining_ledger.account.BalanceType;
import com.flagship.mining_ledger.config.LedgerProperties;
import com.flagship.mining_ledger.event.ReferralValidatedEvent;
import com.flagship.mining_ledger.exception.ErrorKind;
import com.flagship.mining_ledger.exception.LedgerException;
import com.flagship.mining_ledger.observability.LedgerMetrics;
import com.flagship.mining_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Links new accounts to their referrer and pays the referral reward once the
 * referred account makes its first purchase.
 *
 * Lock order: the referred account is always locked by the caller before the
 * referrer is credited. A referrer exists before anyone can use its code, so
 * the order follows account creation and cannot form a cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReferralService {

    private final ReferralLinkRepository linkRepository;
    private final AccountLedgerService ledger;
    private final OutboxService outboxService;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Creates an unvalidated link from the owner of {@code referrerCode} to
     * {@code referredId}. Runs inside the signup transaction.
     *
     * @throws LedgerException INVALID_REFERRAL_CODE when no account owns the code
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ReferralLink link(String referrerCode, UUID referredId) {
        Account referrer = ledger.findByReferralCode(referrerCode)
                .filter(account -> !account.getId().equals(referredId))
                .orElseThrow(() -> new LedgerException(ErrorKind.INVALID_REFERRAL_CODE,
                        "Invalid referral code: " + referrerCode));

        ReferralLink link = ReferralLink.create(UUID.randomUUID(), referrer.getId(), referredId,
                Instant.now(clock));
        linkRepository.save(ReferralLinkEntity.fromDomain(link));

        log.info("Referral linked: referrerId={}, referredId={}", referrer.getId(), referredId);
        return link;
    }

    /**
     * Validates the referred account's link, if it has an unvalidated one, and
     * credits the reward to the referrer. The caller holds the referred
     * account's lock, so this runs at most once per link.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<ReferralLink> onFirstPurchase(UUID referredId) {
        Optional<ReferralLinkEntity> pending = linkRepository.findByReferredId(referredId)
                .filter(entity -> !entity.isValid());
        if (pending.isEmpty()) {
            return Optional.empty();
        }

        ReferralLinkEntity entity = pending.get();
        Instant now = Instant.now(clock);
        ReferralLink validated = entity.toDomain().validate(now);
        entity.markValidated(validated);
        linkRepository.save(entity);

        BigDecimal reward = properties.getReferralReward();
        ledger.credit(validated.getReferrerId(), BalanceType.REFERRAL, reward);
        outboxService.record(ReferralValidatedEvent.of(validated.getReferrerId(), referredId,
                validated.getId(), reward, now));
        metrics.recordReferralValidated();

        log.info("Referral validated: referrerId={}, referredId={}, reward={}",
                validated.getReferrerId(), referredId, reward);
        return Optional.of(validated);
    }

    @Transactional(readOnly = true)
    public ReferralReport report(UUID accountId) {
        Account account = ledger.findById(accountId)
                .orElseThrow(() -> LedgerException.accountNotFound(accountId));

        List<ReferralLinkEntity> links = linkRepository.findByReferrerIdOrderByCreatedAtAsc(accountId);
        Map<UUID, String> usernames = ledger.findAllById(
                links.stream().map(ReferralLinkEntity::getReferredId).toList())
                .stream()
                .collect(Collectors.toMap(Account::getId, Account::getUsername, (a, b) -> a));

        List<ReferralReport.Entry> valid = new ArrayList<>();
        List<ReferralReport.Entry> invalid = new ArrayList<>();
        for (ReferralLinkEntity link : links) {
            String username = usernames.get(link.getReferredId());
            if (username == null) {
                continue;
            }
            ReferralReport.Entry entry = new ReferralReport.Entry(username, link.getCreatedAt(), link.isValid());
            (link.isValid() ? valid : invalid).add(entry);
        }

        BigDecimal totalEarned = properties.getReferralReward().multiply(BigDecimal.valueOf(valid.size()));
        return new ReferralReport(account.getReferralCode(), valid, invalid, totalEarned);
    }
}
