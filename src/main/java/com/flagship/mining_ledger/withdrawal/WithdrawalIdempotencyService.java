package com.flagship.mining_ledger.withdrawal;

import com.flagship.mining_ledger.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves withdrawal idempotency keys to the withdrawal they produced.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the withdrawals table, which is the source of truth
 * 3. Cache database hits and new withdrawals in Redis
 *
 * Keys are scoped per account: two accounts may use the same key.
 * Redis being down never blocks a withdrawal.
 */
@Service
@Slf4j
public class WithdrawalIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:withdrawal:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final WithdrawalRepository withdrawalRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public WithdrawalIdempotencyService(WithdrawalRepository withdrawalRepository,
                                        Optional<StringRedisTemplate> redisTemplate) {
        this.withdrawalRepository = withdrawalRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the withdrawal id previously recorded for this account and key
     */
    public Optional<UUID> checkIdempotencyKey(UUID accountId, String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(accountId, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String withdrawalId = redisTemplate.get().opsForValue().get(redisKey);
                if (withdrawalId != null) {
                    log.debug("Idempotency key found in Redis: accountId={}, key={}", accountId, idempotencyKey);
                    return Optional.of(UUID.fromString(withdrawalId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<WithdrawalEntity> existing;
        try {
            existing = withdrawalRepository.findByAccountIdAndIdempotencyKey(accountId, idempotencyKey);
        } catch (Exception e) {
            log.error("Database lookup failed for idempotency key: {}. Error: {}", idempotencyKey, e.getMessage());
            throw new InfrastructureException("Failed to check idempotency key", e);
        }

        existing.ifPresent(entity -> cache(redisKey, entity.getId()));
        return existing.map(WithdrawalEntity::getId);
    }

    /**
     * Caches the key once the surrounding transaction commits, so a rolled
     * back withdrawal never leaves a key behind. The database row written by
     * the withdrawal itself is the durable record.
     */
    public void storeIdempotencyKey(UUID accountId, String idempotencyKey, UUID withdrawalId) {
        requireKey(idempotencyKey);
        if (withdrawalId == null) {
            throw new IllegalArgumentException("Withdrawal ID cannot be null");
        }
        String redisKey = redisKey(accountId, idempotencyKey);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(redisKey, withdrawalId);
                }
            });
        } else {
            cache(redisKey, withdrawalId);
        }
    }

    private void cache(String redisKey, UUID withdrawalId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, withdrawalId.toString(), REDIS_TTL);
            log.debug("Cached idempotency key in Redis: {} -> {}", redisKey, withdrawalId);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", redisKey, e.getMessage());
        }
    }

    private static String redisKey(UUID accountId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + accountId + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
