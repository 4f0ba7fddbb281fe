package com.flagship.poker_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps Idempotency-Key headers to the transaction they created.
 *
 * Redis is the fast path and may be missing or down. The unique
 * transactions.idempotency_key column is the source of truth, so a Redis
 * failure only costs a database lookup.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "poker-ledger:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransactionRepository transactionRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(TransactionRepository transactionRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the transaction created with this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = lookupRedis(idempotencyKey);
        if (cached.isPresent()) {
            return cached;
        }
        return lookupDatabase(idempotencyKey);
    }

    /**
     * Database-only lookup. Used after the game lock is taken, when an
     * earlier concurrent request with the same key may just have committed.
     */
    public Optional<UUID> lookupDatabase(String idempotencyKey) {
        requireKey(idempotencyKey);
        Optional<UUID> existing = transactionRepository.findByIdempotencyKey(idempotencyKey)
            .map(TransactionEntity::getId);
        existing.ifPresent(transactionId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, transactionId);
        });
        return existing;
    }

    /**
     * Caches the key after the transaction row (which carries the key) is saved.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction ID cannot be null");
        }
        cache(idempotencyKey, transactionId);
    }

    private Optional<UUID> lookupRedis(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String transactionId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            if (transactionId != null) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return Optional.of(UUID.fromString(transactionId));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                idempotencyKey, e.getMessage());
        }
        return Optional.empty();
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            // the database row is authoritative
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
