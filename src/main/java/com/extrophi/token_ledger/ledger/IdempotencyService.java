package com.extrophi.token_ledger.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency key lookup for award and transfer requests.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the ledger (the key is stored on the entry, unique)
 * 3. Cache database hits in Redis for future lookups
 *
 * The ledger is the source of truth. Redis failures are logged and ignored.
 */
@Service
@Slf4j
public class IdempotencyService {

    /** Width of ledger_entries.idempotency_key. */
    public static final int MAX_KEY_LENGTH = 255;

    private static final String REDIS_KEY_PREFIX = "idempotency:";

    private final LedgerRepository ledgerRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean redisEnabled;
    private final Duration ttl;

    public IdempotencyService(LedgerRepository ledgerRepository,
                              Optional<StringRedisTemplate> redisTemplate,
                              @Value("${ledger.idempotency.redis-enabled:true}") boolean redisEnabled,
                              @Value("${ledger.idempotency.ttl:7d}") Duration ttl) {
        this.ledgerRepository = ledgerRepository;
        this.redisTemplate = redisTemplate;
        this.redisEnabled = redisEnabled;
        this.ttl = ttl;
    }

    /**
     * Finds the ledger entry previously posted under this key.
     */
    public Optional<LedgerEntry> findExisting(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        Optional<UUID> cachedEntryId = lookupRedis(idempotencyKey);
        if (cachedEntryId.isPresent()) {
            Optional<LedgerEntry> cached = ledgerRepository.findById(cachedEntryId.get());
            if (cached.isPresent()) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
        }

        Optional<LedgerEntry> existing = ledgerRepository.findByIdempotencyKey(idempotencyKey);
        existing.ifPresent(entry -> {
            log.debug("Idempotency key found in ledger: {}", idempotencyKey);
            remember(idempotencyKey, entry.getId());
        });
        return existing;
    }

    /**
     * Caches the key to entry mapping in Redis. Best effort.
     */
    public void remember(String idempotencyKey, UUID entryId) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, entryId.toString(), ttl);
        } catch (Exception e) {
            log.warn("Failed to store idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private Optional<UUID> lookupRedis(String idempotencyKey) {
        if (!redisEnabled || redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String entryId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(entryId).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to ledger. Error: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }
}
