package com.caradonti.finance_ledger.idempotency;

import com.caradonti.finance_ledger.ledger.LedgerEntryRepository;
import com.caradonti.finance_ledger.register.CashRegisterEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for append requests.
 *
 * Redis is a fast path only. The unique idempotency_key column on the entry
 * tables is the source of truth, so a Redis outage costs a database lookup and
 * never a duplicate entry.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerEntryRepository ledgerEntryRepository;
    private final CashRegisterEntryRepository registerEntryRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(LedgerEntryRepository ledgerEntryRepository,
                              CashRegisterEntryRepository registerEntryRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.ledgerEntryRepository = ledgerEntryRepository;
        this.registerEntryRepository = registerEntryRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up the entry created earlier with this key, if any.
     *
     * @return id of the entry created with the key, or empty for a new request
     */
    public Optional<UUID> checkIdempotencyKey(IdempotencyScope scope, String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = redisKey(scope, idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: scope={}, key={}", scope, idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing = switch (scope) {
            case EVENT_ENTRY -> ledgerEntryRepository.findIdByIdempotencyKey(idempotencyKey);
            case REGISTER_ENTRY -> registerEntryRepository.findIdByIdempotencyKey(idempotencyKey);
        };
        existing.ifPresent(id -> {
            log.debug("Idempotency key found in database: scope={}, key={}", scope, idempotencyKey);
            cache(redisKey, id);
        });
        return existing;
    }

    /**
     * Caches the key in Redis. The database row written with the entry already
     * holds it, so a failure here is only logged.
     */
    public void storeIdempotencyKey(IdempotencyScope scope, String idempotencyKey, UUID entryId) {
        requireKey(idempotencyKey);
        if (entryId == null) {
            throw new IllegalArgumentException("Entry ID cannot be null");
        }
        cache(redisKey(scope, idempotencyKey), entryId);
    }

    private void cache(String redisKey, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, entryId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", redisKey, e.getMessage());
        }
    }

    private static String redisKey(IdempotencyScope scope, String idempotencyKey) {
        return REDIS_KEY_PREFIX + scope.getKeyPrefix() + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
