package com.flagship.journal_ledger.journal;

import com.flagship.journal_ledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers which journal entry represents a {@code (sourceType, sourceId)} pair.
 *
 * Strategy:
 * 1. Redis first, as a hint that lets a replayed submission return without
 *    taking any lock
 * 2. The database is the authority: the caller re-checks it under the source
 *    lock before creating anything
 * 3. Redis is written and evicted only after the posting transaction commits,
 *    so a rolled-back posting never leaves a mapping behind
 *
 * Redis being down only costs the fast path.
 */
@Service
@Slf4j
public class SourceIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:source:";

    private final JournalEntryStore store;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean redisEnabled;
    private final Duration ttl;

    public SourceIdempotencyService(JournalEntryStore store,
                                    Optional<StringRedisTemplate> redisTemplate,
                                    LedgerProperties properties) {
        this.store = store;
        this.redisTemplate = redisTemplate;
        this.redisEnabled = properties.getIdempotency().isRedisEnabled();
        this.ttl = Duration.ofHours(properties.getIdempotency().getTtlHours());
    }

    /**
     * Fast-path lookup. A hit may be stale; the caller must confirm the entry is still live.
     */
    public Optional<UUID> findCachedEntryId(SourceType sourceType, long sourceId) {
        if (!redisAvailable()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(key(sourceType, sourceId));
            if (value != null) {
                log.debug("Source mapping found in Redis: {}:{} -> {}", sourceType, sourceId, value);
                return Optional.of(UUID.fromString(value));
            }
        } catch (Exception e) {
            log.warn("Redis lookup failed for source {}:{}. Falling back to database. Error: {}",
                    sourceType, sourceId, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Authoritative lookup of the live entry for a source. Call while holding the source lock.
     */
    public Optional<JournalEntry> findLiveEntry(SourceType sourceType, long sourceId) {
        return store.findLiveBySource(sourceType, sourceId);
    }

    /**
     * Caches the mapping once the current transaction commits.
     */
    public void rememberAfterCommit(SourceType sourceType, long sourceId, UUID entryId) {
        if (!redisAvailable()) {
            return;
        }
        afterCommit(() -> {
            try {
                redisTemplate.get().opsForValue().set(key(sourceType, sourceId), entryId.toString(), ttl);
            } catch (Exception e) {
                log.warn("Failed to cache source mapping {}:{} in Redis: {}", sourceType, sourceId, e.getMessage());
            }
        });
    }

    /**
     * Drops the mapping once the current transaction commits, freeing the source for a new posting.
     */
    public void forgetAfterCommit(SourceType sourceType, long sourceId) {
        if (!redisAvailable()) {
            return;
        }
        afterCommit(() -> {
            try {
                redisTemplate.get().delete(key(sourceType, sourceId));
            } catch (Exception e) {
                log.warn("Failed to evict source mapping {}:{} from Redis: {}", sourceType, sourceId, e.getMessage());
            }
        });
    }

    private boolean redisAvailable() {
        return redisEnabled && redisTemplate.isPresent();
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    static String key(SourceType sourceType, long sourceId) {
        return REDIS_KEY_PREFIX + sourceType.name() + ":" + sourceId;
    }
}
