package com.delta.prospector.company.cache;

import com.delta.prospector.company.model.CacheEntry;
import com.delta.prospector.company.model.QueryFingerprint;
import com.delta.prospector.company.persistence.QueryCacheRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Durable read-through cache for upstream query results, keyed by {@link QueryFingerprint}.
 *
 * <p>Concurrent misses for one fingerprint share a single in-flight fetch. Fetch failures are
 * rethrown to every waiting caller and nothing is stored for them.
 */
@Service
public class QueryCacheStore {
    private static final Logger log = LoggerFactory.getLogger(QueryCacheStore.class);

    private final QueryCacheRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ConcurrentMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public QueryCacheStore(QueryCacheRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Returns the cached value for {@code fingerprint} when it is younger than {@code ttl} and not
     * past its stored expiry, otherwise fetches, stores and returns a fresh one. The same fingerprint
     * may be read with different TTLs; each caller only sees entries fresh enough for its own TTL.
     */
    public <T> T getOrFetch(QueryFingerprint fingerprint, Duration ttl, Class<T> type, Supplier<T> fetcher) {
        Duration safeTtl = safeTtl(ttl);
        T cached = readLive(fingerprint, safeTtl, type);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(fingerprint.value(), mine);
        if (existing != null) {
            log.debug("Joining in-flight fetch for {} {}", fingerprint.kind(), fingerprint.value());
            return type.cast(await(existing));
        }

        try {
            // A previous leader may have stored the value between our read and our registration.
            T stored = readLive(fingerprint, safeTtl, type);
            if (stored != null) {
                mine.complete(stored);
                return stored;
            }
            T fetched = fetcher.get();
            if (fetched != null) {
                store(fingerprint, safeTtl, fetched);
            }
            mine.complete(fetched);
            return fetched;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint.value(), mine);
        }
    }

    public boolean invalidate(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return false;
        }
        boolean removed = repository.delete(fingerprint.trim()) > 0;
        if (removed) {
            log.info("Invalidated cache entry {}", fingerprint);
        }
        return removed;
    }

    public boolean invalidate(QueryFingerprint fingerprint) {
        return invalidate(fingerprint.value());
    }

    public int clear() {
        int removed = repository.deleteAll();
        log.info("Cleared query cache ({} entries)", removed);
        return removed;
    }

    public int purgeExpired() {
        int removed = repository.deleteExpired(clock.instant());
        if (removed > 0) {
            log.info("Purged {} expired cache entries", removed);
        }
        return removed;
    }

    private <T> T readLive(QueryFingerprint fingerprint, Duration ttl, Class<T> type) {
        CacheEntry entry;
        try {
            entry = repository.find(fingerprint.value());
        } catch (DataAccessException e) {
            log.warn("Cache read failed for {}; fetching upstream", fingerprint.value(), e);
            return null;
        }
        if (entry == null) {
            return null;
        }
        Instant now = clock.instant();
        if (!entry.isLive(now)) {
            deleteQuietly(fingerprint.value());
            return null;
        }
        if (!entry.isFreshFor(now, ttl)) {
            log.debug("Cache entry {} is older than {}; refetching", fingerprint.value(), ttl);
            return null;
        }
        try {
            T value = objectMapper.readValue(entry.payloadJson(), type);
            log.debug("Cache hit for {} {}", fingerprint.kind(), fingerprint.value());
            return value;
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", fingerprint.value(), e.getOriginalMessage());
            return null;
        }
    }

    private void store(QueryFingerprint fingerprint, Duration safeTtl, Object value) {
        Instant now = clock.instant();
        try {
            String payload = objectMapper.writeValueAsString(value);
            repository.upsert(new CacheEntry(fingerprint.value(), fingerprint.kind(), payload, now, now.plus(safeTtl)));
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Unable to store cache entry {}; returning fetched value uncached", fingerprint.value(), e);
        }
    }

    private static Duration safeTtl(Duration ttl) {
        return ttl == null || ttl.isNegative() || ttl.isZero() ? Duration.ofMinutes(1) : ttl;
    }

    private void deleteQuietly(String fingerprint) {
        try {
            repository.delete(fingerprint);
        } catch (DataAccessException e) {
            log.debug("Unable to delete expired cache entry {}", fingerprint, e);
        }
    }

    private Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
