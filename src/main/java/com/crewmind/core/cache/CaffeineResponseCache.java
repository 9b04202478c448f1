package com.crewmind.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ResponseCache} backed by Caffeine with per-entry expiry.
 * <p>
 * Caffeine evicts entries in the background; lookups additionally compare the
 * entry's creation time and ttl with the injected clock, so an expired entry is
 * a miss even before eviction runs. Any cache failure is logged and treated as a miss.
 */
public class CaffeineResponseCache implements ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineResponseCache.class);

    private final Cache<String, CacheEntry> cache;
    private final Duration defaultTtl;
    private final Clock clock;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public CaffeineResponseCache(Duration defaultTtl, long maxEntries) {
        this(defaultTtl, maxEntries, Clock.systemUTC());
    }

    public CaffeineResponseCache(Duration defaultTtl, long maxEntries, Clock clock) {
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry(clock))
                .recordStats()
                .build();
        log.info("Initialized response cache: defaultTtl={}, maxEntries={}", defaultTtl, maxEntries);
    }

    @Override
    public Optional<String> get(CacheKey key) {
        try {
            String k = key.toString();
            CacheEntry entry = cache.getIfPresent(k);
            if (entry != null && entry.isExpired(clock.instant())) {
                cache.invalidate(k);
                entry = null;
            }
            if (entry == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(entry.value());
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for {}, treating as miss: {}", key, e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    @Override
    public void put(CacheKey key, String value, Duration ttl) {
        if (value == null) return;
        try {
            String k = key.toString();
            cache.put(k, new CacheEntry(k, value, clock.instant(), ttl));
        } catch (RuntimeException e) {
            log.warn("Cache store failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void put(CacheKey key, String value) {
        put(key, value, defaultTtl);
    }

    @Override
    public long hits() {
        return hits.get();
    }

    @Override
    public long misses() {
        return misses.get();
    }

    @Override
    public List<CacheEntry> snapshot() {
        var now = clock.instant();
        var entries = new ArrayList<CacheEntry>();
        for (var entry : cache.asMap().values()) {
            if (!entry.isExpired(now)) {
                entries.add(entry);
            }
        }
        return entries;
    }

    @Override
    public int restore(List<CacheEntry> entries) {
        var now = clock.instant();
        int restored = 0;
        for (var entry : entries) {
            if (entry.isExpired(now)) continue;
            cache.put(entry.key(), entry);
            restored++;
        }
        log.info("Restored {} of {} cached responses", restored, entries.size());
        return restored;
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        private final Clock clock;

        EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.remaining(clock.instant()).toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.remaining(clock.instant()).toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
