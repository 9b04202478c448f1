package com.crewmind.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached tool response. Immutable; expiry is checked lazily on lookup.
 *
 * @param key       {@link CacheKey} in its {@code toolId:digest} form
 * @param value     the tool's response text
 * @param createdAt when the response was stored
 * @param ttl       how long the response stays valid
 */
public record CacheEntry(String key, String value, Instant createdAt, Duration ttl) {

    public CacheEntry {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be non-negative");
        }
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }

    /** Time left before expiry, never negative. */
    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, createdAt.plus(ttl));
        return left.isNegative() ? Duration.ZERO : left;
    }
}
