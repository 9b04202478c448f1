package com.crewmind.core.ratelimit;

import java.time.Duration;

/**
 * Process-wide gate for outbound calls (tool invocations and model calls).
 */
public interface RateLimiter {

    /**
     * Blocks until the caller may proceed.
     *
     * @param caller tool id or model provider, used for logging and error messages
     * @return how long the caller waited
     * @throws RateLimitTimeoutException when the required wait exceeds the configured maximum
     */
    Duration acquire(String caller);

    /** A limiter that never waits. */
    static RateLimiter unlimited() {
        return caller -> Duration.ZERO;
    }
}
