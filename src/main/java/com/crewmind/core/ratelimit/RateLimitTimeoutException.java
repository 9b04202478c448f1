package com.crewmind.core.ratelimit;

import com.crewmind.core.tool.ToolInvocationException;

import java.time.Duration;

/**
 * Thrown when the next free slot is further away than the configured maximum wait.
 */
public class RateLimitTimeoutException extends ToolInvocationException {

    private final Duration requiredWait;

    public RateLimitTimeoutException(String caller, Duration requiredWait, Duration maxWait) {
        super(caller, "Rate limit slot for '" + caller + "' needs a wait of " + requiredWait.toMillis()
                + "ms, exceeding the maximum of " + maxWait.toMillis() + "ms");
        this.requiredWait = requiredWait;
    }

    public Duration getRequiredWait() {
        return requiredWait;
    }
}
