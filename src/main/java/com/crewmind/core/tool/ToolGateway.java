package com.crewmind.core.tool;

import com.crewmind.core.cache.CacheKey;
import com.crewmind.core.cache.ResponseCache;
import com.crewmind.core.metrics.CrewmindMetrics;
import com.crewmind.core.ratelimit.RateLimitTimeoutException;
import com.crewmind.core.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single path for tool requests: rate limiter, then response cache, then invoker.
 * Successful responses are written back to the cache.
 */
public class ToolGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolGateway.class);

    private final ToolCatalog catalog;
    private final RateLimiter rateLimiter;
    private final ResponseCache cache;
    private final ToolInvoker invoker;
    private final CrewmindMetrics metrics;

    public ToolGateway(ToolCatalog catalog, RateLimiter rateLimiter, ResponseCache cache,
                       ToolInvoker invoker, CrewmindMetrics metrics) {
        this.catalog = catalog;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.invoker = invoker;
        this.metrics = metrics;
    }

    /**
     * @throws ToolNotPermittedException when the catalog has no such tool
     * @throws ToolInvocationException   when the call, or the wait for a rate limit slot, fails after retries
     */
    public ToolCallResult call(String toolId, Map<String, Object> parameters) {
        Tool tool = catalog.find(toolId)
                .orElseThrow(() -> new ToolNotPermittedException(toolId, catalog.all().stream()
                        .map(Tool::id).collect(Collectors.toSet())));

        try {
            var waited = invoker.awaitSlot(rateLimiter, toolId);
            metrics.recordRateLimitWait(waited.toMillis());
        } catch (RateLimitTimeoutException e) {
            metrics.recordToolCall(toolId, "rate_limited");
            throw e;
        }

        var key = CacheKey.of(toolId, parameters);
        var cached = cache.get(key);
        metrics.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            log.debug("Cache hit for tool '{}' ({})", toolId, key.digest());
            return new ToolCallResult(toolId, cached.get(), true);
        }

        try {
            String output = invoker.invoke(tool, parameters == null ? Map.of() : parameters);
            metrics.recordToolCall(toolId, "success");
            cache.put(key, output);
            return new ToolCallResult(toolId, output, false);
        } catch (ToolInvocationException e) {
            metrics.recordToolCall(toolId, "failure");
            throw e;
        }
    }

    public ToolCatalog getCatalog() {
        return catalog;
    }
}
