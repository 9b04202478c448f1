package com.crewmind.core.tool;

import com.crewmind.core.ratelimit.RateLimitTimeoutException;
import com.crewmind.core.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Performs one external call with a per-attempt timeout and bounded retry with
 * exponential backoff. Used for tool invocations and for model calls.
 * {@link IllegalArgumentException} and {@link SecurityException} are not retried.
 * Rate limit slots are awaited under the same attempt and backoff settings.
 */
public class ToolInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolInvoker.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double backoffMultiplier;
    private final Duration callTimeout;
    private final Sleeper sleeper;
    private final ExecutorService callExecutor;

    public ToolInvoker(int maxAttempts, Duration initialBackoff, double backoffMultiplier, Duration callTimeout) {
        this(maxAttempts, initialBackoff, backoffMultiplier, callTimeout, Thread::sleep);
    }

    public ToolInvoker(int maxAttempts, Duration initialBackoff, double backoffMultiplier,
                       Duration callTimeout, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff;
        this.backoffMultiplier = Math.max(1.0, backoffMultiplier);
        this.callTimeout = callTimeout;
        this.sleeper = sleeper;
        var counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "crewmind-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public String invoke(Tool tool, Map<String, Object> parameters) {
        return execute(tool.id(), () -> tool.invoke(parameters));
    }

    /**
     * Acquires a slot from {@code limiter}, backing off and trying again when the
     * required wait exceeds the limiter's maximum.
     *
     * @return time spent waiting inside the limiter, excluding backoff
     * @throws RateLimitTimeoutException when every attempt timed out
     */
    public Duration awaitSlot(RateLimiter limiter, String callerId) {
        long backoffMs = initialBackoff.toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return limiter.acquire(callerId);
            } catch (RateLimitTimeoutException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Rate limit slot for '{}' too far away (attempt {}/{}), backing off {}ms",
                        callerId, attempt, maxAttempts, backoffMs);
                pause(callerId, backoffMs);
                backoffMs = (long) (backoffMs * backoffMultiplier);
            }
        }
    }

    /**
     * Runs {@code call} until it succeeds or the attempts are used up.
     *
     * @throws ToolInvocationException after the final failed attempt
     */
    public String execute(String callerId, Callable<String> call) {
        long backoffMs = initialBackoff.toMillis();
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return callWithTimeout(call);
            } catch (TimeoutException e) {
                lastError = e;
                log.warn("Call '{}' timed out after {}ms (attempt {}/{})",
                        callerId, callTimeout.toMillis(), attempt, maxAttempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ToolInvocationException(callerId, "Call '" + callerId + "' interrupted", e);
            } catch (IllegalArgumentException | SecurityException e) {
                // bad parameters or a refused path; retrying cannot help
                throw new ToolInvocationException(callerId,
                        "Call '" + callerId + "' rejected: " + e.getMessage(), e);
            } catch (Exception e) {
                lastError = e;
                log.warn("Call '{}' failed (attempt {}/{}): {}", callerId, attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                pause(callerId, backoffMs);
                backoffMs = (long) (backoffMs * backoffMultiplier);
            }
        }

        String detail = lastError instanceof TimeoutException
                ? "timed out after " + callTimeout.toMillis() + "ms"
                : lastError.getMessage();
        throw new ToolInvocationException(callerId,
                "Call '" + callerId + "' failed after " + maxAttempts + " attempt(s): " + detail, lastError);
    }

    private void pause(String callerId, long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException(callerId, "Call '" + callerId + "' interrupted during backoff", ie);
        }
    }

    private String callWithTimeout(Callable<String> call) throws Exception {
        Future<String> future = callExecutor.submit(call);
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw e;
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Stops accepting calls and lets in-flight ones finish within one call timeout.
     */
    @Override
    public void close() {
        callExecutor.shutdown();
        try {
            if (!callExecutor.awaitTermination(callTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Calls still running after {}ms, interrupting", callTimeout.toMillis());
                callExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            callExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
