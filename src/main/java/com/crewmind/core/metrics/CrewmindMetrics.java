package com.crewmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class CrewmindMetrics {

    private final MeterRegistry registry;

    public CrewmindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String agentId, String status, long ms) {
        Timer.builder("crewmind.task.duration")
                .tag("agent", agentId)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "success", "failure" or "rate_limited"
     */
    public void recordToolCall(String toolId, String outcome) {
        Counter.builder("crewmind.tool.calls")
                .description("External tool invocations (cache misses only)")
                .tag("tool", toolId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("crewmind.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void recordRateLimitWait(long waitMs) {
        Timer.builder("crewmind.ratelimit.wait")
                .description("Time callers spent waiting for a rate-limit slot")
                .register(registry)
                .record(Duration.ofMillis(waitMs));
    }

    public void recordModelCall(String provider) {
        Counter.builder("crewmind.model.calls")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void recordAgentIterations(int iterations) {
        DistributionSummary.builder("crewmind.agent.iterations")
                .description("Tool rounds used per task")
                .register(registry)
                .record(iterations);
    }

    public void recordSchemaViolation(String taskId) {
        Counter.builder("crewmind.schema.violations")
                .tag("task", taskId)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("crewmind.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
