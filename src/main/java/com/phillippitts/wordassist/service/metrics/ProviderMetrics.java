package com.phillippitts.wordassist.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for AI provider calls.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Call latency per provider</li>
 *   <li>Success/failure counts per provider and failure reason</li>
 *   <li>Fallbacks away from a provider</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ProviderMetrics {

    private static final String METRIC_PREFIX = "wordassist.provider";

    private final MeterRegistry registry;

    public ProviderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one HTTP call.
     *
     * @param providerId provider id
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String providerId, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a provider HTTP call")
                .tag("provider", providerId)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String providerId) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful provider calls")
                .tag("provider", providerId)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for a provider.
     *
     * @param providerId provider id
     * @param reason failure reason (network, upstream, authentication, ...)
     */
    public void incrementFailure(String providerId, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed provider calls")
                .tag("provider", providerId)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a fallback away from a provider after its retries were exhausted.
     *
     * @param providerId provider that was given up on
     */
    public void incrementFallback(String providerId) {
        Counter.builder(METRIC_PREFIX + ".fallback")
                .description("Number of times a provider was abandoned for the next candidate")
                .tag("provider", providerId)
                .register(registry)
                .increment();
    }
}
