package com.phillippitts.voicebridge.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for streaming adapters.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Submitted volume per provider (characters for synthesis, bytes for transcription)</li>
 *   <li>Emitted results and first-chunk latency</li>
 *   <li>Reconnects, correlation desyncs and malformed inbound events</li>
 * </ul>
 *
 * <p>All meters are tagged with {@code provider}.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class StreamingMetrics {

    private static final String METRIC_PREFIX = "voicebridge.stream";

    private final MeterRegistry registry;

    public StreamingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Adds submitted volume for a provider.
     *
     * @param provider provider name (elevenlabs, azure)
     * @param amount characters or bytes submitted
     */
    public void recordSubmitted(String provider, long amount) {
        Counter.builder(METRIC_PREFIX + ".submitted")
                .description("Characters or bytes submitted to the speech service")
                .tag("provider", provider)
                .register(registry)
                .increment(amount);
    }

    public void incrementResults(String provider) {
        Counter.builder(METRIC_PREFIX + ".results")
                .description("Number of results emitted to consumers")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void incrementReconnects(String provider) {
        Counter.builder(METRIC_PREFIX + ".reconnects")
                .description("Number of successful reconnects after a lost connection")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * Counts an inbound event that arrived with no pending unit to correlate it with.
     *
     * @param provider provider name
     */
    public void incrementDesync(String provider) {
        Counter.builder(METRIC_PREFIX + ".desync")
                .description("Inbound events without a pending correlation entry")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    public void incrementMalformed(String provider) {
        Counter.builder(METRIC_PREFIX + ".malformed")
                .description("Inbound events that could not be parsed")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }

    /**
     * Records the time between submitting a unit and emitting its first result.
     *
     * @param provider provider name
     * @param durationNanos duration in nanoseconds
     */
    public void recordFirstChunkLatency(String provider, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".first_chunk_latency")
                .description("Time from submission to first emitted result")
                .tag("provider", provider)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
