package com.phillippitts.voicebridge.service.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final StreamingMetrics metrics = new StreamingMetrics(registry);

    @Test
    void countersShouldBeTaggedPerProvider() {
        metrics.recordSubmitted("elevenlabs", 11);
        metrics.recordSubmitted("azure", 320);
        metrics.incrementResults("elevenlabs");
        metrics.incrementResults("elevenlabs");

        assertThat(registry.get("voicebridge.stream.submitted").tag("provider", "elevenlabs").counter().count())
                .isEqualTo(11.0);
        assertThat(registry.get("voicebridge.stream.submitted").tag("provider", "azure").counter().count())
                .isEqualTo(320.0);
        assertThat(registry.get("voicebridge.stream.results").tag("provider", "elevenlabs").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountProtocolAnomalies() {
        metrics.incrementDesync("azure");
        metrics.incrementMalformed("azure");
        metrics.incrementReconnects("azure");

        assertThat(registry.get("voicebridge.stream.desync").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("voicebridge.stream.malformed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("voicebridge.stream.reconnects").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordFirstChunkLatency() {
        metrics.recordFirstChunkLatency("elevenlabs", TimeUnit.MILLISECONDS.toNanos(40));

        var timer = registry.get("voicebridge.stream.first_chunk_latency").tag("provider", "elevenlabs").timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
    }
}
