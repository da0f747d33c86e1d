package com.phillippitts.voicebridge.service.health;

import com.phillippitts.voicebridge.service.stream.StreamingAdapter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the enabled streaming adapters.
 *
 * <p>Reports connection state for monitoring and alerting:
 * <ul>
 *   <li>UP: every adapter connected</li>
 *   <li>DEGRADED: at least one adapter connected</li>
 *   <li>DOWN: no adapter connected</li>
 *   <li>UNKNOWN: no adapter enabled</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class StreamingHealthIndicator implements HealthIndicator {

    private final ObjectProvider<StreamingAdapter<?, ?>> adapters;

    public StreamingHealthIndicator(ObjectProvider<StreamingAdapter<?, ?>> adapters) {
        this.adapters = adapters;
    }

    @Override
    public Health health() {
        List<StreamingAdapter<?, ?>> enabled = adapters.orderedStream().toList();
        if (enabled.isEmpty()) {
            return Health.unknown().withDetail("status", "No streaming adapters enabled").build();
        }

        long connected = enabled.stream().filter(StreamingAdapter::isConnected).count();
        Health.Builder builder;
        if (connected == enabled.size()) {
            builder = Health.up().withDetail("status", "All adapters connected");
        } else if (connected > 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Partial adapter availability");
        } else {
            builder = Health.down().withDetail("status", "No adapters connected");
        }
        for (StreamingAdapter<?, ?> adapter : enabled) {
            builder.withDetail(adapter.getProviderName(), describe(adapter));
        }
        return builder.build();
    }

    private String describe(StreamingAdapter<?, ?> adapter) {
        if (!adapter.isRunning()) {
            return "stopped";
        }
        String state = adapter.isConnected() ? "connected" : "reconnecting";
        return state + ", pending=" + adapter.getPendingUnits();
    }
}
