package com.phillippitts.voicebridge.service.stream.connection;

import com.phillippitts.voicebridge.service.stream.connection.event.ConnectionLostEvent;
import com.phillippitts.voicebridge.service.stream.connection.event.ConnectionRestoredEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;

/**
 * Utility class for publishing connection lifecycle events.
 *
 * <p>A null publisher is tolerated so that adapters can run outside a Spring context (tests).
 */
public final class ConnectionEventPublisher {

    private ConnectionEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publishLost(ApplicationEventPublisher publisher, String provider) {
        if (publisher != null) {
            publisher.publishEvent(new ConnectionLostEvent(provider, Instant.now()));
        }
    }

    public static void publishRestored(ApplicationEventPublisher publisher, String provider, int attempts) {
        if (publisher != null) {
            publisher.publishEvent(new ConnectionRestoredEvent(provider, Instant.now(), attempts));
        }
    }
}
