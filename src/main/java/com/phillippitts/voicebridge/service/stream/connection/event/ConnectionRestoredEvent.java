package com.phillippitts.voicebridge.service.stream.connection.event;

import java.time.Instant;

/**
 * Published when a replacement connection is live again after a loss.
 *
 * @param provider provider name
 * @param at       time the replacement was installed
 * @param attempts connect attempts it took, including the successful one
 */
public record ConnectionRestoredEvent(String provider, Instant at, int attempts) {}
