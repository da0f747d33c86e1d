package com.phillippitts.voicebridge.service.stream.connection.event;

import java.time.Instant;

/**
 * Published when the supervisor finds that a previously live connection has died.
 */
public record ConnectionLostEvent(String provider, Instant at) {}
