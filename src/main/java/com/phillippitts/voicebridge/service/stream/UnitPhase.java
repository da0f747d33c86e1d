package com.phillippitts.voicebridge.service.stream;

/**
 * Progress of the logical unit the result path is currently emitting for.
 */
public enum UnitPhase {
    /** Dequeued, nothing emitted yet. The next result carries {@code firstChunk=true}. */
    AWAITING_FIRST_CHUNK,
    STREAMING,
    /** End of unit seen. The next inbound event belongs to the next pending unit. */
    COMPLETED
}
