package com.phillippitts.voicebridge.domain;

import java.util.Objects;

/**
 * One result produced by a streaming adapter: a payload plus the metadata snapshot that was active
 * when it was emitted.
 *
 * <p>Created once per inbound event and consumed once by the caller.
 *
 * @param payload  result payload (audio bytes for synthesis, {@link TranscriptEvent} for transcription)
 * @param metadata metadata snapshot at emission time
 * @param <T>      payload type
 */
public record StreamResult<T>(T payload, StreamMetadata metadata) {

    public StreamResult {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    public boolean isFirstChunk() {
        return metadata.firstChunk();
    }

    public boolean isEndOfStream() {
        return metadata.endOfStream();
    }

    public String requestId() {
        return metadata.requestId();
    }

    public String format() {
        return metadata.format();
    }
}
