package com.phillippitts.voicebridge.domain;

import java.util.Objects;

/**
 * Typed payload emitted by the transcriber.
 *
 * @param type    one of {@link #INTERIM}, {@link #FINAL} or {@link #CONNECTION_CLOSED}
 * @param content recognized text (empty for lifecycle notifications)
 */
public record TranscriptEvent(String type, String content) {

    public static final String INTERIM = "interim_transcript_received";
    public static final String FINAL = "transcript";
    public static final String CONNECTION_CLOSED = "transcriber_connection_closed";

    public TranscriptEvent {
        Objects.requireNonNull(type, "type must not be null");
        content = content == null ? "" : content;
    }

    public static TranscriptEvent interim(String text) {
        return new TranscriptEvent(INTERIM, text);
    }

    public static TranscriptEvent transcript(String text) {
        return new TranscriptEvent(FINAL, text);
    }

    public static TranscriptEvent connectionClosed() {
        return new TranscriptEvent(CONNECTION_CLOSED, "");
    }

    public boolean isFinal() {
        return FINAL.equals(type);
    }
}
