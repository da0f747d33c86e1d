package com.phillippitts.voicebridge.service.audio;

import java.util.Objects;

/**
 * Audio ready for the consumer, with the format tag to put on its metadata.
 */
public record NormalizedAudio(byte[] data, String format) {

    public NormalizedAudio {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }
}
