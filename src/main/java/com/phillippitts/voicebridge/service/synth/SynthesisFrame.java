package com.phillippitts.voicebridge.service.synth;

import java.util.Objects;

/**
 * One decoded inbound frame of the ElevenLabs stream.
 *
 * @param audio   decoded audio; empty when the frame carried none
 * @param isFinal true on the frame that ends the current unit
 */
public record SynthesisFrame(byte[] audio, boolean isFinal) {

    public SynthesisFrame {
        Objects.requireNonNull(audio, "audio must not be null");
    }

    public boolean hasAudio() {
        return audio.length > 0;
    }
}
