package com.phillippitts.voicebridge.service.synth;

import java.util.Locale;
import java.util.Objects;

/**
 * Cache key for synthesized audio. Text is canonicalized (trimmed, whitespace collapsed) so that
 * chunking differences do not produce distinct entries; voice, model and output format are part of
 * the key because they change the audio.
 */
public record SynthesisCacheKey(String text, String voiceId, String model, String outputFormat) {

    public SynthesisCacheKey {
        Objects.requireNonNull(text, "text must not be null");
        text = text.strip().replaceAll("\\s+", " ");
        voiceId = voiceId == null ? "" : voiceId;
        model = model == null ? "" : model.toLowerCase(Locale.ROOT);
        outputFormat = outputFormat == null ? "" : outputFormat.toLowerCase(Locale.ROOT);
    }

    public String value() {
        return voiceId + '|' + model + '|' + outputFormat + '|' + text;
    }
}
