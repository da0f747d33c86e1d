package com.phillippitts.voicebridge.service.audio;

/**
 * Converts provider audio into the format consumers expect. Implementations are pure functions.
 */
public interface AudioNormalizer {

    /**
     * Normalizes one chunk of provider audio.
     *
     * @param raw provider audio
     * @param targetSampleRate sample rate the consumer wants
     * @return converted audio and its format tag
     */
    NormalizedAudio normalize(byte[] raw, int targetSampleRate);

    /**
     * Applies the same sample-rate conversion to an end-of-unit sentinel, without any container.
     */
    NormalizedAudio normalizeSentinel(byte[] sentinel, int targetSampleRate);
}
