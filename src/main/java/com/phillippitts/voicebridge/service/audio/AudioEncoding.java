package com.phillippitts.voicebridge.service.audio;

/**
 * Encoding of raw audio received from a synthesis provider.
 */
public enum AudioEncoding {
    /** 16-bit signed little-endian PCM. */
    PCM16,
    /** 8-bit mu-law at 8 kHz. */
    MULAW
}
