package com.phillippitts.voicebridge.service.audio;

/**
 * Audio constants shared by the normalizer and the WAV writer.
 * PCM is always 16-bit signed, mono, little-endian; only the sample rate varies.
 */
public final class AudioFormat {

    /** Format tag of WAV-wrapped PCM results. */
    public static final String FORMAT_WAV = "wav";
    /** Format tag of raw 8 kHz mu-law results. */
    public static final String FORMAT_MULAW = "mulaw";

    public static final int PCM_BITS_PER_SAMPLE = 16;
    public static final int PCM_CHANNELS = 1;
    /** Bytes per PCM frame (sample for all channels). */
    public static final int PCM_BLOCK_ALIGN = (PCM_BITS_PER_SAMPLE / 8) * PCM_CHANNELS; // 2 bytes

    public static final int MULAW_SAMPLE_RATE = 8_000;

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)
    public static final int WAV_DATA_SIZE_OFFSET = 40;           // 4 bytes (LE)

    private AudioFormat() {}
}
