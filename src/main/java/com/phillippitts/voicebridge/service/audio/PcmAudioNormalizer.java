package com.phillippitts.voicebridge.service.audio;

import java.util.Arrays;
import java.util.Objects;

/**
 * Default {@link AudioNormalizer}.
 *
 * <ul>
 *   <li>{@link AudioEncoding#MULAW}: passed through unchanged, tagged {@code mulaw}</li>
 *   <li>{@link AudioEncoding#PCM16}: resampled from the provider rate to the target rate and wrapped
 *       in WAV, tagged {@code wav}</li>
 * </ul>
 */
public class PcmAudioNormalizer implements AudioNormalizer {

    private final AudioEncoding encoding;
    private final int providerSampleRate;

    public PcmAudioNormalizer(AudioEncoding encoding, int providerSampleRate) {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
        if (providerSampleRate <= 0) {
            throw new IllegalArgumentException("providerSampleRate must be positive, got: " + providerSampleRate);
        }
        this.providerSampleRate = providerSampleRate;
    }

    @Override
    public NormalizedAudio normalize(byte[] raw, int targetSampleRate) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (encoding == AudioEncoding.MULAW) {
            return new NormalizedAudio(Arrays.copyOf(raw, raw.length), AudioFormat.FORMAT_MULAW);
        }
        byte[] pcm = PcmResampler.resample(raw, providerSampleRate, targetSampleRate);
        return new NormalizedAudio(WavWriter.toWav(pcm, targetSampleRate), AudioFormat.FORMAT_WAV);
    }

    @Override
    public NormalizedAudio normalizeSentinel(byte[] sentinel, int targetSampleRate) {
        Objects.requireNonNull(sentinel, "sentinel must not be null");
        if (encoding == AudioEncoding.MULAW) {
            return new NormalizedAudio(Arrays.copyOf(sentinel, sentinel.length), AudioFormat.FORMAT_MULAW);
        }
        return new NormalizedAudio(PcmResampler.resample(sentinel, providerSampleRate, targetSampleRate),
                AudioFormat.FORMAT_WAV);
    }

    public AudioEncoding getEncoding() {
        return encoding;
    }
}
