package com.phillippitts.voicebridge.service.audio;

import java.util.Arrays;

/**
 * Linear-interpolation resampler for 16-bit little-endian mono PCM.
 */
public final class PcmResampler {

    private PcmResampler() {}

    /**
     * Resamples PCM16LE mono audio.
     *
     * <p>Input shorter than one frame is returned unchanged (this covers the one-byte end-of-unit
     * sentinel). A trailing odd byte is dropped.
     *
     * @param pcm      PCM16LE mono samples
     * @param fromRate sample rate of {@code pcm}
     * @param toRate   desired sample rate
     * @return resampled audio, or a copy of the input when no conversion is needed
     */
    public static byte[] resample(byte[] pcm, int fromRate, int toRate) {
        if (fromRate <= 0 || toRate <= 0) {
            throw new IllegalArgumentException("Sample rates must be positive: from=" + fromRate + ", to=" + toRate);
        }
        if (pcm.length < AudioFormat.PCM_BLOCK_ALIGN || fromRate == toRate) {
            return Arrays.copyOf(pcm, pcm.length);
        }
        int inSamples = pcm.length / AudioFormat.PCM_BLOCK_ALIGN;
        int outSamples = (int) Math.max(1L, Math.round((double) inSamples * toRate / fromRate));
        byte[] out = new byte[outSamples * AudioFormat.PCM_BLOCK_ALIGN];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < outSamples; i++) {
            double pos = i * step;
            int idx = (int) pos;
            double frac = pos - idx;
            int s0 = sampleAt(pcm, Math.min(idx, inSamples - 1));
            int s1 = sampleAt(pcm, Math.min(idx + 1, inSamples - 1));
            int value = (int) Math.round(s0 + (s1 - s0) * frac);
            value = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, value));
            out[i * 2] = (byte) (value & 0xFF);
            out[i * 2 + 1] = (byte) ((value >>> 8) & 0xFF);
        }
        return out;
    }

    private static int sampleAt(byte[] pcm, int index) {
        int lo = pcm[index * 2] & 0xFF;
        int hi = pcm[index * 2 + 1];
        return (hi << 8) | lo;
    }
}
