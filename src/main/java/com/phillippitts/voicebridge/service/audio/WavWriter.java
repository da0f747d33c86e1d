package com.phillippitts.voicebridge.service.audio;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

import static com.phillippitts.voicebridge.service.audio.AudioFormat.PCM_BITS_PER_SAMPLE;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.PCM_BLOCK_ALIGN;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.PCM_CHANNELS;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Wraps raw PCM16LE mono audio in a minimal in-memory WAV container.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * @param pcm        raw PCM16LE mono audio
     * @param sampleRate sample rate of {@code pcm} in Hz
     * @return a 44-byte RIFF header followed by {@code pcm}
     */
    public static byte[] toWav(byte[] pcm, int sampleRate) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        ByteArrayOutputStream os = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        int dataSize = pcm.length;

        os.writeBytes(new byte[] { 'R', 'I', 'F', 'F' });
        // ChunkSize: 36 + data size
        writeLEInt(os, 36 + dataSize);
        os.writeBytes(new byte[] { 'W', 'A', 'V', 'E' });

        os.writeBytes(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);
        // AudioFormat: 1 for PCM
        writeLEShort(os, (short) 1);
        writeLEShort(os, (short) PCM_CHANNELS);
        writeLEInt(os, sampleRate);
        // ByteRate
        writeLEInt(os, sampleRate * PCM_BLOCK_ALIGN);
        writeLEShort(os, (short) PCM_BLOCK_ALIGN);
        writeLEShort(os, (short) PCM_BITS_PER_SAMPLE);

        os.writeBytes(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);
        os.writeBytes(pcm);
        return os.toByteArray();
    }

    private static void writeLEShort(ByteArrayOutputStream os, short v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(ByteArrayOutputStream os, int v) {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
