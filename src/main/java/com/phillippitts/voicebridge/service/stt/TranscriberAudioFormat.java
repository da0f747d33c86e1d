package com.phillippitts.voicebridge.service.stt;

import com.phillippitts.voicebridge.service.audio.AudioEncoding;

import java.util.Locale;

/**
 * Input audio format the recognizer is configured with.
 */
public record TranscriberAudioFormat(AudioEncoding encoding, int sampleRate, int bitsPerSample, int channels) {

    /**
     * Derives the input format from the telephony provider that produces the audio.
     *
     * <ul>
     *   <li>{@code twilio}: mu-law, 8 kHz, 8-bit</li>
     *   <li>{@code exotel}, {@code plivo}: linear16, 8 kHz</li>
     *   <li>{@code web_based_call}: linear16, 16 kHz</li>
     *   <li>anything else: linear16, 8 kHz</li>
     * </ul>
     */
    public static TranscriberAudioFormat forProvider(String telephonyProvider) {
        String provider = telephonyProvider == null ? "" : telephonyProvider.trim().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "twilio" -> new TranscriberAudioFormat(AudioEncoding.MULAW, 8_000, 8, 1);
            case "web_based_call" -> new TranscriberAudioFormat(AudioEncoding.PCM16, 16_000, 16, 1);
            default -> new TranscriberAudioFormat(AudioEncoding.PCM16, 8_000, 16, 1);
        };
    }
}
