package com.phillippitts.voicebridge.service.synth;

import com.phillippitts.voicebridge.exception.MalformedEventException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;

/**
 * Encodes outbound and decodes inbound frames of the ElevenLabs {@code stream-input} protocol.
 *
 * <p>Outbound:
 * <ul>
 *   <li>handshake: {@code {"text":" ","voice_settings":{...},"xi_api_key":"..."}}</li>
 *   <li>text: {@code {"text":"chunk "}}</li>
 *   <li>flush: {@code {"text":"","flush":true}}</li>
 * </ul>
 * Inbound: {@code {"audio":"<base64>","isFinal":false}}; {@code audio} may be null.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class ElevenLabsFrames {

    /** Provider name used in logs, metrics and exceptions. */
    public static final String PROVIDER = "elevenlabs";

    /** Payload emitted for the end of a unit. */
    static final byte[] END_OF_UNIT = new byte[] { 0x00 };

    private static final int MAX_FRAME_SIZE = 8 * 1_048_576; // 8MB

    private ElevenLabsFrames() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the beginning-of-stream frame sent on every connect.
     */
    public static String handshake(double stability, double similarityBoost, String apiKey) {
        JSONObject voiceSettings = new JSONObject()
                .put("stability", stability)
                .put("similarity_boost", similarityBoost);
        return new JSONObject()
                .put("text", " ")
                .put("voice_settings", voiceSettings)
                .put("xi_api_key", apiKey == null ? "" : apiKey)
                .toString();
    }

    public static String textFrame(String chunk) {
        return new JSONObject().put("text", chunk).toString();
    }

    /**
     * Builds the frame that asks the provider to synthesize everything buffered so far.
     */
    public static String flushFrame() {
        return new JSONObject().put("text", "").put("flush", true).toString();
    }

    /**
     * Decodes one inbound frame.
     *
     * @param json raw frame text
     * @return decoded frame
     * @throws MalformedEventException if the frame is not valid JSON, is oversized, carries invalid
     *         base64 audio, or is a provider error message
     */
    public static SynthesisFrame parse(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedEventException(PROVIDER, "Empty inbound frame");
        }
        if (json.length() > MAX_FRAME_SIZE) {
            throw new MalformedEventException(PROVIDER, "Inbound frame too large: " + json.length() + " chars");
        }
        try {
            JSONObject obj = new JSONObject(json);
            if (obj.has("error") && !obj.has("audio")) {
                throw new MalformedEventException(PROVIDER,
                        "Provider error: " + obj.optString("message", obj.optString("error")));
            }
            String audio = obj.isNull("audio") ? "" : obj.getString("audio");
            byte[] bytes = audio.isEmpty() ? new byte[0] : Base64.getDecoder().decode(audio);
            return new SynthesisFrame(bytes, obj.optBoolean("isFinal", false));
        } catch (JSONException | IllegalArgumentException e) {
            throw new MalformedEventException(PROVIDER, "Cannot decode inbound frame: " + e.getMessage(), e);
        }
    }
}
