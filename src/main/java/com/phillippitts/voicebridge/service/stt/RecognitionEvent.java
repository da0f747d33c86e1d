package com.phillippitts.voicebridge.service.stt;

import java.util.Objects;

/**
 * Recognizer callback, copied off the SDK thread so it can be queued for the result loop.
 *
 * @param type   callback kind
 * @param text   recognized text ({@code RECOGNIZING}, {@code RECOGNIZED}); empty otherwise
 * @param detail session id or cancellation details, for logging
 */
public record RecognitionEvent(Type type, String text, String detail) {

    public enum Type { RECOGNIZING, RECOGNIZED, CANCELED, SESSION_STARTED, SESSION_STOPPED }

    public RecognitionEvent {
        Objects.requireNonNull(type, "type must not be null");
        text = text == null ? "" : text;
        detail = detail == null ? "" : detail;
    }

    public static RecognitionEvent recognizing(String text) {
        return new RecognitionEvent(Type.RECOGNIZING, text, null);
    }

    public static RecognitionEvent recognized(String text) {
        return new RecognitionEvent(Type.RECOGNIZED, text, null);
    }

    public static RecognitionEvent canceled(String detail) {
        return new RecognitionEvent(Type.CANCELED, null, detail);
    }

    public static RecognitionEvent sessionStarted(String sessionId) {
        return new RecognitionEvent(Type.SESSION_STARTED, null, sessionId);
    }

    public static RecognitionEvent sessionStopped(String sessionId) {
        return new RecognitionEvent(Type.SESSION_STOPPED, null, sessionId);
    }
}
