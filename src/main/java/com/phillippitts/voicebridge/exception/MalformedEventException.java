package com.phillippitts.voicebridge.exception;

/**
 * Thrown when an inbound frame from a speech service cannot be parsed.
 *
 * <p>The result loop skips the offending event and keeps running.
 */
public class MalformedEventException extends VoiceBridgeException {

    private final String providerName;

    public MalformedEventException(String providerName, String message) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public MalformedEventException(String providerName, String message, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
