package com.phillippitts.voicebridge.exception;

/**
 * Thrown when a connection to an external speech service cannot be opened, or when a send or
 * handshake on an open connection fails.
 *
 * <p>Never surfaced to adapter callers: the connection manager and the submission path catch it,
 * log it and rely on the supervisor to reconnect.
 */
public class StreamConnectionException extends VoiceBridgeException {

    private final String providerName;

    public StreamConnectionException(String message) {
        super(message);
        this.providerName = "unknown";
    }

    public StreamConnectionException(String message, String providerName) {
        super(message + " (provider: " + providerName + ")");
        this.providerName = providerName;
    }

    public StreamConnectionException(String message, String providerName, Throwable cause) {
        super(message + " (provider: " + providerName + ")", cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
