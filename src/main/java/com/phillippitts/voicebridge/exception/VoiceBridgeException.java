package com.phillippitts.voicebridge.exception;

/**
 * Base exception for all voicebridge application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceBridgeException extends RuntimeException {

    public VoiceBridgeException(String message) {
        super(message);
    }

    public VoiceBridgeException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceBridgeException(Throwable cause) {
        super(cause);
    }
}
