package com.phillippitts.voicebridge.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link StreamConnectionException} with contextual details.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw StreamConnectionExceptionBuilder.create("Handshake failed")
 *         .provider("elevenlabs")
 *         .cause(exception)
 *         .metadata("uri", uri)
 *         .build();
 * </pre>
 */
public final class StreamConnectionExceptionBuilder {

    private final String message;
    private String providerName;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private StreamConnectionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static StreamConnectionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new StreamConnectionExceptionBuilder(message);
    }

    public StreamConnectionExceptionBuilder provider(String providerName) {
        this.providerName = providerName;
        return this;
    }

    public StreamConnectionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public StreamConnectionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * <p>Never pass credentials here; the message ends up in logs.
     */
    public StreamConnectionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (provider: {provider})
     * </pre>
     */
    public StreamConnectionException build() {
        String detailedMessage = buildDetailedMessage();
        String provider = providerName != null ? providerName : "unknown";
        if (cause != null) {
            return new StreamConnectionException(detailedMessage, provider, cause);
        }
        return new StreamConnectionException(detailedMessage, provider);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
