package com.phillippitts.voicebridge.domain;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, versioned metadata attached to every unit entering or leaving a streaming adapter.
 *
 * <p>Fields mirror what callers hand in with a submission: correlation id, target format and the
 * upstream/downstream boundary flags. Flags discovered while results are produced (first chunk,
 * end of stream) are applied with the {@code with*} methods, which return a new instance with
 * {@link #version()} incremented. Each emitted {@link StreamResult} therefore holds a stable snapshot
 * that later updates cannot touch.
 *
 * <p>Attribute values must be non-null; use {@link #withAttribute(String, Object)} to add them.
 *
 * @param requestId     caller-supplied correlation id (must not be null)
 * @param format        target payload format, e.g. {@code "wav"} or {@code "mulaw"} (may be null until normalized)
 * @param firstChunk    true on the first result emitted for a logical unit
 * @param endOfUpstream true when the caller will submit no further units for this conversation
 * @param endOfStream   true on the final result the adapter emits for a logical unit
 * @param version       replace-on-write counter, starting at 0
 * @param attributes    additional caller-owned fields
 */
public record StreamMetadata(
        String requestId,
        String format,
        boolean firstChunk,
        boolean endOfUpstream,
        boolean endOfStream,
        long version,
        Map<String, Object> attributes
) {

    /** Attribute holding the text of a synthesis unit. */
    public static final String ATTR_TEXT = "text";

    /** Attribute overriding the adapter's target sample rate for one unit. */
    public static final String ATTR_SAMPLING_RATE = "sampling_rate";

    public StreamMetadata {
        Objects.requireNonNull(requestId, "requestId must not be null");
        if (version < 0) {
            throw new IllegalArgumentException("version must not be negative, got: " + version);
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Creates metadata for a new logical unit with no flags set.
     *
     * @param requestId correlation id
     * @return fresh metadata at version 0
     */
    public static StreamMetadata of(String requestId) {
        return new StreamMetadata(requestId, null, false, false, false, 0L, Map.of());
    }

    /**
     * Creates metadata for a logical unit that closes the caller's upstream input.
     *
     * @param requestId correlation id
     * @return fresh metadata at version 0 with {@code endOfUpstream} set
     */
    public static StreamMetadata endOfUpstream(String requestId) {
        return new StreamMetadata(requestId, null, false, true, false, 0L, Map.of());
    }

    public StreamMetadata withFormat(String newFormat) {
        return new StreamMetadata(requestId, newFormat, firstChunk, endOfUpstream, endOfStream, version + 1, attributes);
    }

    public StreamMetadata withFirstChunk(boolean value) {
        return new StreamMetadata(requestId, format, value, endOfUpstream, endOfStream, version + 1, attributes);
    }

    public StreamMetadata withEndOfUpstream(boolean value) {
        return new StreamMetadata(requestId, format, firstChunk, value, endOfStream, version + 1, attributes);
    }

    public StreamMetadata withEndOfStream(boolean value) {
        return new StreamMetadata(requestId, format, firstChunk, endOfUpstream, value, version + 1, attributes);
    }

    public StreamMetadata withAttribute(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, Object> copy = new HashMap<>(attributes);
        copy.put(key, value);
        return new StreamMetadata(requestId, format, firstChunk, endOfUpstream, endOfStream, version + 1, copy);
    }

    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }
}
