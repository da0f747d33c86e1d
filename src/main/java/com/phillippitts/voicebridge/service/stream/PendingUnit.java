package com.phillippitts.voicebridge.service.stream;

import com.phillippitts.voicebridge.domain.StreamMetadata;

import java.util.Objects;

/**
 * Correlation entry for one submitted logical unit.
 *
 * @param metadata         caller metadata as submitted
 * @param submittedAtNanos {@link System#nanoTime()} at submission, for first-chunk latency
 * @param cacheKey         synthesis cache key, or null when caching does not apply
 * @param cachedAudio      raw audio found in the cache at submission time, or null
 */
public record PendingUnit(StreamMetadata metadata, long submittedAtNanos, String cacheKey, byte[] cachedAudio) {

    public PendingUnit {
        Objects.requireNonNull(metadata, "metadata must not be null");
    }

    public static PendingUnit of(StreamMetadata metadata) {
        return new PendingUnit(metadata, System.nanoTime(), null, null);
    }

    /**
     * @return true when the unit is served from cache and nothing was sent for it
     */
    public boolean isCached() {
        return cachedAudio != null;
    }

    public String requestId() {
        return metadata.requestId();
    }
}
