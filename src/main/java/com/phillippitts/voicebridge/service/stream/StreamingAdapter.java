package com.phillippitts.voicebridge.service.stream;

import com.phillippitts.voicebridge.domain.StreamMetadata;

/**
 * A duplex streaming adapter in front of an external speech service.
 *
 * <p>Callers push input with {@link #submit(Object, StreamMetadata)} and read results from the single
 * {@link ResultSequence} returned by {@link #results()}. Results appear in submission order and carry
 * the metadata of the unit they belong to, even though the service itself never echoes request ids.
 *
 * @param <I> input type (text for synthesis, audio bytes for transcription)
 * @param <R> result payload type
 */
public interface StreamingAdapter<I, R> {

    /**
     * @return provider identifier, e.g. "elevenlabs" or "azure"
     */
    String getProviderName();

    /**
     * Connects, starts the connection supervisor and the result loop. Idempotent.
     */
    void start();

    /**
     * Queues input for sending and returns immediately.
     *
     * <p>The correlation entry for a new logical unit is recorded before this method returns, and
     * before any byte of the unit is sent. If no connection is live the send waits for one.
     *
     * @param payload input to send
     * @param metadata caller metadata for the unit
     * @throws IllegalStateException if the adapter has been stopped
     */
    void submit(I payload, StreamMetadata metadata);

    /**
     * Returns the result sequence. It can be claimed once.
     *
     * @throws IllegalStateException on a second call
     */
    ResultSequence<R> results();

    boolean isConnected();

    boolean isRunning();

    /**
     * @return characters (synthesis) or bytes (transcription) submitted so far
     */
    long getSubmittedCount();

    /**
     * @return correlation entries still awaiting results
     */
    int getPendingUnits();

    /**
     * Cancels in-flight sends, stops background work, closes the connection and ends the result
     * sequence. Idempotent.
     */
    void stop();
}
