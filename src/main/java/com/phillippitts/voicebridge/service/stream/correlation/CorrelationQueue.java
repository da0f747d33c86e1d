package com.phillippitts.voicebridge.service.stream.correlation;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * FIFO of submitted units still awaiting results.
 *
 * <p>The remote service never echoes a request id, so results are matched to requests purely by
 * order: the submission path appends one entry per logical unit before sending any byte of it and
 * the result path removes entries from the head. All operations are guarded by the queue's monitor
 * because the two paths run on different threads.
 *
 * @param <T> entry type
 */
public class CorrelationQueue<T> {

    private final Deque<T> pending = new ArrayDeque<>();

    public synchronized void enqueue(T entry) {
        pending.addLast(Objects.requireNonNull(entry, "entry must not be null"));
    }

    /**
     * Removes and returns the oldest entry.
     *
     * @return the head entry, or empty when nothing is pending
     */
    public synchronized Optional<T> dequeue() {
        return Optional.ofNullable(pending.pollFirst());
    }

    public synchronized Optional<T> peek() {
        return Optional.ofNullable(pending.peekFirst());
    }

    /**
     * @return true if any pending entry matches the predicate
     */
    public synchronized boolean anyMatch(Predicate<? super T> predicate) {
        return pending.stream().anyMatch(predicate);
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    /**
     * Drops every pending entry.
     *
     * @return number of entries dropped
     */
    public synchronized int clear() {
        int dropped = pending.size();
        pending.clear();
        return dropped;
    }
}
