package com.phillippitts.voicebridge.service.stream;

import com.phillippitts.voicebridge.domain.StreamResult;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily consumed, single-pass sequence of results produced by an adapter's result loop.
 *
 * <p>The sequence has no natural end: {@link #hasNext()} blocks until the next result arrives, and
 * returns false only after {@link #terminate()} once every buffered result has been handed out, or when
 * the consuming thread is interrupted (the interrupt flag is kept). Intended for a single consumer thread.
 *
 * @param <T> payload type
 */
public final class ResultSequence<T> implements Iterator<StreamResult<T>>, AutoCloseable {

    // Empty marks the end of the sequence
    private final BlockingQueue<Optional<StreamResult<T>>> buffer = new LinkedBlockingQueue<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    // Consumer-thread confined lookahead
    private Optional<StreamResult<T>> next;

    /**
     * Appends a result. Ignored once the sequence is terminated.
     *
     * @return true if the result was appended
     */
    boolean offer(StreamResult<T> result) {
        if (terminated.get()) {
            return false;
        }
        return buffer.offer(Optional.of(result));
    }

    /**
     * Ends the sequence after the results already buffered. Idempotent.
     */
    public void terminate() {
        if (terminated.compareAndSet(false, true)) {
            buffer.offer(Optional.empty());
        }
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            try {
                next = buffer.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return next.isPresent();
    }

    @Override
    public StreamResult<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Result sequence has ended");
        }
        StreamResult<T> result = next.get();
        next = null;
        return result;
    }

    /**
     * Waits up to {@code timeout} for the next result.
     *
     * @return the next result, or empty on timeout or after the end of the sequence
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<StreamResult<T>> poll(Duration timeout) throws InterruptedException {
        if (next == null) {
            next = buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }
        if (next == null || next.isEmpty()) {
            return Optional.empty();
        }
        Optional<StreamResult<T>> result = next;
        next = null;
        return result;
    }

    /**
     * @return an ordered, sequential stream view; it shares this sequence's position
     */
    public Stream<StreamResult<T>> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    @Override
    public void close() {
        terminate();
    }
}
