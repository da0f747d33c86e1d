package com.phillippitts.voicebridge.service.stream;

import com.phillippitts.voicebridge.config.logging.ThreadContextTaskDecorator;
import com.phillippitts.voicebridge.config.properties.StreamProperties;
import com.phillippitts.voicebridge.domain.StreamMetadata;
import com.phillippitts.voicebridge.domain.StreamResult;
import com.phillippitts.voicebridge.exception.MalformedEventException;
import com.phillippitts.voicebridge.exception.StreamConnectionException;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.stream.connection.ConnectionFactory;
import com.phillippitts.voicebridge.service.stream.connection.ConnectionManager;
import com.phillippitts.voicebridge.service.stream.connection.StreamConnection;
import com.phillippitts.voicebridge.service.stream.correlation.CorrelationQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for streaming adapters providing the submission path, the result path and the lifecycle.
 *
 * <p>This class implements the Template Method pattern. Subclasses decide how input is measured,
 * split into logical units and written to the wire, and how inbound events turn into results; the
 * base class owns everything they share:
 * <ul>
 *   <li><b>Connection:</b> a supervised {@link ConnectionManager}. Inbound events of every connection
 *       are delivered into one adapter-level queue, so a reconnect never loses the consumer side.</li>
 *   <li><b>Correlation:</b> a {@link CorrelationQueue} of {@link PendingUnit}s, appended on submit
 *       and consumed from the head by the result loop.</li>
 *   <li><b>Sending:</b> a single sender thread, so frames go out in submission order. Each send waits
 *       for a live connection.</li>
 *   <li><b>Results:</b> a single result-loop thread that hands inbound events to
 *       {@link #handleEvent(Object)} and publishes into the {@link ResultSequence}.</li>
 * </ul>
 *
 * <p><b>Per-unit state:</b> {@code AWAITING_FIRST_CHUNK -> STREAMING -> COMPLETED}. {@link #activateUnit()}
 * dequeues the next unit when none is active, when the active one has completed, or when the active one
 * is already streaming and a newer sent unit is waiting; in the last case the old unit is completed
 * without a sentinel, because providers do not always send a final marker. The first result of a unit
 * carries {@code firstChunk=true}; {@link #completeUnit(Object, String)} emits the last one with
 * {@code endOfStream=true}. A unit flagged end-of-upstream closes the conversation: once it completes,
 * the adapter forgets it, so the next unit starts fresh and stray events are no longer attributed to
 * it. All result-path state is confined to the result-loop thread.
 *
 * <p><b>Lifecycle:</b> {@link #start()} and {@link #stop()} are idempotent. Submitting before
 * {@code start()} is allowed; the sends wait for the first connection.
 *
 * @param <I> input type
 * @param <E> inbound event type delivered by the connection
 * @param <R> result payload type
 * @param <C> connection type
 */
public abstract class AbstractStreamingAdapter<I, E, R, C extends StreamConnection<?>>
        implements StreamingAdapter<I, R> {

    private static final Logger LOG = LogManager.getLogger(AbstractStreamingAdapter.class);

    private enum State { NEW, RUNNING, STOPPED }

    private final String providerName;
    private final StreamProperties properties;
    private final StreamingMetrics metrics;
    private final ConnectionManager<C> connections;

    private final BlockingQueue<E> inbound = new LinkedBlockingQueue<>();
    private final CorrelationQueue<PendingUnit> correlation = new CorrelationQueue<>();
    private final ResultSequence<R> sequence = new ResultSequence<>();
    private final AtomicLong submittedCount = new AtomicLong();
    private final AtomicBoolean endOfUpstream = new AtomicBoolean(false);
    private final AtomicBoolean resultsClaimed = new AtomicBoolean(false);
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final Object submitLock = new Object();

    private final TaskDecorator taskDecorator = new ThreadContextTaskDecorator();
    private final ExecutorService sender;
    private final ExecutorService receiver;

    // Result-loop confined
    private PendingUnit activeUnit;
    private StreamMetadata activeMetadata;
    private UnitPhase phase = UnitPhase.COMPLETED;
    private boolean reusedUnit;
    private boolean conversationEnded;

    protected AbstractStreamingAdapter(String providerName,
                                       ConnectionFactory<C, E> connectionFactory,
                                       StreamProperties properties,
                                       StreamingMetrics metrics,
                                       ApplicationEventPublisher publisher) {
        this.providerName = Objects.requireNonNull(providerName, "providerName");
        Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.connections = new ConnectionManager<>(providerName,
                () -> connectionFactory.open(inbound::offer), publisher, metrics);
        this.sender = Executors.newSingleThreadExecutor(new CustomizableThreadFactory(providerName + "-sender-"));
        this.receiver = Executors.newSingleThreadExecutor(new CustomizableThreadFactory(providerName + "-results-"));
    }

    @Override
    public final String getProviderName() {
        return providerName;
    }

    @Override
    public final void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            LOG.debug("{} adapter already started or stopped; ignoring start()", providerName);
            return;
        }
        LOG.info("Starting {} adapter", providerName);
        connections.ensureConnected();
        connections.startSupervisor(Duration.ofMillis(properties.getSupervisorIntervalMs()));
        receiver.execute(taskDecorator.decorate(this::resultLoop));
    }

    @Override
    public final void submit(I payload, StreamMetadata metadata) {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        if (state.get() == State.STOPPED) {
            throw new IllegalStateException(providerName + " adapter is stopped");
        }

        // Enqueue and schedule under one lock so correlation order equals send order
        synchronized (submitLock) {
            long amount = measure(payload);
            submittedCount.addAndGet(amount);
            metrics.recordSubmitted(providerName, amount);

            Optional<PendingUnit> unit = openUnit(payload, metadata);
            unit.ifPresent(correlation::enqueue);
            if (metadata.endOfUpstream()) {
                endOfUpstream.set(true);
            }
            if (unit.isPresent() && unit.get().isCached()) {
                LOG.debug("Request {} served from cache; nothing sent", metadata.requestId());
                return;
            }
            try {
                sender.execute(taskDecorator.decorate(() -> sendWhenConnected(payload, metadata)));
            } catch (RejectedExecutionException e) {
                LOG.warn("{} adapter stopped before request {} could be sent", providerName, metadata.requestId());
            }
        }
    }

    @Override
    public final ResultSequence<R> results() {
        if (!resultsClaimed.compareAndSet(false, true)) {
            throw new IllegalStateException("Results of the " + providerName + " adapter were already claimed");
        }
        return sequence;
    }

    @Override
    public final boolean isConnected() {
        return connections.isConnected();
    }

    @Override
    public final boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    @Override
    public final long getSubmittedCount() {
        return submittedCount.get();
    }

    @Override
    public final int getPendingUnits() {
        return correlation.size();
    }

    /**
     * @return true between the submission of a unit flagged end-of-upstream and its first result
     */
    public final boolean isEndOfUpstream() {
        return endOfUpstream.get();
    }

    @Override
    public final void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        Duration timeout = Duration.ofMillis(properties.getShutdownTimeoutMs());

        // In-flight sends first, so nothing writes to a connection that is being closed
        shutdownAndAwait(sender, "sender", timeout);
        connections.stopSupervisor(timeout);
        shutdownAndAwait(receiver, "result loop", timeout);
        connections.shutdown(timeout);
        sequence.terminate();

        int dropped = correlation.clear();
        if (dropped > 0) {
            LOG.info("Dropped {} pending unit(s) of {} on stop", dropped, providerName);
        }
        inbound.clear();
        onStopped();
        if (previous == State.RUNNING) {
            LOG.info("{} adapter stopped", providerName);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Subclass hooks
    // ---------------------------------------------------------------------------------------------

    /**
     * @return amount added to the submitted counter for this input (characters or bytes)
     */
    protected abstract long measure(I payload);

    /**
     * Decides whether this submission starts a new logical unit.
     *
     * <p>Called on the submitting thread, serialized with other submissions.
     *
     * @return the correlation entry to enqueue, or empty if the input continues the current unit
     */
    protected abstract Optional<PendingUnit> openUnit(I payload, StreamMetadata metadata);

    /**
     * Writes one submission to the wire. Called on the sender thread with a live connection.
     *
     * @throws InterruptedException if cancelled while waiting on the transport
     */
    protected abstract void send(C connection, I payload, StreamMetadata metadata) throws InterruptedException;

    /**
     * Turns one inbound event into zero or more results. Called on the result-loop thread.
     *
     * @throws MalformedEventException if the event cannot be parsed; it is skipped
     */
    protected abstract void handleEvent(E event);

    /**
     * Emits the results of a unit served from cache. The unit is already active when this is called.
     * Adapters that never enqueue cached units need not override it.
     */
    protected void replayCached(PendingUnit unit) {
        LOG.warn("{} adapter cannot replay cached request {}", providerName, unit.requestId());
    }

    /**
     * Called on the result-loop thread when a unit that was dequeued for real has completed.
     */
    protected void onUnitCompleted(PendingUnit unit) {
        // no-op by default
    }

    /**
     * Called at the end of {@link #stop()}.
     */
    protected void onStopped() {
        // no-op by default
    }

    // ---------------------------------------------------------------------------------------------
    // Result-path helpers (result-loop thread only)
    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the metadata of the unit the next result belongs to, dequeuing a new unit when none is
     * active. A streaming unit is given up for a newer unit that was sent after it, so a unit that never
     * received a final marker does not swallow the results of the units behind it. Cached units at the
     * head of the queue are replayed first so that FIFO order holds.
     *
     * <p>If nothing is pending the event cannot be correlated: the metadata of the last unit is reused
     * (logged as a desync), or the event is dropped when no unit is left to reuse.
     *
     * @return active metadata, or empty when the event must be dropped
     */
    protected final Optional<StreamMetadata> activateUnit() {
        if (activeUnit != null && phase != UnitPhase.COMPLETED) {
            if (phase == UnitPhase.AWAITING_FIRST_CHUNK || !correlation.anyMatch(unit -> !unit.isCached())) {
                return Optional.of(activeMetadata);
            }
            LOG.debug("Request {} ended without a final marker; advancing to the next request",
                    activeUnit.requestId());
            markUnitCompleted();
        }
        replayCachedHeads();
        Optional<PendingUnit> next = correlation.dequeue();
        if (next.isPresent()) {
            begin(next.get());
            return Optional.of(activeMetadata);
        }

        metrics.incrementDesync(providerName);
        if (activeUnit == null) {
            LOG.warn("Inbound {} event with no pending request and no open conversation; dropping it",
                    providerName);
            return Optional.empty();
        }
        LOG.warn("Inbound {} event with no pending request; reusing metadata of request {}",
                providerName, activeUnit.requestId());
        activeMetadata = activeUnit.metadata();
        phase = UnitPhase.STREAMING;
        reusedUnit = true;
        return Optional.of(activeMetadata);
    }

    /**
     * Publishes a result for the active unit.
     *
     * @param payload result payload
     * @param format format tag to apply, or null to keep the unit's format
     */
    protected final void emit(R payload, String format) {
        publish(payload, format, false);
    }

    /**
     * Publishes the last result of the active unit with {@code endOfStream=true} and completes it.
     */
    protected final void completeUnit(R payload, String format) {
        publish(payload, format, true);
        markUnitCompleted();
    }

    /**
     * Completes the active unit without publishing anything. The next event dequeues a new unit.
     */
    protected final void markUnitCompleted() {
        if (activeUnit == null || phase == UnitPhase.COMPLETED) {
            return;
        }
        phase = UnitPhase.COMPLETED;
        if (!reusedUnit) {
            onUnitCompleted(activeUnit);
        }
        if (conversationEnded) {
            LOG.debug("Conversation ended with request {}", activeUnit.requestId());
            activeUnit = null;
            activeMetadata = null;
            conversationEnded = false;
            ThreadContext.remove("requestId");
        }
    }

    protected final Optional<PendingUnit> activeUnit() {
        return Optional.ofNullable(activeUnit);
    }

    protected final UnitPhase currentPhase() {
        return phase;
    }

    protected final boolean hasPendingUnits() {
        return !correlation.isEmpty();
    }

    // ---------------------------------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------------------------------

    private void sendWhenConnected(I payload, StreamMetadata metadata) {
        ThreadContext.put("provider", providerName);
        ThreadContext.put("requestId", metadata.requestId());
        try {
            C connection = connections.awaitLive(Duration.ofMillis(properties.getConnectionPollMs()));
            send(connection, payload, metadata);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Send of request {} cancelled", metadata.requestId());
        } catch (CancellationException e) {
            LOG.debug("Send of request {} cancelled: {}", metadata.requestId(), e.getMessage());
        } catch (StreamConnectionException e) {
            LOG.warn("Send of request {} failed: {}", metadata.requestId(), e.getMessage());
        }
    }

    private void resultLoop() {
        ThreadContext.put("provider", providerName);
        LOG.info("{} result loop started", providerName);
        long pollMs = properties.getReceivePollMs();
        while (state.get() == State.RUNNING && !Thread.currentThread().isInterrupted()) {
            try {
                replayCachedHeads();
                E event = inbound.poll(pollMs, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                handleEvent(event);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (MalformedEventException e) {
                metrics.incrementMalformed(providerName);
                LOG.warn("Skipping malformed {} event: {}", providerName, e.getMessage());
                pause();
            } catch (RuntimeException e) {
                LOG.error("Error while handling {} event", providerName, e);
                pause();
            }
        }
        LOG.info("{} result loop stopped", providerName);
    }

    private void replayCachedHeads() {
        while (activeUnit == null || phase == UnitPhase.COMPLETED) {
            Optional<PendingUnit> head = correlation.peek();
            if (head.isEmpty() || !head.get().isCached()) {
                return;
            }
            // Only this thread dequeues, so the head is still the peeked unit
            correlation.dequeue();
            begin(head.get());
            replayCached(head.get());
            markUnitCompleted();
        }
    }

    private void begin(PendingUnit unit) {
        activeUnit = unit;
        activeMetadata = unit.metadata();
        phase = UnitPhase.AWAITING_FIRST_CHUNK;
        reusedUnit = false;
        conversationEnded = false;
        ThreadContext.put("requestId", unit.requestId());
    }

    private void publish(R payload, String format, boolean endOfStream) {
        if (activeMetadata == null) {
            throw new IllegalStateException("No active unit; activateUnit() must be called first");
        }
        StreamMetadata snapshot = activeMetadata;
        if (format != null) {
            snapshot = snapshot.withFormat(format);
        }
        boolean first = phase == UnitPhase.AWAITING_FIRST_CHUNK;
        if (first) {
            phase = UnitPhase.STREAMING;
            metrics.recordFirstChunkLatency(providerName, System.nanoTime() - activeUnit.submittedAtNanos());
        }
        if (snapshot.firstChunk() != first) {
            snapshot = snapshot.withFirstChunk(first);
        }
        if (snapshot.endOfStream() != endOfStream) {
            snapshot = snapshot.withEndOfStream(endOfStream);
        }
        if (snapshot.endOfUpstream() && !reusedUnit) {
            // No unit follows this one in the conversation; completing it resets the unit bookkeeping
            conversationEnded = true;
            if (endOfUpstream.compareAndSet(true, false)) {
                LOG.debug("End of upstream reached with request {}", snapshot.requestId());
            }
        }
        if (sequence.offer(new StreamResult<>(payload, snapshot))) {
            metrics.incrementResults(providerName);
        }
    }

    private void pause() {
        try {
            Thread.sleep(properties.getReceiveRetryDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void shutdownAndAwait(ExecutorService executor, String name, Duration timeout) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("{} {} did not terminate within {}ms", providerName, name, timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while stopping {} {}", providerName, name);
        }
    }
}
