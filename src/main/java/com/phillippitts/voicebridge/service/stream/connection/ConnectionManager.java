package com.phillippitts.voicebridge.service.stream.connection;

import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Owns the single live connection of an adapter and keeps it alive.
 *
 * <p>The current handle lives in an {@link AtomicReference} and is only ever replaced as a whole:
 * senders read it, the supervisor swaps it. A supervisor task runs {@link #ensureConnected()} at a
 * fixed interval; when the handle is alive that call does nothing, otherwise it closes the dead handle
 * and installs a fresh one. The opener is expected to perform the handshake, so a reconnect re-sends
 * it.
 *
 * <p>Connect failures never propagate to callers. The first failure of a streak is logged at WARN and
 * later ones at DEBUG, and the supervisor simply tries again on its next tick.
 *
 * @param <C> connection type
 */
public class ConnectionManager<C extends StreamConnection<?>> {

    private static final Logger LOG = LogManager.getLogger(ConnectionManager.class);

    private final String providerName;
    private final Supplier<C> opener;
    private final ApplicationEventPublisher publisher;
    private final StreamingMetrics metrics;

    private final AtomicReference<C> current = new AtomicReference<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final Object reconnectLock = new Object();

    // Guarded by reconnectLock
    private boolean lostSinceLastConnect = false;
    private int failureStreak = 0;

    private volatile ScheduledExecutorService supervisor;

    /**
     * @param providerName provider name used in logs, events and metrics
     * @param opener opens and handshakes a new connection; may throw
     * @param publisher event publisher (may be null)
     * @param metrics metrics sink (may be null)
     */
    public ConnectionManager(String providerName,
                             Supplier<C> opener,
                             ApplicationEventPublisher publisher,
                             StreamingMetrics metrics) {
        this.providerName = Objects.requireNonNull(providerName, "providerName");
        this.opener = Objects.requireNonNull(opener, "opener");
        this.publisher = publisher;
        this.metrics = metrics;
    }

    /**
     * Opens a new connection without installing it.
     *
     * @return the new connection, or empty if opening failed
     */
    public Optional<C> connect() {
        synchronized (reconnectLock) {
            return open(failureStreak);
        }
    }

    private Optional<C> open(int streak) {
        try {
            return Optional.ofNullable(opener.get());
        } catch (RuntimeException e) {
            if (streak == 0) {
                LOG.warn("Connect to {} failed: {}", providerName, e.getMessage());
            } else {
                LOG.debug("Connect to {} failed again (streak={}): {}", providerName, streak, e.getMessage());
            }
            return Optional.empty();
        }
    }

    public boolean isAlive(C handle) {
        return handle != null && handle.isOpen();
    }

    /**
     * Closes a handle. Absent or already dead handles are ignored.
     */
    public void close(C handle) {
        if (handle == null) {
            return;
        }
        try {
            handle.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing {} connection: {}", providerName, e.toString());
        }
    }

    /**
     * Makes sure a live connection is installed. A no-op while the current handle is alive.
     *
     * @return true if a live connection is installed when the call returns
     */
    public boolean ensureConnected() {
        synchronized (reconnectLock) {
            if (terminated.get()) {
                return false;
            }
            C existing = current.get();
            if (isAlive(existing)) {
                return true;
            }
            if (existing != null && current.compareAndSet(existing, null)) {
                lostSinceLastConnect = true;
                LOG.warn("Connection to {} lost; reconnecting", providerName);
                ConnectionEventPublisher.publishLost(publisher, providerName);
                close(existing);
            }

            Optional<C> fresh = open(failureStreak);
            if (fresh.isEmpty()) {
                failureStreak++;
                return false;
            }
            C handle = fresh.get();
            current.set(handle);
            if (terminated.get()) {
                // shutdown() ran while we were connecting
                close(current.getAndSet(null));
                return false;
            }

            int attempts = failureStreak + 1;
            failureStreak = 0;
            if (lostSinceLastConnect) {
                lostSinceLastConnect = false;
                LOG.info("Connection to {} restored after {} attempt(s)", providerName, attempts);
                ConnectionEventPublisher.publishRestored(publisher, providerName, attempts);
                if (metrics != null) {
                    metrics.incrementReconnects(providerName);
                }
            } else {
                LOG.info("Connected to {}", providerName);
            }
            return true;
        }
    }

    /**
     * Blocks until a live connection is installed.
     *
     * @param pollInterval delay between liveness checks
     * @return the live connection
     * @throws InterruptedException if the waiting thread is interrupted
     * @throws CancellationException if the manager is shut down while waiting
     */
    public C awaitLive(Duration pollInterval) throws InterruptedException {
        long pollMs = Math.max(1L, pollInterval.toMillis());
        while (!terminated.get()) {
            C handle = current.get();
            if (isAlive(handle)) {
                return handle;
            }
            Thread.sleep(pollMs);
        }
        throw new CancellationException("Connection manager for " + providerName + " is shut down");
    }

    /**
     * Starts the supervisor, which calls {@link #ensureConnected()} at a fixed interval.
     * Calling it again while the supervisor runs has no effect.
     */
    public synchronized void startSupervisor(Duration interval) {
        if (supervisor != null || terminated.get()) {
            return;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
                new CustomizableThreadFactory(providerName + "-supervisor-"));
        long periodMs = Math.max(1L, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::supervise, periodMs, periodMs, TimeUnit.MILLISECONDS);
        supervisor = scheduler;
        LOG.debug("Supervisor for {} started (interval={}ms)", providerName, periodMs);
    }

    /**
     * Stops the supervisor and waits for a running tick to finish.
     */
    public synchronized void stopSupervisor(Duration timeout) {
        ScheduledExecutorService scheduler = supervisor;
        if (scheduler == null) {
            return;
        }
        supervisor = null;
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Supervisor for {} did not stop within {}ms", providerName, timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while stopping supervisor for {}", providerName);
        }
    }

    /**
     * Stops supervision for good, then closes the current connection and clears the handle.
     * Idempotent.
     */
    public void shutdown(Duration timeout) {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }
        stopSupervisor(timeout);
        close(current.getAndSet(null));
        LOG.info("Connection manager for {} shut down", providerName);
    }

    public Optional<C> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isConnected() {
        return isAlive(current.get());
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    private void supervise() {
        try {
            ensureConnected();
        } catch (RuntimeException e) {
            LOG.error("Supervisor tick for {} failed", providerName, e);
        }
    }
}
