package com.phillippitts.voicebridge.service.synth;

import com.phillippitts.voicebridge.exception.StreamConnectionExceptionBuilder;
import com.phillippitts.voicebridge.service.stream.connection.StreamConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A {@code java.net.http} WebSocket to the ElevenLabs stream-input endpoint.
 *
 * <p>Sends are not concurrent: the owning adapter writes from a single sender thread.
 */
final class ElevenLabsConnection implements StreamConnection<String> {

    private static final Logger LOG = LogManager.getLogger(ElevenLabsConnection.class);

    private final WebSocket webSocket;
    private final InboundListener listener;
    private final Duration sendTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ElevenLabsConnection(WebSocket webSocket, InboundListener listener, Duration sendTimeout) {
        this.webSocket = Objects.requireNonNull(webSocket, "webSocket");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
    }

    @Override
    public boolean isOpen() {
        return !closed.get()
                && !listener.isClosed()
                && !webSocket.isOutputClosed()
                && !webSocket.isInputClosed();
    }

    @Override
    public void send(String frame) throws InterruptedException {
        long start = System.nanoTime();
        try {
            webSocket.sendText(frame, true).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw StreamConnectionExceptionBuilder.create("Failed to send frame")
                    .provider(ElevenLabsFrames.PROVIDER)
                    .cause(e.getCause())
                    .durationMs((System.nanoTime() - start) / 1_000_000)
                    .build();
        } catch (TimeoutException e) {
            throw StreamConnectionExceptionBuilder.create("Timed out sending frame")
                    .provider(ElevenLabsFrames.PROVIDER)
                    .cause(e)
                    .durationMs(sendTimeout.toMillis())
                    .build();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (webSocket.isOutputClosed()) {
            webSocket.abort();
            return;
        }
        try {
            webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "closing")
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            webSocket.abort();
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Graceful close failed, aborting: {}", e.toString());
            webSocket.abort();
        }
    }

    /**
     * Reassembles text messages and hands each complete one to the adapter's inbound consumer.
     */
    static final class InboundListener implements WebSocket.Listener {

        private final Consumer<String> inbound;
        private final StringBuilder textBuffer = new StringBuilder();
        private final AtomicBoolean closed = new AtomicBoolean(false);

        InboundListener(Consumer<String> inbound) {
            this.inbound = Objects.requireNonNull(inbound, "inbound");
        }

        boolean isClosed() {
            return closed.get();
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String payload = textBuffer.toString();
                textBuffer.setLength(0);
                inbound.accept(payload);
            }
            webSocket.request(1);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closed.set(true);
            LOG.info("ElevenLabs socket closed by server: status={}, reason={}", statusCode, reason);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            closed.set(true);
            LOG.warn("ElevenLabs socket error: {}", error == null ? "unknown" : error.toString());
        }
    }
}
