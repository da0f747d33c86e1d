package com.phillippitts.voicebridge.service.synth;

import com.phillippitts.voicebridge.config.properties.SynthesizerProperties;
import com.phillippitts.voicebridge.exception.StreamConnectionExceptionBuilder;
import com.phillippitts.voicebridge.service.stream.connection.ConnectionFactory;
import com.phillippitts.voicebridge.service.stream.connection.StreamConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Opens WebSockets to the ElevenLabs {@code stream-input} endpoint and sends the handshake frame
 * (voice settings and API key) on each of them.
 */
public class ElevenLabsConnectionFactory implements ConnectionFactory<StreamConnection<String>, String> {

    private static final Logger LOG = LogManager.getLogger(ElevenLabsConnectionFactory.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

    private final SynthesizerProperties properties;
    private final HttpClient httpClient;

    public ElevenLabsConnectionFactory(SynthesizerProperties properties) {
        this(properties, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    public ElevenLabsConnectionFactory(SynthesizerProperties properties, HttpClient httpClient) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public StreamConnection<String> open(Consumer<String> inbound) {
        URI uri = streamInputUri();
        long start = System.nanoTime();
        ElevenLabsConnection.InboundListener listener = new ElevenLabsConnection.InboundListener(inbound);
        WebSocket webSocket;
        try {
            webSocket = httpClient.newWebSocketBuilder()
                    .connectTimeout(CONNECT_TIMEOUT)
                    .buildAsync(uri, listener)
                    .get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("Interrupted while connecting", e, start);
        } catch (ExecutionException e) {
            throw failure("Failed to connect", e.getCause(), start);
        } catch (TimeoutException e) {
            throw failure("Timed out connecting", e, start);
        }

        ElevenLabsConnection connection = new ElevenLabsConnection(webSocket, listener, SEND_TIMEOUT);
        try {
            connection.send(ElevenLabsFrames.handshake(
                    properties.getStability(), properties.getSimilarityBoost(), properties.getApiKey()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.close();
            throw failure("Interrupted while sending handshake", e, start);
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
        LOG.info("Connected to ElevenLabs voice={} model={} format={}",
                properties.getVoiceId(), properties.getModel(), properties.providerOutputFormat());
        return connection;
    }

    /**
     * Builds {@code <base>/v1/text-to-speech/<voice>/stream-input?model_id=...&output_format=...&inactivity_timeout=...}.
     */
    URI streamInputUri() {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String url = base + "/v1/text-to-speech/" + encode(properties.getVoiceId()) + "/stream-input"
                + "?model_id=" + encode(properties.getModel())
                + "&output_format=" + encode(properties.providerOutputFormat())
                + "&inactivity_timeout=" + properties.getInactivityTimeoutSeconds();
        return URI.create(url);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static RuntimeException failure(String message, Throwable cause, long startNanos) {
        return StreamConnectionExceptionBuilder.create(message)
                .provider(ElevenLabsFrames.PROVIDER)
                .cause(cause)
                .durationMs((System.nanoTime() - startNanos) / 1_000_000)
                .build();
    }
}
