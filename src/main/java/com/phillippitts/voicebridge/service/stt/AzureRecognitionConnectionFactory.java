package com.phillippitts.voicebridge.service.stt;

import com.microsoft.cognitiveservices.speech.SpeechConfig;
import com.microsoft.cognitiveservices.speech.SpeechRecognizer;
import com.microsoft.cognitiveservices.speech.audio.AudioConfig;
import com.microsoft.cognitiveservices.speech.audio.AudioStreamFormat;
import com.microsoft.cognitiveservices.speech.audio.AudioStreamWaveFormat;
import com.microsoft.cognitiveservices.speech.audio.PushAudioInputStream;
import com.phillippitts.voicebridge.config.properties.TranscriberProperties;
import com.phillippitts.voicebridge.exception.StreamConnectionExceptionBuilder;
import com.phillippitts.voicebridge.service.audio.AudioEncoding;
import com.phillippitts.voicebridge.service.stream.connection.ConnectionFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Starts Azure continuous recognition sessions over a push audio stream.
 *
 * <p>SDK callbacks run on SDK threads; each one is copied into a {@link RecognitionEvent} and handed to
 * the adapter's inbound consumer, which queues it for the result loop.
 */
public class AzureRecognitionConnectionFactory implements ConnectionFactory<RecognitionConnection, RecognitionEvent> {

    /** Provider name used in logs, metrics and exceptions. */
    public static final String PROVIDER = "azure";

    private static final Logger LOG = LogManager.getLogger(AzureRecognitionConnectionFactory.class);

    private static final long START_TIMEOUT_SECONDS = 15;

    private final TranscriberProperties properties;
    private final TranscriberAudioFormat audioFormat;

    public AzureRecognitionConnectionFactory(TranscriberProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.audioFormat = TranscriberAudioFormat.forProvider(properties.getTelephonyProvider());
    }

    @Override
    public RecognitionConnection open(Consumer<RecognitionEvent> inbound) {
        long start = System.nanoTime();
        SpeechConfig speechConfig = null;
        AudioConfig audioConfig = null;
        SpeechRecognizer recognizer = null;
        try {
            speechConfig = SpeechConfig.fromSubscription(properties.getSubscriptionKey(), properties.getRegion());
            speechConfig.setSpeechRecognitionLanguage(properties.getLanguage());

            PushAudioInputStream pushStream = PushAudioInputStream.create(streamFormat());
            audioConfig = AudioConfig.fromStreamInput(pushStream);
            recognizer = new SpeechRecognizer(speechConfig, audioConfig);

            AzureRecognitionConnection connection =
                    new AzureRecognitionConnection(speechConfig, audioConfig, pushStream, recognizer);
            wire(recognizer, connection, inbound);

            recognizer.startContinuousRecognitionAsync().get(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            LOG.info("Azure recognition started: region={}, language={}, format={}",
                    properties.getRegion(), properties.getLanguage(), audioFormat);
            return connection;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(recognizer, audioConfig, speechConfig);
            throw failure("Interrupted while starting recognition", e, start);
        } catch (ExecutionException e) {
            release(recognizer, audioConfig, speechConfig);
            throw failure("Failed to start recognition", e.getCause(), start);
        } catch (TimeoutException e) {
            release(recognizer, audioConfig, speechConfig);
            throw failure("Timed out starting recognition", e, start);
        } catch (RuntimeException e) {
            release(recognizer, audioConfig, speechConfig);
            throw failure("Failed to configure recognition", e, start);
        }
    }

    public TranscriberAudioFormat getAudioFormat() {
        return audioFormat;
    }

    private AudioStreamFormat streamFormat() {
        long rate = audioFormat.sampleRate();
        short bits = (short) audioFormat.bitsPerSample();
        short channels = (short) audioFormat.channels();
        if (audioFormat.encoding() == AudioEncoding.MULAW) {
            return AudioStreamFormat.getWaveFormat(rate, bits, channels, AudioStreamWaveFormat.MULAW);
        }
        return AudioStreamFormat.getWaveFormatPCM(rate, bits, channels);
    }

    private static void wire(SpeechRecognizer recognizer,
                             AzureRecognitionConnection connection,
                             Consumer<RecognitionEvent> inbound) {
        recognizer.recognizing.addEventListener((source, e) ->
                inbound.accept(RecognitionEvent.recognizing(e.getResult().getText())));
        recognizer.recognized.addEventListener((source, e) ->
                inbound.accept(RecognitionEvent.recognized(e.getResult().getText())));
        recognizer.canceled.addEventListener((source, e) ->
                inbound.accept(RecognitionEvent.canceled(e.getReason() + ": " + e.getErrorDetails())));
        recognizer.sessionStarted.addEventListener((source, e) ->
                inbound.accept(RecognitionEvent.sessionStarted(e.getSessionId())));
        recognizer.sessionStopped.addEventListener((source, e) -> {
            connection.markSessionStopped();
            inbound.accept(RecognitionEvent.sessionStopped(e.getSessionId()));
        });
    }

    private static void release(SpeechRecognizer recognizer, AudioConfig audioConfig, SpeechConfig speechConfig) {
        if (recognizer != null) {
            recognizer.close();
        }
        if (audioConfig != null) {
            audioConfig.close();
        }
        if (speechConfig != null) {
            speechConfig.close();
        }
    }

    private static RuntimeException failure(String message, Throwable cause, long startNanos) {
        return StreamConnectionExceptionBuilder.create(message)
                .provider(PROVIDER)
                .cause(cause)
                .durationMs((System.nanoTime() - startNanos) / 1_000_000)
                .build();
    }
}
