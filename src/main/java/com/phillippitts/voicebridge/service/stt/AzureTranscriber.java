package com.phillippitts.voicebridge.service.stt;

import com.phillippitts.voicebridge.config.properties.StreamProperties;
import com.phillippitts.voicebridge.domain.StreamMetadata;
import com.phillippitts.voicebridge.domain.TranscriptEvent;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.stream.AbstractStreamingAdapter;
import com.phillippitts.voicebridge.service.stream.PendingUnit;
import com.phillippitts.voicebridge.service.stream.connection.ConnectionFactory;
import com.phillippitts.voicebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.Optional;

/**
 * Streaming speech-to-text adapter for Azure continuous recognition.
 *
 * <p>Audio submitted under one request id forms one logical unit; a different request id opens the
 * next one. A submission flagged end-of-upstream is a unit of its own: any audio it carries is pushed,
 * then the input is closed and the recognizer winds the session down.
 *
 * <p>Recognizer callbacks map to {@link TranscriptEvent} results:
 * <ul>
 *   <li>{@code RECOGNIZING}: {@code interim_transcript_received}</li>
 *   <li>{@code RECOGNIZED}: {@code transcript}; completes the unit when a later unit is pending</li>
 *   <li>{@code SESSION_STOPPED}: {@code transcriber_connection_closed} with {@code endOfStream=true}</li>
 *   <li>{@code CANCELED}, {@code SESSION_STARTED}: logged only</li>
 * </ul>
 */
public class AzureTranscriber
        extends AbstractStreamingAdapter<byte[], RecognitionEvent, TranscriptEvent, RecognitionConnection> {

    private static final Logger LOG = LogManager.getLogger(AzureTranscriber.class);

    // Guarded by the submission lock of the base class (openUnit is serialized)
    private String currentRequestId;

    public AzureTranscriber(ConnectionFactory<RecognitionConnection, RecognitionEvent> connectionFactory,
                            StreamProperties streamProperties,
                            StreamingMetrics metrics,
                            ApplicationEventPublisher publisher) {
        super(AzureRecognitionConnectionFactory.PROVIDER, connectionFactory, streamProperties, metrics, publisher);
    }

    @Override
    protected long measure(byte[] audio) {
        return audio.length;
    }

    @Override
    protected Optional<PendingUnit> openUnit(byte[] audio, StreamMetadata metadata) {
        if (metadata.endOfUpstream()) {
            currentRequestId = null;
            return Optional.of(PendingUnit.of(metadata));
        }
        if (Objects.equals(currentRequestId, metadata.requestId())) {
            return Optional.empty();
        }
        currentRequestId = metadata.requestId();
        return Optional.of(PendingUnit.of(metadata));
    }

    @Override
    protected void send(RecognitionConnection connection, byte[] audio, StreamMetadata metadata) {
        if (audio.length > 0) {
            connection.send(audio);
        }
        if (metadata.endOfUpstream()) {
            LOG.info("End of upstream for request {}; closing audio input", metadata.requestId());
            connection.endInput();
        }
    }

    @Override
    protected void handleEvent(RecognitionEvent event) {
        switch (event.type()) {
            case RECOGNIZING -> {
                LOG.debug("Interim: \"{}\"", LogSanitizer.preview(event.text()));
                activateUnit().ifPresent(m -> emit(TranscriptEvent.interim(event.text()), null));
            }
            case RECOGNIZED -> {
                LOG.info("Final transcript: \"{}\"", LogSanitizer.preview(event.text()));
                if (activateUnit().isEmpty()) {
                    return;
                }
                emit(TranscriptEvent.transcript(event.text()), null);
                if (hasPendingUnits()) {
                    markUnitCompleted();
                }
            }
            case SESSION_STOPPED -> {
                LOG.info("Azure session stopped: {}", event.detail());
                if (activateUnit().isPresent()) {
                    completeUnit(TranscriptEvent.connectionClosed(), null);
                }
            }
            case CANCELED -> LOG.warn("Azure recognition canceled: {}", event.detail());
            case SESSION_STARTED -> LOG.info("Azure session started: {}", event.detail());
            default -> LOG.debug("Ignoring recognition event {}", event.type());
        }
    }
}
