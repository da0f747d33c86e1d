package com.phillippitts.voicebridge.service.synth;

import com.phillippitts.voicebridge.config.properties.StreamProperties;
import com.phillippitts.voicebridge.config.properties.SynthesizerProperties;
import com.phillippitts.voicebridge.domain.StreamMetadata;
import com.phillippitts.voicebridge.service.audio.AudioNormalizer;
import com.phillippitts.voicebridge.service.audio.NormalizedAudio;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.stream.AbstractStreamingAdapter;
import com.phillippitts.voicebridge.service.stream.PendingUnit;
import com.phillippitts.voicebridge.service.stream.connection.ConnectionFactory;
import com.phillippitts.voicebridge.service.stream.connection.StreamConnection;
import com.phillippitts.voicebridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Streaming text-to-speech adapter for ElevenLabs.
 *
 * <p>Each {@link #submit(Object, StreamMetadata) submit} is one logical unit. Its text is sent as a
 * series of {@code {"text": ...}} frames followed by a flush frame; the provider answers with audio
 * frames and finally one with {@code isFinal=true}. Audio is normalized (mu-law pass-through or
 * resampled WAV) and emitted as {@code byte[]} results. The final frame is followed by a one-byte
 * {@code 0x00} result with {@code endOfStream=true}.
 *
 * <p>With caching enabled, text already synthesized with the same voice, model and output format is
 * served from the {@link SynthesisCache} without contacting the provider, in its FIFO position.
 */
public class ElevenLabsSynthesizer extends AbstractStreamingAdapter<String, String, byte[], StreamConnection<String>> {

    private static final Logger LOG = LogManager.getLogger(ElevenLabsSynthesizer.class);

    private final SynthesizerProperties properties;
    private final AudioNormalizer normalizer;
    private final SynthesisCache cache;
    private final TextChunker chunker;

    // Result-loop confined: raw audio of the active unit, for the cache
    private final ByteArrayOutputStream unitAudio = new ByteArrayOutputStream();
    private PendingUnit accumulating;

    /**
     * @param cache synthesis cache, or null to disable caching regardless of properties
     */
    public ElevenLabsSynthesizer(ConnectionFactory<StreamConnection<String>, String> connectionFactory,
                                 SynthesizerProperties properties,
                                 StreamProperties streamProperties,
                                 AudioNormalizer normalizer,
                                 SynthesisCache cache,
                                 StreamingMetrics metrics,
                                 ApplicationEventPublisher publisher) {
        super(ElevenLabsFrames.PROVIDER, connectionFactory, streamProperties, metrics, publisher);
        this.properties = Objects.requireNonNull(properties, "properties");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.cache = properties.isCaching() ? cache : null;
        this.chunker = new TextChunker(properties.getMaxChunkChars());
    }

    /**
     * @return characters submitted for synthesis so far, including cache hits
     */
    public long getSynthesizedCharacters() {
        return getSubmittedCount();
    }

    @Override
    protected long measure(String text) {
        return text.length();
    }

    @Override
    protected Optional<PendingUnit> openUnit(String text, StreamMetadata metadata) {
        StreamMetadata unitMetadata = metadata.withAttribute(StreamMetadata.ATTR_TEXT, text);
        long now = System.nanoTime();
        if (cache == null || text.isBlank()) {
            return Optional.of(new PendingUnit(unitMetadata, now, null, null));
        }
        String key = new SynthesisCacheKey(text, properties.getVoiceId(), properties.getModel(),
                properties.providerOutputFormat()).value();
        byte[] cached = cache.get(key).orElse(null);
        if (cached != null) {
            LOG.debug("Cache hit for request {}: \"{}\"", metadata.requestId(), LogSanitizer.preview(text));
        }
        return Optional.of(new PendingUnit(unitMetadata, now, key, cached));
    }

    @Override
    protected void send(StreamConnection<String> connection, String text, StreamMetadata metadata)
            throws InterruptedException {
        List<String> chunks = chunker.chunk(text);
        LOG.debug("Sending request {} in {} chunk(s): \"{}\"",
                metadata.requestId(), chunks.size(), LogSanitizer.preview(text));
        for (String chunk : chunks) {
            connection.send(ElevenLabsFrames.textFrame(chunk));
        }
        connection.send(ElevenLabsFrames.flushFrame());
    }

    @Override
    protected void handleEvent(String rawFrame) {
        SynthesisFrame frame = ElevenLabsFrames.parse(rawFrame);
        if (!frame.hasAudio() && !frame.isFinal()) {
            LOG.debug("Frame without audio ignored");
            return;
        }
        Optional<StreamMetadata> active = activateUnit();
        if (active.isEmpty()) {
            return;
        }
        int targetRate = targetSampleRate(active.get());
        if (frame.hasAudio()) {
            collect(frame.audio());
            NormalizedAudio audio = normalizer.normalize(frame.audio(), targetRate);
            emit(audio.data(), audio.format());
        }
        if (frame.isFinal()) {
            LOG.debug("End of unit for request {}", active.get().requestId());
            NormalizedAudio end = normalizer.normalizeSentinel(ElevenLabsFrames.END_OF_UNIT, targetRate);
            completeUnit(end.data(), end.format());
        }
    }

    @Override
    protected void replayCached(PendingUnit unit) {
        int targetRate = targetSampleRate(unit.metadata());
        NormalizedAudio audio = normalizer.normalize(unit.cachedAudio(), targetRate);
        emit(audio.data(), audio.format());
        NormalizedAudio end = normalizer.normalizeSentinel(ElevenLabsFrames.END_OF_UNIT, targetRate);
        completeUnit(end.data(), end.format());
    }

    @Override
    protected void onUnitCompleted(PendingUnit unit) {
        if (cache != null && unit.cacheKey() != null && !unit.isCached()
                && unit == accumulating && unitAudio.size() > 0) {
            cache.put(unit.cacheKey(), unitAudio.toByteArray());
            LOG.debug("Cached {} bytes for request {}", unitAudio.size(), unit.requestId());
        }
        unitAudio.reset();
        accumulating = null;
    }

    @Override
    protected void onStopped() {
        LOG.info("ElevenLabs synthesizer stopped after {} character(s)", getSynthesizedCharacters());
    }

    private void collect(byte[] raw) {
        if (cache == null) {
            return;
        }
        PendingUnit unit = activeUnit().orElse(null);
        if (unit != accumulating) {
            unitAudio.reset();
            accumulating = unit;
        }
        unitAudio.writeBytes(raw);
    }

    private int targetSampleRate(StreamMetadata metadata) {
        return metadata.attribute(StreamMetadata.ATTR_SAMPLING_RATE)
                .map(ElevenLabsSynthesizer::toRate)
                .orElse(properties.getSamplingRate());
    }

    private static int toRate(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }
}
