package com.phillippitts.voicebridge.service.synth;

import com.phillippitts.voicebridge.config.properties.SynthesizerProperties;
import com.phillippitts.voicebridge.domain.StreamMetadata;
import com.phillippitts.voicebridge.domain.StreamResult;
import com.phillippitts.voicebridge.exception.StreamConnectionException;
import com.phillippitts.voicebridge.service.audio.AudioEncoding;
import com.phillippitts.voicebridge.service.audio.PcmAudioNormalizer;
import com.phillippitts.voicebridge.service.metrics.StreamingMetrics;
import com.phillippitts.voicebridge.service.stream.ResultSequence;
import com.phillippitts.voicebridge.testutil.EventCapturingPublisher;
import com.phillippitts.voicebridge.testutil.FakeConnectionFactory;
import com.phillippitts.voicebridge.testutil.FakeStreamConnection;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Base64;
import java.util.List;

import static com.phillippitts.voicebridge.testutil.TestStreams.WAIT;
import static com.phillippitts.voicebridge.testutil.TestStreams.eventually;
import static com.phillippitts.voicebridge.testutil.TestStreams.fastProperties;
import static com.phillippitts.voicebridge.testutil.TestStreams.take;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElevenLabsSynthesizerTest {

    private static final byte[] SENTINEL = { 0x00 };

    private FakeConnectionFactory<String, String> factory;
    private SimpleMeterRegistry registry;
    private SynthesizerProperties props;
    private InMemorySynthesisCache cache;
    private ElevenLabsSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        factory = new FakeConnectionFactory<>();
        registry = new SimpleMeterRegistry();
        props = new SynthesizerProperties();
        props.setUseMulaw(true);
        props.setCaching(false);
        props.setVoiceId("voice-1");
        cache = new InMemorySynthesisCache();
    }

    @AfterEach
    void tearDown() {
        if (synthesizer != null) {
            synthesizer.stop();
        }
    }

    private ElevenLabsSynthesizer startSynthesizer() {
        synthesizer = createSynthesizer(new PcmAudioNormalizer(AudioEncoding.MULAW, 8000));
        synthesizer.start();
        return synthesizer;
    }

    private ElevenLabsSynthesizer createSynthesizer(PcmAudioNormalizer normalizer) {
        return new ElevenLabsSynthesizer(factory, props, fastProperties(), normalizer, cache,
                new StreamingMetrics(registry), new EventCapturingPublisher());
    }

    private static String audioFrame(byte[] audio, boolean isFinal) {
        return new JSONObject()
                .put("audio", Base64.getEncoder().encodeToString(audio))
                .put("isFinal", isFinal)
                .toString();
    }

    private static String finalFrame() {
        return new JSONObject().put("audio", JSONObject.NULL).put("isFinal", true).toString();
    }

    private double counter(String name) {
        var counter = registry.find(name).tag("provider", "elevenlabs").counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void shouldTagFirstResultOfUnitWithoutEndingIt() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Hello world", StreamMetadata.of("1"));
        factory.emit(audioFrame(new byte[] { 1, 2 }, false));
        factory.emit(audioFrame(new byte[] { 3, 4 }, false));

        List<StreamResult<byte[]>> taken = take(results, 2);
        assertThat(taken).extracting(StreamResult::requestId).containsExactly("1", "1");
        assertThat(taken).extracting(StreamResult::isFirstChunk).containsExactly(true, false);
        assertThat(taken).noneMatch(StreamResult::isEndOfStream);
        assertThat(taken.get(0).payload()).containsExactly(1, 2);
        assertThat(taken.get(1).payload()).containsExactly(3, 4);
    }

    @Test
    void shouldEmitSentinelAndResetFirstChunkAfterFinalFrame() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("", StreamMetadata.endOfUpstream("2"));
        assertThat(adapter.isEndOfUpstream()).isTrue();
        factory.emit(audioFrame(new byte[] { 9 }, false));
        factory.emit(finalFrame());

        List<StreamResult<byte[]>> taken = take(results, 2);
        assertThat(taken.get(0).isFirstChunk()).isTrue();
        assertThat(taken.get(0).isEndOfStream()).isFalse();
        assertThat(taken.get(1).isEndOfStream()).isTrue();
        assertThat(taken.get(1).isFirstChunk()).isFalse();
        assertThat(taken.get(1).payload()).containsExactly(SENTINEL);
        assertThat(adapter.isEndOfUpstream()).isFalse();

        adapter.submit("Next", StreamMetadata.of("3"));
        factory.emit(audioFrame(new byte[] { 7 }, false));

        StreamResult<byte[]> next = take(results, 1).get(0);
        assertThat(next.requestId()).isEqualTo("3");
        assertThat(next.isFirstChunk()).isTrue();
    }

    @Test
    void shouldResolveResultsAgainstOriginalUnitAcrossReconnect() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Reconnect me", StreamMetadata.of("C"));
        factory.emit(audioFrame(new byte[] { 5 }, false));
        StreamResult<byte[]> first = take(results, 1).get(0);

        factory.latest().kill();
        assertThat(eventually(() -> factory.opened().size() == 2 && adapter.isConnected())).isTrue();

        factory.emit(audioFrame(new byte[] { 6 }, true));
        List<StreamResult<byte[]>> rest = take(results, 2);

        assertThat(first.isFirstChunk()).isTrue();
        assertThat(rest).extracting(StreamResult::requestId).containsExactly("C", "C");
        assertThat(rest.get(0).isFirstChunk()).isFalse();
        assertThat(rest.get(1).isEndOfStream()).isTrue();
        assertThat(rest.get(1).metadata().attribute(StreamMetadata.ATTR_TEXT)).contains("Reconnect me");
        assertThat(adapter.getPendingUnits()).isZero();
        assertThat(counter("voicebridge.stream.reconnects")).isEqualTo(1.0);
    }

    @Test
    void shouldKeepSubmissionOrderAndFirstChunkPerUnit() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        for (String id : List.of("a", "b", "c")) {
            adapter.submit("Text " + id, StreamMetadata.of(id));
        }
        for (int i = 0; i < 3; i++) {
            factory.emit(audioFrame(new byte[] { (byte) i }, true));
        }

        List<StreamResult<byte[]>> taken = take(results, 6);
        assertThat(taken).extracting(StreamResult::requestId)
                .containsExactly("a", "a", "b", "b", "c", "c");
        assertThat(taken).filteredOn(StreamResult::isFirstChunk).extracting(StreamResult::requestId)
                .containsExactly("a", "b", "c");
        assertThat(taken).filteredOn(StreamResult::isEndOfStream).extracting(StreamResult::requestId)
                .containsExactly("a", "b", "c");
        assertThat(adapter.getPendingUnits()).isZero();
    }

    @Test
    void shouldAdvanceToNextUnitWhenPreviousEndedWithoutFinalFrame() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Hello world", StreamMetadata.of("1"));
        factory.emit(audioFrame(new byte[] { 1 }, false));
        factory.emit(audioFrame(new byte[] { 2 }, false));
        List<StreamResult<byte[]>> unitA = take(results, 2);
        assertThat(unitA).extracting(StreamResult::requestId).containsExactly("1", "1");

        adapter.submit("", StreamMetadata.endOfUpstream("2"));
        factory.emit(audioFrame(new byte[] { 3 }, false));
        factory.emit(finalFrame());

        List<StreamResult<byte[]>> unitB = take(results, 2);
        assertThat(unitB).extracting(StreamResult::requestId).containsExactly("2", "2");
        assertThat(unitB.get(0).isFirstChunk()).isTrue();
        assertThat(unitB.get(0).isEndOfStream()).isFalse();
        assertThat(unitB.get(1).isFirstChunk()).isFalse();
        assertThat(unitB.get(1).isEndOfStream()).isTrue();
        assertThat(adapter.getPendingUnits()).isZero();
        assertThat(counter("voicebridge.stream.desync")).isZero();
    }

    @Test
    void shouldStartNextConversationFreshWhenEndOfUpstreamUnitGetsNoFinalFrame() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Goodbye", StreamMetadata.endOfUpstream("2"));
        factory.emit(audioFrame(new byte[] { 1 }, false));
        factory.emit(audioFrame(new byte[] { 2 }, false));

        List<StreamResult<byte[]>> ending = take(results, 2);
        assertThat(ending).extracting(StreamResult::requestId).containsExactly("2", "2");
        assertThat(ending).extracting(StreamResult::isFirstChunk).containsExactly(true, false);
        assertThat(ending).noneMatch(StreamResult::isEndOfStream);
        assertThat(adapter.isEndOfUpstream()).isFalse();

        adapter.submit("Hello again", StreamMetadata.of("3"));
        factory.emit(audioFrame(new byte[] { 3 }, false));

        StreamResult<byte[]> next = take(results, 1).get(0);
        assertThat(next.requestId()).isEqualTo("3");
        assertThat(next.isFirstChunk()).isTrue();
        assertThat(adapter.getPendingUnits()).isZero();
    }

    @Test
    void shouldDropStrayFramesAfterConversationEnded() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Goodbye", StreamMetadata.endOfUpstream("2"));
        factory.emit(audioFrame(new byte[] { 1 }, true));
        take(results, 2);

        factory.emit(audioFrame(new byte[] { 2 }, false));
        assertThat(eventually(() -> counter("voicebridge.stream.desync") == 1.0)).isTrue();
        assertThat(results.poll(Duration.ofMillis(50))).isEmpty();

        adapter.submit("Hello again", StreamMetadata.of("3"));
        factory.emit(audioFrame(new byte[] { 3 }, false));

        StreamResult<byte[]> next = take(results, 1).get(0);
        assertThat(next.requestId()).isEqualTo("3");
        assertThat(next.isFirstChunk()).isTrue();
    }

    @Test
    void shouldSendChunksFollowedByFlush() throws InterruptedException {
        props.setMaxChunkChars(12);
        ElevenLabsSynthesizer adapter = startSynthesizer();
        FakeStreamConnection<String> connection = factory.latest();

        adapter.submit("Hello there. How are you", StreamMetadata.of("1"));

        assertThat(eventually(() -> connection.sent().size() == 3)).isTrue();
        List<String> texts = connection.sent().stream()
                .map(frame -> new JSONObject(frame).getString("text"))
                .toList();
        assertThat(texts).containsExactly("Hello there. ", "How are you ", "");
        assertThat(new JSONObject(connection.sent().get(2)).getBoolean("flush")).isTrue();
    }

    @Test
    void shouldSendFlushForEmptyText() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        FakeStreamConnection<String> connection = factory.latest();

        adapter.submit("", StreamMetadata.endOfUpstream("eos"));

        assertThat(eventually(() -> connection.sent().size() == 1)).isTrue();
        assertThat(connection.sent().get(0)).isEqualTo(ElevenLabsFrames.flushFrame());
    }

    @Test
    void shouldWaitForConnectionWhenSubmittedBeforeStart() throws InterruptedException {
        synthesizer = createSynthesizer(new PcmAudioNormalizer(AudioEncoding.MULAW, 8000));
        synthesizer.submit("Early", StreamMetadata.of("early"));
        assertThat(factory.opened()).isEmpty();

        synthesizer.start();

        assertThat(eventually(() -> factory.latest().sent().size() == 2)).isTrue();
        assertThat(synthesizer.getPendingUnits()).isEqualTo(1);
    }

    @Test
    void shouldSkipMalformedFrameAndContinue() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Hi", StreamMetadata.of("1"));
        factory.emit("{not json");
        factory.emit(audioFrame(new byte[] { 1 }, true));

        List<StreamResult<byte[]>> taken = take(results, 2);
        assertThat(taken.get(0).isFirstChunk()).isTrue();
        assertThat(taken.get(1).isEndOfStream()).isTrue();
        assertThat(counter("voicebridge.stream.malformed")).isEqualTo(1.0);
    }

    @Test
    void shouldDropEventWhenNoUnitWasEverActive() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        factory.emit(audioFrame(new byte[] { 1 }, false));

        assertThat(eventually(() -> counter("voicebridge.stream.desync") == 1.0)).isTrue();
        assertThat(results.poll(Duration.ofMillis(50))).isEmpty();
        assertThat(adapter.getPendingUnits()).isZero();
    }

    @Test
    void shouldReuseLastMetadataOnDesync() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Once", StreamMetadata.of("1"));
        factory.emit(audioFrame(new byte[] { 1 }, true));
        take(results, 2);

        factory.emit(audioFrame(new byte[] { 2 }, false));

        StreamResult<byte[]> stray = take(results, 1).get(0);
        assertThat(stray.requestId()).isEqualTo("1");
        assertThat(stray.isFirstChunk()).isFalse();
        assertThat(counter("voicebridge.stream.desync")).isEqualTo(1.0);
        assertThat(adapter.getPendingUnits()).isZero();
    }

    @Test
    void shouldReplayCachedAudioInQueueOrderWithoutSending() throws InterruptedException {
        props.setCaching(true);
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();
        FakeStreamConnection<String> connection = factory.latest();

        adapter.submit("Hi there", StreamMetadata.of("first"));
        factory.emit(audioFrame(new byte[] { 1, 2 }, false));
        factory.emit(audioFrame(new byte[] { 3 }, true));
        take(results, 3);
        assertThat(eventually(() -> cache.size() == 1)).isTrue();
        int sentBefore = connection.sent().size();

        adapter.submit("Something new", StreamMetadata.of("second"));
        adapter.submit("Hi there", StreamMetadata.of("cached"));
        factory.emit(audioFrame(new byte[] { 8 }, true));

        List<StreamResult<byte[]>> taken = take(results, 4);
        assertThat(taken).extracting(StreamResult::requestId)
                .containsExactly("second", "second", "cached", "cached");
        assertThat(taken.get(2).isFirstChunk()).isTrue();
        assertThat(taken.get(2).payload()).containsExactly(1, 2, 3);
        assertThat(taken.get(3).isEndOfStream()).isTrue();
        assertThat(eventually(() -> connection.sent().size() == sentBefore + 2)).isTrue();
        assertThat(adapter.getSynthesizedCharacters()).isEqualTo(8 + 13 + 8);
    }

    @Test
    void shouldNotCacheWhenCachingDisabled() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Hi there", StreamMetadata.of("1"));
        factory.emit(audioFrame(new byte[] { 1 }, true));
        take(results, 2);

        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldWrapPcmAudioInWav() throws InterruptedException {
        props.setUseMulaw(false);
        synthesizer = createSynthesizer(new PcmAudioNormalizer(AudioEncoding.PCM16, 16_000));
        synthesizer.start();
        ResultSequence<byte[]> results = synthesizer.results();

        synthesizer.submit("Hi", StreamMetadata.of("pcm"));
        factory.emit(audioFrame(new byte[] { 1, 0, 2, 0 }, true));

        List<StreamResult<byte[]>> taken = take(results, 2);
        assertThat(taken.get(0).format()).isEqualTo("wav");
        assertThat(new String(taken.get(0).payload(), 0, 4, java.nio.charset.StandardCharsets.US_ASCII))
                .isEqualTo("RIFF");
        assertThat(taken.get(1).isEndOfStream()).isTrue();
    }

    @Test
    void shouldTagMulawResults() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();

        adapter.submit("Hi", StreamMetadata.of("1"));
        factory.emit(audioFrame(new byte[] { 1 }, false));

        assertThat(take(results, 1).get(0).format()).isEqualTo("mulaw");
    }

    @Test
    void shouldLogAndContinueWhenSendFails() throws InterruptedException {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        FakeStreamConnection<String> connection = factory.latest();
        connection.failSends(new StreamConnectionException("boom", "fake"));

        adapter.submit("Never sent", StreamMetadata.of("1"));
        Thread.sleep(50);

        assertThat(connection.sent()).isEmpty();
        assertThat(adapter.isRunning()).isTrue();
        assertThat(adapter.getSynthesizedCharacters()).isEqualTo(10);
    }

    @Test
    void stopShouldCancelInFlightSendAndEndResults() throws InterruptedException {
        factory.holdSendsOnNewConnections();
        ElevenLabsSynthesizer adapter = startSynthesizer();
        ResultSequence<byte[]> results = adapter.results();
        FakeStreamConnection<String> connection = factory.latest();

        adapter.submit("Held", StreamMetadata.of("1"));
        assertThat(connection.awaitSendEntered(WAIT.toMillis())).isTrue();

        adapter.stop();

        assertThat(connection.interruptedSends()).isEqualTo(1);
        assertThat(connection.closeCount()).isEqualTo(1);
        assertThat(connection.sent()).isEmpty();
        assertThat(results.hasNext()).isFalse();
        assertThat(adapter.isConnected()).isFalse();
        assertThat(adapter.getPendingUnits()).isZero();
    }

    @Test
    void stopShouldBeIdempotent() {
        ElevenLabsSynthesizer adapter = startSynthesizer();

        adapter.stop();
        adapter.stop();

        assertThat(factory.latest().closeCount()).isEqualTo(1);
        assertThat(adapter.isRunning()).isFalse();
    }

    @Test
    void stopWithoutStartShouldBeNoOp() {
        synthesizer = createSynthesizer(new PcmAudioNormalizer(AudioEncoding.MULAW, 8000));

        synthesizer.stop();

        assertThat(factory.opened()).isEmpty();
        assertThat(synthesizer.isRunning()).isFalse();
    }

    @Test
    void stopShouldCompleteOnDeadConnection() {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        factory.failNextOpens(Integer.MAX_VALUE);
        factory.latest().kill();

        adapter.stop();

        assertThat(adapter.isRunning()).isFalse();
    }

    @Test
    void startShouldBeIdempotent() {
        ElevenLabsSynthesizer adapter = startSynthesizer();

        adapter.start();

        assertThat(factory.opened()).hasSize(1);
    }

    @Test
    void submitAfterStopShouldFail() {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        adapter.stop();

        assertThatThrownBy(() -> adapter.submit("late", StreamMetadata.of("x")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resultsShouldBeClaimableOnlyOnce() {
        ElevenLabsSynthesizer adapter = startSynthesizer();
        adapter.results();

        assertThatThrownBy(adapter::results).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldCountSubmittedCharacters() {
        ElevenLabsSynthesizer adapter = startSynthesizer();

        adapter.submit("abc", StreamMetadata.of("1"));
        adapter.submit("de", StreamMetadata.of("2"));

        assertThat(adapter.getSynthesizedCharacters()).isEqualTo(5);
        assertThat(counter("voicebridge.stream.submitted")).isEqualTo(5.0);
        assertThat(adapter.getPendingUnits()).isEqualTo(2);
    }
}
