package com.phillippitts.voicebridge.service.stream;

import com.phillippitts.voicebridge.domain.StreamMetadata;
import com.phillippitts.voicebridge.domain.StreamResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultSequenceTest {

    private static StreamResult<String> result(String payload) {
        return new StreamResult<>(payload, StreamMetadata.of("r1"));
    }

    @Test
    void shouldHandOutBufferedResultsBeforeEnding() {
        ResultSequence<String> sequence = new ResultSequence<>();
        sequence.offer(result("a"));
        sequence.offer(result("b"));
        sequence.terminate();

        List<String> payloads = sequence.stream().map(StreamResult::payload).toList();

        assertThat(payloads).containsExactly("a", "b");
        assertThat(sequence.hasNext()).isFalse();
    }

    @Test
    void nextAfterEndShouldThrow() {
        ResultSequence<String> sequence = new ResultSequence<>();
        sequence.terminate();

        assertThatThrownBy(sequence::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void pollShouldTimeOutWhenNothingArrives() throws InterruptedException {
        ResultSequence<String> sequence = new ResultSequence<>();

        assertThat(sequence.poll(Duration.ofMillis(20))).isEmpty();
        assertThat(sequence.isTerminated()).isFalse();
    }

    @Test
    void offerAfterTerminateShouldBeIgnored() throws InterruptedException {
        ResultSequence<String> sequence = new ResultSequence<>();
        sequence.close();

        assertThat(sequence.offer(result("late"))).isFalse();
        assertThat(sequence.poll(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    void hasNextShouldBlockUntilResultArrives() throws Exception {
        ResultSequence<String> sequence = new ResultSequence<>();
        Thread producer = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            sequence.offer(result("late"));
        });
        producer.start();

        assertThat(sequence.hasNext()).isTrue();
        assertThat(sequence.next().payload()).isEqualTo("late");
        producer.join();
    }

    @Test
    void pollShouldDrainBufferedResultsThenReportEnd() throws InterruptedException {
        ResultSequence<String> sequence = new ResultSequence<>();
        sequence.offer(result("a"));
        sequence.terminate();

        assertThat(sequence.poll(Duration.ofMillis(20))).map(StreamResult::payload).contains("a");
        assertThat(sequence.poll(Duration.ofMillis(20))).isEmpty();
        assertThat(sequence.hasNext()).isFalse();
    }

    @Test
    void terminateShouldBeIdempotent() {
        ResultSequence<String> sequence = new ResultSequence<>();
        sequence.terminate();
        sequence.terminate();

        assertThat(sequence.hasNext()).isFalse();
        assertThat(sequence.hasNext()).isFalse();
    }
}
