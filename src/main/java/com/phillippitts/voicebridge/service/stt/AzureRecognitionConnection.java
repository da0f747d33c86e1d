package com.phillippitts.voicebridge.service.stt;

import com.microsoft.cognitiveservices.speech.SpeechConfig;
import com.microsoft.cognitiveservices.speech.SpeechRecognizer;
import com.microsoft.cognitiveservices.speech.audio.AudioConfig;
import com.microsoft.cognitiveservices.speech.audio.PushAudioInputStream;
import com.phillippitts.voicebridge.exception.StreamConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Azure continuous recognition session fed through a {@link PushAudioInputStream}.
 */
final class AzureRecognitionConnection implements RecognitionConnection {

    private static final Logger LOG = LogManager.getLogger(AzureRecognitionConnection.class);

    private static final long STOP_TIMEOUT_SECONDS = 10;

    private final SpeechConfig speechConfig;
    private final AudioConfig audioConfig;
    private final PushAudioInputStream pushStream;
    private final SpeechRecognizer recognizer;

    private final AtomicBoolean inputEnded = new AtomicBoolean(false);
    private final AtomicBoolean sessionStopped = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    AzureRecognitionConnection(SpeechConfig speechConfig,
                               AudioConfig audioConfig,
                               PushAudioInputStream pushStream,
                               SpeechRecognizer recognizer) {
        this.speechConfig = speechConfig;
        this.audioConfig = audioConfig;
        this.pushStream = pushStream;
        this.recognizer = recognizer;
    }

    void markSessionStopped() {
        sessionStopped.set(true);
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && !inputEnded.get() && !sessionStopped.get();
    }

    @Override
    public void send(byte[] audio) {
        if (!isOpen()) {
            throw new StreamConnectionException("Recognition session is not accepting audio",
                    AzureRecognitionConnectionFactory.PROVIDER);
        }
        pushStream.write(audio);
    }

    @Override
    public void endInput() {
        if (inputEnded.compareAndSet(false, true)) {
            pushStream.close();
            LOG.info("Azure audio input ended");
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        endInput();
        try {
            recognizer.stopContinuousRecognitionAsync().get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while stopping Azure recognition");
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Error stopping Azure recognition: {}", e.toString());
        } finally {
            recognizer.close();
            audioConfig.close();
            speechConfig.close();
        }
        LOG.info("Azure recognition session closed");
    }
}
