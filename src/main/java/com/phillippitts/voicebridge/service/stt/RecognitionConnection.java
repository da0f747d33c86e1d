package com.phillippitts.voicebridge.service.stt;

import com.phillippitts.voicebridge.service.stream.connection.StreamConnection;

/**
 * Connection to a continuous speech recognizer fed with pushed audio.
 */
public interface RecognitionConnection extends StreamConnection<byte[]> {

    /**
     * Pushes audio into the recognizer's input stream. Pushing does not block on the network.
     */
    @Override
    void send(byte[] audio);

    /**
     * Signals that no more audio follows. The recognizer finishes pending utterances and then
     * reports session stopped; the connection is no longer open afterwards.
     */
    void endInput();
}
