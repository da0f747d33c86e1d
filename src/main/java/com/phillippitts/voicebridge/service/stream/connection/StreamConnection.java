package com.phillippitts.voicebridge.service.stream.connection;

/**
 * A live duplex transport to a speech service.
 *
 * <p>Inbound traffic is not read from the connection: the {@link ConnectionFactory} that opened it
 * delivers every inbound event to a consumer owned by the adapter. This keeps the adapter's inbound
 * queue stable across reconnects.
 *
 * @param <O> outbound frame type
 */
public interface StreamConnection<O> extends AutoCloseable {

    /**
     * @return true while the transport accepts frames
     */
    boolean isOpen();

    /**
     * Sends one frame and waits until the transport has accepted it.
     *
     * @param frame outbound frame
     * @throws InterruptedException if the sending thread is interrupted while waiting
     * @throws com.phillippitts.voicebridge.exception.StreamConnectionException if the transport fails
     */
    void send(O frame) throws InterruptedException;

    /**
     * Closes the transport. Safe to call more than once; never throws.
     */
    @Override
    void close();
}
