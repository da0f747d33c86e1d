package com.phillippitts.voicebridge.service.stream.connection;

import java.util.function.Consumer;

/**
 * Opens connections to one speech service, including any handshake the service requires.
 *
 * @param <C> connection type
 * @param <E> inbound event type
 */
@FunctionalInterface
public interface ConnectionFactory<C extends StreamConnection<?>, E> {

    /**
     * Opens a new connection and performs the handshake.
     *
     * @param inbound receives every inbound event of the new connection, on a transport thread
     * @return an open connection
     * @throws com.phillippitts.voicebridge.exception.StreamConnectionException if the connection
     *         or handshake fails
     */
    C open(Consumer<E> inbound);
}
