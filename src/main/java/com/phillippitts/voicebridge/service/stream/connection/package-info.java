/**
 * Connection lifecycle: the transport abstraction, its factory, and the supervised
 * {@link com.phillippitts.voicebridge.service.stream.connection.ConnectionManager}.
 */
package com.phillippitts.voicebridge.service.stream.connection;
