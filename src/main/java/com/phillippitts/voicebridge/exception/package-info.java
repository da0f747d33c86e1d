/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicebridge.exception.VoiceBridgeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.StreamConnectionException} - Thrown when a
 *       speech service connection cannot be opened or a send fails</li>
 *   <li>{@link com.phillippitts.voicebridge.exception.MalformedEventException} - Thrown when an
 *       inbound frame cannot be parsed</li>
 * </ul>
 *
 * <p>None of these reach callers of the streaming adapters. Connection failures are retried by
 * the supervisor and malformed events are skipped; callers observe a gap in output, never a
 * terminated result sequence.
 *
 * @see com.phillippitts.voicebridge.exception.VoiceBridgeException
 * @since 1.0
 */
package com.phillippitts.voicebridge.exception;
