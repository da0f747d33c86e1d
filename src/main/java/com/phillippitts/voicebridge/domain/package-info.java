/**
 * Domain types shared by the streaming adapters.
 *
 * <ul>
 *   <li>{@link com.phillippitts.voicebridge.domain.StreamMetadata} - versioned, immutable metadata
 *       carried by every submitted unit and every emitted result</li>
 *   <li>{@link com.phillippitts.voicebridge.domain.StreamResult} - payload plus metadata snapshot</li>
 *   <li>{@link com.phillippitts.voicebridge.domain.TranscriptEvent} - typed transcriber payload</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicebridge.domain;
