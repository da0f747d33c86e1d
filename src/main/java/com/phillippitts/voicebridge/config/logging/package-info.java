/**
 * Logging support: Log4j2 ThreadContext propagation onto adapter worker threads.
 */
package com.phillippitts.voicebridge.config.logging;
