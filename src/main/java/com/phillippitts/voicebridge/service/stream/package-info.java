/**
 * Streaming adapter core: submission path, result path and lifecycle shared by all providers.
 *
 * @see com.phillippitts.voicebridge.service.stream.AbstractStreamingAdapter
 */
package com.phillippitts.voicebridge.service.stream;
