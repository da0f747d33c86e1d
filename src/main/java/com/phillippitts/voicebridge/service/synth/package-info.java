/**
 * ElevenLabs streaming text-to-speech: WebSocket transport, frame codec, text chunking and the
 * synthesis cache.
 */
package com.phillippitts.voicebridge.service.synth;
