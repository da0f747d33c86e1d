/**
 * Azure streaming speech-to-text: recognizer session transport and the transcriber adapter.
 */
package com.phillippitts.voicebridge.service.stt;
