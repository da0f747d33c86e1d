/**
 * Audio normalization for synthesized speech: resampling, WAV wrapping and mu-law pass-through.
 */
package com.phillippitts.voicebridge.service.audio;
