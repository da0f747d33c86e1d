/**
 * Spring configuration: adapter wiring, configuration properties and logging support.
 */
package com.phillippitts.voicebridge.config;
