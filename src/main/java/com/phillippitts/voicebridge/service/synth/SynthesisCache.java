package com.phillippitts.voicebridge.service.synth;

import java.util.Optional;

/**
 * Stores raw provider audio of completed synthesis units, keyed by {@link SynthesisCacheKey#value()}.
 */
public interface SynthesisCache {

    Optional<byte[]> get(String key);

    void put(String key, byte[] audio);

    int size();
}
