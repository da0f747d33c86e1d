package com.phillippitts.voicebridge.service.synth;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Unbounded in-process {@link SynthesisCache}. Entries live as long as the cache.
 */
public class InMemorySynthesisCache implements SynthesisCache {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] audio = entries.get(key);
        return audio == null ? Optional.empty() : Optional.of(Arrays.copyOf(audio, audio.length));
    }

    @Override
    public void put(String key, byte[] audio) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(audio, "audio must not be null");
        entries.put(key, Arrays.copyOf(audio, audio.length));
    }

    @Override
    public int size() {
        return entries.size();
    }
}
