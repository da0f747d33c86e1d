package com.phillippitts.voicebridge.service.synth;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into frames for incremental synthesis.
 *
 * <p>Chunks break only between words and each one ends with a single space, which the provider uses
 * as a word boundary. A chunk is closed early after sentence-ending punctuation so that the provider
 * can start speaking the first sentence sooner. A single word longer than the limit becomes its own
 * chunk.
 */
public final class TextChunker {

    private static final String SENTENCE_END = ".?!";

    private final int maxChars;

    public TextChunker(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive, got: " + maxChars);
        }
        this.maxChars = maxChars;
    }

    /**
     * @param text input text (may be null)
     * @return chunks in order; empty for null or blank text
     */
    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String[] words = text.strip().split("\\s+");
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : words) {
            if (current.length() > 0 && current.length() + 1 + word.length() > maxChars) {
                flush(current, chunks);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
            if (SENTENCE_END.indexOf(word.charAt(word.length() - 1)) >= 0) {
                flush(current, chunks);
            }
        }
        flush(current, chunks);
        return chunks;
    }

    public int getMaxChars() {
        return maxChars;
    }

    private static void flush(StringBuilder current, List<String> chunks) {
        if (current.length() == 0) {
            return;
        }
        chunks.add(current.append(' ').toString());
        current.setLength(0);
    }
}
