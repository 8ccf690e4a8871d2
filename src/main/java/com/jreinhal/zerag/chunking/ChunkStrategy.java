package com.jreinhal.zerag.chunking;

import java.util.Locale;

public enum ChunkStrategy {
    FIXED,
    PARAGRAPH,
    SENTENCE,
    SMART;

    /**
     * Parses a stored strategy tag, returning {@code fallback} when the tag is absent.
     */
    public static ChunkStrategy fromString(String value, ChunkStrategy fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return ChunkStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown chunk strategy: " + value);
        }
    }
}
