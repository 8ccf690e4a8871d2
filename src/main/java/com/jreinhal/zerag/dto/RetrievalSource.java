package com.jreinhal.zerag.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Which retrieval path produced a candidate. Lexical hits ({@code BM25}, {@code KEYWORD}) outrank
 * vector-based hits during fusion; only vector-based hits feed the fallback confidence signal.
 */
public enum RetrievalSource {
    BM25,
    KEYWORD,
    VECTOR,
    HYDE;

    public boolean isVectorBased() {
        return this == VECTOR || this == HYDE;
    }

    @JsonValue
    public String tag() {
        return this.name().toLowerCase(Locale.ROOT);
    }
}
