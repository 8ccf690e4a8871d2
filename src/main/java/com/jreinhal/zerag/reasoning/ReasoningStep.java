package com.jreinhal.zerag.reasoning;

import java.util.Map;

public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data != null ? data : Map.of());
    }

    public enum StepType {
        CACHE,
        QUERY_EXPANSION,
        HYDE,
        VECTOR_SEARCH,
        LEXICAL_SEARCH,
        FUSION,
        RERANK,
        STRUCTURED_FALLBACK,
        GENERATION,
        ERROR
    }
}
