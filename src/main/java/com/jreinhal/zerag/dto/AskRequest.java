package com.jreinhal.zerag.dto;

import java.util.List;

/**
 * Question-answering request. Null flags default to enabled; {@code topK} defaults to 5 and is
 * clamped to [1, 50].
 */
public record AskRequest(
        String question,
        String dataSourceId,
        Integer topK,
        Boolean enableRewrite,
        Boolean enableHyde,
        Boolean enableStructuredFallback,
        List<ConversationTurn> history) {

    public static final int DEFAULT_TOP_K = 5;
    public static final int MAX_TOP_K = 50;

    public static AskRequest of(String question, String dataSourceId, int topK) {
        return new AskRequest(question, dataSourceId, topK, null, null, null, null);
    }

    public int effectiveTopK() {
        if (topK == null) {
            return DEFAULT_TOP_K;
        }
        return Math.max(1, Math.min(MAX_TOP_K, topK));
    }

    public boolean rewriteEnabled() {
        return enableRewrite == null || enableRewrite;
    }

    public boolean hydeEnabled() {
        return enableHyde == null || enableHyde;
    }

    public boolean structuredFallbackEnabled() {
        return enableStructuredFallback == null || enableStructuredFallback;
    }

    public List<ConversationTurn> safeHistory() {
        return history != null ? history : List.of();
    }

    public boolean hasHistory() {
        return history != null && history.stream().anyMatch(ConversationTurn::isUsable);
    }
}
