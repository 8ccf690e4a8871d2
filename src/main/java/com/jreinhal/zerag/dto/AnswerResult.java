package com.jreinhal.zerag.dto;

import java.util.List;
import java.util.Map;

public record AnswerResult(
        String question,
        String answer,
        List<RetrievedChunk> chunks,
        String dataSourceId,
        List<Map<String, Object>> trace,
        boolean structuredFallbackUsed) {
}
