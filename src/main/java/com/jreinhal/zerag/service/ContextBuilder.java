package com.jreinhal.zerag.service;

import com.jreinhal.zerag.dto.RetrievalSource;
import com.jreinhal.zerag.dto.RetrievedChunk;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

/**
 * Renders fused passages and fallback rows into the reference block handed to the model.
 */
@Component
public class ContextBuilder {

    static final String EMPTY_CONTEXT = "(no relevant content retrieved)";
    static final String STRUCTURED_HEADER = "[structured query result]";
    static final int MAX_FALLBACK_ROWS = 10;

    public String build(List<RetrievedChunk> chunks, List<Map<String, Object>> fallbackRows) {
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            if (context.length() > 0) {
                context.append("\n\n");
            }
            context.append("[passage ").append(i + 1).append(" | ").append(label(chunk)).append("] source: ")
                    .append(locator(chunk)).append('\n')
                    .append(chunk.text() != null ? chunk.text() : "");
        }
        if (fallbackRows != null && !fallbackRows.isEmpty()) {
            if (context.length() > 0) {
                context.append("\n\n");
            }
            context.append(STRUCTURED_HEADER);
            fallbackRows.stream().limit(MAX_FALLBACK_ROWS).forEach(row -> context.append('\n').append(formatRow(row)));
        }
        return context.length() > 0 ? context.toString() : EMPTY_CONTEXT;
    }

    static String label(RetrievedChunk chunk) {
        RetrievalSource source = chunk.source() != null ? chunk.source() : RetrievalSource.VECTOR;
        String label = switch (source) {
            case BM25 -> String.format(Locale.ROOT, "bm25 %.2f", chunk.bm25Score() != null ? chunk.bm25Score() : chunk.similarity());
            case KEYWORD -> "keyword match";
            case VECTOR, HYDE -> String.format(Locale.ROOT, "semantic %d%%", Math.round(chunk.similarity() * 100.0));
        };
        if (chunk.rerankScore() != null) {
            label += String.format(Locale.ROOT, " | rerank %.2f", chunk.rerankScore());
        }
        return label;
    }

    static String locator(RetrievedChunk chunk) {
        String unit = chunk.unitName() != null ? chunk.unitName() : "unknown";
        return chunk.rowId() != null ? unit + "#" + chunk.rowId() : unit;
    }

    private static String formatRow(Map<String, Object> row) {
        StringJoiner fields = new StringJoiner(", ");
        row.forEach((key, value) -> fields.add(key + "=" + value));
        return fields.toString();
    }
}
