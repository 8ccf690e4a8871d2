package com.jreinhal.zerag.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One retrieval candidate. {@code similarity} is in [0, 1]; for lexical hits it is the
 * normalized proxy, with the raw score kept in {@code bm25Score}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetrievedChunk(
        String chunkId,
        String dataSourceId,
        String unitName,
        String rowId,
        String text,
        double similarity,
        RetrievalSource source,
        Double bm25Score,
        Double rerankScore) {

    public static RetrievedChunk vector(String chunkId, String dataSourceId, String unitName, String rowId,
                                        String text, double similarity) {
        return new RetrievedChunk(chunkId, dataSourceId, unitName, rowId, text, similarity, RetrievalSource.VECTOR,
                null, null);
    }

    public RetrievedChunk withSource(RetrievalSource newSource) {
        return new RetrievedChunk(chunkId, dataSourceId, unitName, rowId, text, similarity, newSource, bm25Score,
                rerankScore);
    }

    public RetrievedChunk withRerankScore(double score) {
        return new RetrievedChunk(chunkId, dataSourceId, unitName, rowId, text, similarity, source, bm25Score, score);
    }

    /**
     * Provenance summary stored on the audit record.
     */
    public Map<String, Object> toAuditMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("chunkId", chunkId);
        map.put("similarity", similarity);
        map.put("unitName", unitName);
        map.put("rowId", rowId);
        map.put("source", source != null ? source.tag() : null);
        if (rerankScore != null) {
            map.put("rerankScore", rerankScore);
        }
        return map;
    }
}
