package com.jreinhal.zerag.rag.fusion;

import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.lexical.LexicalIndexService;
import com.jreinhal.zerag.rag.expansion.QueryExpansion;
import com.jreinhal.zerag.rag.hyde.HydeService;
import com.jreinhal.zerag.rag.rerank.CrossEncoderReranker;
import com.jreinhal.zerag.reasoning.ReasoningStep.StepType;
import com.jreinhal.zerag.reasoning.ReasoningTrace;
import com.jreinhal.zerag.util.LogSanitizer;
import com.jreinhal.zerag.vector.ChunkVectorStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every retrieval path for one question and fuses the results into the final passages.
 * <p>
 * Vector paths (question, up to two paraphrases, HyDE) are deduplicated in that order. The
 * lexical path runs independently. Lexical hits are merged first and outrank vector hits;
 * within a group candidates sort by similarity, stable on ties. The pool is then reranked
 * down to {@code topK}, or simply cut if reranking is off or fails.
 */
@Service
public class RetrievalFusionService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalFusionService.class);
    private static final int MAX_VARIANTS = 2;

    private final ChunkVectorStore vectorStore;
    private final LexicalIndexService lexicalIndex;
    private final HydeService hydeService;
    private final CrossEncoderReranker reranker;

    public RetrievalFusionService(ChunkVectorStore vectorStore, LexicalIndexService lexicalIndex, HydeService hydeService,
                                  CrossEncoderReranker reranker) {
        this.vectorStore = vectorStore;
        this.lexicalIndex = lexicalIndex;
        this.hydeService = hydeService;
        this.reranker = reranker;
    }

    public FusionResult retrieve(String question, QueryExpansion expansion, String dataSourceId, int topK,
                                 boolean hydeEnabled, ReasoningTrace trace) {
        int poolSize = this.reranker.candidatePoolSize(topK);

        long start = System.currentTimeMillis();
        Map<String, RetrievedChunk> vectorHits = new LinkedHashMap<>();
        addAbsent(vectorHits, this.vectorStore.searchText(question, dataSourceId, poolSize));
        List<String> variants = expansion.variants(question, MAX_VARIANTS);
        for (String variant : variants) {
            addAbsent(vectorHits, this.vectorStore.searchText(variant, dataSourceId, poolSize));
        }
        trace.addStep(StepType.VECTOR_SEARCH, "Vector search", (1 + variants.size()) + " queries, "
                + vectorHits.size() + " unique hits", System.currentTimeMillis() - start,
                Map.of("variants", variants.size(), "hits", vectorHits.size()));

        if (hydeEnabled) {
            start = System.currentTimeMillis();
            HydeService.HydeResult hyde = this.hydeService.retrieve(question, expansion.hydeHint(), dataSourceId, poolSize);
            int before = vectorHits.size();
            addAbsent(vectorHits, hyde.chunks());
            trace.addStep(StepType.HYDE, "HyDE retrieval", hyde.applied()
                    ? (vectorHits.size() - before) + " new hits" : "skipped after failure", System.currentTimeMillis() - start);
        }

        start = System.currentTimeMillis();
        List<RetrievedChunk> lexicalHits = this.lexicalSearch(expansion, dataSourceId, poolSize);
        trace.addStep(StepType.LEXICAL_SEARCH, dataSourceId != null ? "BM25 search" : "Keyword search",
                lexicalHits.size() + " hits", System.currentTimeMillis() - start, Map.of("hits", lexicalHits.size()));

        List<RetrievedChunk> pool = merge(lexicalHits, new ArrayList<>(vectorHits.values()), poolSize);
        double maxVectorSimilarity = maxVectorSimilarity(pool);
        trace.addStep(StepType.FUSION, "Merge", pool.size() + " candidates", 0L,
                Map.of("candidates", pool.size(), "maxSimilarity", Math.round(maxVectorSimilarity * 1000.0) / 1000.0,
                        "lexicalHits", lexicalHits.size()));
        if (log.isDebugEnabled()) {
            log.debug("Fused {} candidates for {} on {} (max vector similarity {})", pool.size(),
                    LogSanitizer.querySummary(question), dataSourceId, maxVectorSimilarity);
        }

        List<RetrievedChunk> finalChunks = this.rerank(question, pool, topK, dataSourceId, trace);
        return new FusionResult(finalChunks, lexicalHits.size(), maxVectorSimilarity);
    }

    private List<RetrievedChunk> lexicalSearch(QueryExpansion expansion, String dataSourceId, int poolSize) {
        if (dataSourceId == null) {
            return this.lexicalIndex.substringSearch(expansion.keywords(), null, poolSize * 2);
        }
        try {
            return this.lexicalIndex.search(expansion.lexicalQuery(), dataSourceId, poolSize);
        }
        catch (RuntimeException e) {
            log.warn("BM25 search failed for data source {}, using substring match: {}", dataSourceId, e.getMessage());
            return this.lexicalIndex.substringSearch(expansion.keywords(), dataSourceId, poolSize * 2);
        }
    }

    private List<RetrievedChunk> rerank(String question, List<RetrievedChunk> pool, int topK, String dataSourceId,
                                        ReasoningTrace trace) {
        if (!this.reranker.isEnabled() || pool.isEmpty()) {
            return truncate(pool, topK);
        }
        long start = System.currentTimeMillis();
        try {
            List<RetrievedChunk> reranked = this.reranker.rerank(question, pool, topK);
            trace.addStep(StepType.RERANK, "Rerank", pool.size() + " -> " + reranked.size(),
                    System.currentTimeMillis() - start);
            return reranked;
        }
        catch (RuntimeException e) {
            log.error("Reranker failed for '{}' on data source {}, keeping fusion order: {}", LogSanitizer.prefix(question),
                    dataSourceId, e.getMessage());
            trace.addStep(StepType.ERROR, "Rerank (failed)", e.getMessage(), System.currentTimeMillis() - start);
            return truncate(pool, topK);
        }
    }

    /**
     * Lexical hits first, then unseen vector hits; sorted lexical-before-vector and by
     * similarity, then cut to {@code limit}.
     */
    static List<RetrievedChunk> merge(List<RetrievedChunk> lexicalHits, List<RetrievedChunk> vectorHits, int limit) {
        Map<String, RetrievedChunk> merged = new LinkedHashMap<>();
        addAbsent(merged, lexicalHits);
        addAbsent(merged, vectorHits);
        return merged.values().stream()
                .sorted(Comparator.comparingInt((RetrievedChunk c) -> c.source() != null && c.source().isVectorBased() ? 0 : 1)
                        .thenComparingDouble(RetrievedChunk::similarity)
                        .reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Best similarity among vector-sourced candidates only; 0 when there are none.
     */
    static double maxVectorSimilarity(List<RetrievedChunk> candidates) {
        return candidates.stream()
                .filter(c -> c.source() != null && c.source().isVectorBased())
                .mapToDouble(RetrievedChunk::similarity)
                .max()
                .orElse(0.0);
    }

    private static void addAbsent(Map<String, RetrievedChunk> target, List<RetrievedChunk> hits) {
        for (RetrievedChunk hit : hits) {
            target.putIfAbsent(hit.chunkId(), hit);
        }
    }

    private static List<RetrievedChunk> truncate(List<RetrievedChunk> chunks, int limit) {
        return chunks.size() <= limit ? chunks : List.copyOf(chunks.subList(0, limit));
    }

    public record FusionResult(List<RetrievedChunk> chunks, int lexicalHitCount, double maxVectorSimilarity) {
    }
}
