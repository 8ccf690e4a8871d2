package com.jreinhal.zerag.vector;

import com.jreinhal.zerag.dto.RetrievedChunk;
import com.jreinhal.zerag.model.ChunkVector;
import com.jreinhal.zerag.model.DocumentChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

/**
 * Reads and writes chunk embeddings in MongoDB and answers cosine-similarity searches in
 * memory, prefiltered by data source. An absent data source id means a global search.
 */
@Component
public class ChunkVectorStore {

    private static final Logger log = LoggerFactory.getLogger(ChunkVectorStore.class);
    static final String VECTOR_COLLECTION = "document_vectors";
    static final String CHUNK_COLLECTION = "document_chunks";

    private final MongoTemplate mongoTemplate;
    private final EmbeddingService embeddingService;

    public ChunkVectorStore(MongoTemplate mongoTemplate, EmbeddingService embeddingService) {
        this.mongoTemplate = mongoTemplate;
        this.embeddingService = embeddingService;
    }

    /**
     * Persists one vector per chunk. Chunks and vectors are matched by position.
     */
    public int saveVectors(List<DocumentChunk> chunks, List<float[]> embeddings) {
        if (chunks.size() != embeddings.size()) {
            throw new IllegalArgumentException("Chunk/vector count mismatch: " + chunks.size() + " vs " + embeddings.size());
        }
        if (chunks.isEmpty()) {
            return 0;
        }
        List<ChunkVector> vectors = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            DocumentChunk chunk = chunks.get(i);
            List<Double> embedding = toList(embeddings.get(i));
            vectors.add(new ChunkVector(chunk.getId(), chunk.getDataSourceId(), embedding, computeNorm(embedding)));
        }
        this.mongoTemplate.insert(vectors, ChunkVector.class);
        return vectors.size();
    }

    public List<RetrievedChunk> searchText(String text, String dataSourceId, int topK) {
        return this.search(this.embeddingService.embedQuery(text), dataSourceId, topK);
    }

    public List<RetrievedChunk> search(float[] queryVector, String dataSourceId, int topK) {
        if (topK <= 0 || queryVector == null || queryVector.length == 0) {
            return List.of();
        }
        Query scope = scopeQuery(dataSourceId);
        List<ChunkVector> vectors = this.mongoTemplate.find(scope, ChunkVector.class);
        if (vectors.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("No vectors in scope {}, skipping similarity search", dataSourceId != null ? dataSourceId : "global");
            }
            return List.of();
        }
        double queryNorm = computeNorm(queryVector);
        List<Scored> ranked = vectors.stream()
                .map(v -> new Scored(v, cosineSimilarity(queryVector, queryNorm, v.getEmbedding(), v.getEmbeddingNorm())))
                .sorted(Comparator.comparingDouble(Scored::score).reversed())
                .limit(topK)
                .toList();
        Map<String, DocumentChunk> chunksById = this.loadChunks(ranked.stream().map(s -> s.vector().getChunkId()).toList());
        List<RetrievedChunk> results = new ArrayList<>(ranked.size());
        for (Scored scored : ranked) {
            DocumentChunk chunk = chunksById.get(scored.vector().getChunkId());
            if (chunk == null) {
                // vector outlived its chunk; the next sync cleans it up
                continue;
            }
            results.add(RetrievedChunk.vector(chunk.getId(), chunk.getDataSourceId(), chunk.getUnitName(),
                    chunk.getRowId(), chunk.getText(), scored.score()));
        }
        return results;
    }

    public long countVectors(String dataSourceId) {
        return this.mongoTemplate.count(scopeQuery(dataSourceId), ChunkVector.class);
    }

    public long deleteBySource(String dataSourceId) {
        return this.mongoTemplate.remove(scopeQuery(dataSourceId), ChunkVector.class).getDeletedCount();
    }

    public long deleteAll() {
        return this.mongoTemplate.remove(new Query(), ChunkVector.class).getDeletedCount();
    }

    /**
     * Distinct stored vector dimensions across all sources.
     */
    public List<Integer> storedDimensions() {
        return this.mongoTemplate.findDistinct(new Query(), "dimension", VECTOR_COLLECTION, Integer.class);
    }

    private Map<String, DocumentChunk> loadChunks(List<String> chunkIds) {
        Map<String, DocumentChunk> byId = new LinkedHashMap<>();
        if (chunkIds.isEmpty()) {
            return byId;
        }
        Query query = new Query(Criteria.where("_id").in(chunkIds));
        for (DocumentChunk chunk : this.mongoTemplate.find(query, DocumentChunk.class, CHUNK_COLLECTION)) {
            byId.put(chunk.getId(), chunk);
        }
        return byId;
    }

    private static Query scopeQuery(String dataSourceId) {
        return dataSourceId != null ? new Query(Criteria.where("dataSourceId").is(dataSourceId)) : new Query();
    }

    /**
     * Cosine similarity clamped into [0, 1]. Mismatched or zero vectors score 0.
     */
    static double cosineSimilarity(float[] query, double queryNorm, List<Double> stored, Double storedNorm) {
        if (query == null || stored == null || query.length == 0 || query.length != stored.size()) {
            return 0.0;
        }
        double docNorm = storedNorm != null ? storedNorm : computeNorm(stored);
        if (queryNorm == 0.0 || docNorm == 0.0) {
            return 0.0;
        }
        double dot = 0.0;
        for (int i = 0; i < query.length; i++) {
            dot += (double) query[i] * stored.get(i);
        }
        double cosine = dot / (Math.sqrt(queryNorm) * Math.sqrt(docNorm));
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    static double computeNorm(float[] embedding) {
        double sum = 0.0;
        for (float f : embedding) {
            sum += (double) f * (double) f;
        }
        return sum;
    }

    static double computeNorm(List<Double> embedding) {
        double sum = 0.0;
        for (Double value : embedding) {
            if (value != null) {
                sum += value * value;
            }
        }
        return sum;
    }

    private static List<Double> toList(float[] embedding) {
        List<Double> values = new ArrayList<>(embedding.length);
        for (float f : embedding) {
            values.add((double) f);
        }
        return values;
    }

    private record Scored(ChunkVector vector, double score) {
    }
}
