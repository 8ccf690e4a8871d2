package com.jreinhal.zerag.vector;

import com.jreinhal.zerag.cache.EmbeddingCache;
import com.jreinhal.zerag.exception.EmbeddingDimensionMismatchException;
import com.jreinhal.zerag.exception.EmbeddingException;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Front door to the embedding model. Batch embedding (sync) bypasses the cache; single query
 * embedding goes through {@link EmbeddingCache}.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;
    private final EmbeddingCache embeddingCache;

    @Value("${zerag.embedding.batch-size:64}")
    private int batchSize;

    // 0 accepts whatever the model produces
    @Value("${zerag.embedding.dimension:0}")
    private int configuredDimension;

    public EmbeddingService(EmbeddingModel embeddingModel, EmbeddingCache embeddingCache) {
        this.embeddingModel = embeddingModel;
        this.embeddingCache = embeddingCache;
    }

    @PostConstruct
    public void init() {
        log.info("Embedding service initialized (batchSize={}, dimension={})", this.batchSize,
                this.configuredDimension > 0 ? this.configuredDimension : "model-defined");
    }

    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        int size = Math.max(1, this.batchSize);
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += size) {
            List<String> batch = texts.subList(start, Math.min(start + size, texts.size()));
            List<float[]> embedded;
            try {
                embedded = this.embeddingModel.embed(batch);
            }
            catch (RuntimeException e) {
                throw new EmbeddingException("Embedding batch failed: " + e.getMessage(), e);
            }
            if (embedded == null || embedded.size() != batch.size()) {
                throw new EmbeddingException("Embedding model returned " + (embedded == null ? 0 : embedded.size())
                        + " vectors for " + batch.size() + " texts");
            }
            for (float[] vector : embedded) {
                this.checkDimension(vector);
                vectors.add(vector);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Embedded {} texts in batches of {}", texts.size(), size);
        }
        return vectors;
    }

    public float[] embedQuery(String text) {
        float[] vector = this.embeddingCache.getOrCompute(text, this::embedSingle);
        this.checkDimension(vector);
        return vector;
    }

    /**
     * Dimension vectors are expected to have: the configured one, else the model's own.
     */
    public int dimension() {
        if (this.configuredDimension > 0) {
            return this.configuredDimension;
        }
        return this.embeddingModel.dimensions();
    }

    private float[] embedSingle(String text) {
        try {
            return this.embeddingModel.embed(text);
        }
        catch (RuntimeException e) {
            throw new EmbeddingException("Query embedding failed: " + e.getMessage(), e);
        }
    }

    private void checkDimension(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector");
        }
        if (this.configuredDimension > 0 && vector.length != this.configuredDimension) {
            throw new EmbeddingDimensionMismatchException(this.configuredDimension, vector.length);
        }
    }
}
