package com.jreinhal.zerag.model;

import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Dense embedding of exactly one {@link DocumentChunk}. The squared norm is stored so query-time
 * cosine only has to compute the dot product.
 */
@Document(collection = "document_vectors")
public class ChunkVector {

    @Id
    private String id;
    @Indexed(unique = true)
    private String chunkId;
    @Indexed
    private String dataSourceId;
    private List<Double> embedding;
    private Double embeddingNorm;
    private int dimension;

    public ChunkVector() {
    }

    public ChunkVector(String chunkId, String dataSourceId, List<Double> embedding, double embeddingNorm) {
        this.chunkId = chunkId;
        this.dataSourceId = dataSourceId;
        this.embedding = embedding;
        this.embeddingNorm = embeddingNorm;
        this.dimension = embedding != null ? embedding.size() : 0;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getChunkId() { return chunkId; }
    public void setChunkId(String chunkId) { this.chunkId = chunkId; }

    public String getDataSourceId() { return dataSourceId; }
    public void setDataSourceId(String dataSourceId) { this.dataSourceId = dataSourceId; }

    public List<Double> getEmbedding() { return embedding; }
    public void setEmbedding(List<Double> embedding) { this.embedding = embedding; }

    public Double getEmbeddingNorm() { return embeddingNorm; }
    public void setEmbeddingNorm(Double embeddingNorm) { this.embeddingNorm = embeddingNorm; }

    public int getDimension() { return dimension; }
    public void setDimension(int dimension) { this.dimension = dimension; }
}
