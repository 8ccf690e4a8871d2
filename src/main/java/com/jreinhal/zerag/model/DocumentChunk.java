package com.jreinhal.zerag.model;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A retrieval-sized passage of one source unit. {@code unitName} is the table name for
 * database rows, the file name for uploads and the URL for web pages; {@code rowId} is the
 * row key (or the chunk ordinal for documents).
 */
@Document(collection = "document_chunks")
public class DocumentChunk {

    @Id
    private String id;
    @Indexed
    private String dataSourceId;
    private String unitName;
    private String rowId;
    private int chunkIndex;
    private String text;
    private Map<String, Object> metadata = new HashMap<>();
    private Instant createdAt;

    public DocumentChunk() {
    }

    public DocumentChunk(String dataSourceId, String unitName, String rowId, int chunkIndex, String text,
                         Map<String, Object> metadata) {
        this.dataSourceId = dataSourceId;
        this.unitName = unitName;
        this.rowId = rowId;
        this.chunkIndex = chunkIndex;
        this.text = text;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.createdAt = Instant.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getDataSourceId() { return dataSourceId; }
    public void setDataSourceId(String dataSourceId) { this.dataSourceId = dataSourceId; }

    public String getUnitName() { return unitName; }
    public void setUnitName(String unitName) { this.unitName = unitName; }

    public String getRowId() { return rowId; }
    public void setRowId(String rowId) { this.rowId = rowId; }

    public int getChunkIndex() { return chunkIndex; }
    public void setChunkIndex(int chunkIndex) { this.chunkIndex = chunkIndex; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public Map<String, Object> getMetadata() { return metadata; }
    public void setMetadata(Map<String, Object> metadata) { this.metadata = metadata; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
