package com.jreinhal.zerag.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.PersistenceCreator;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Immutable audit entry for one answered question.
 */
@Document(collection = "qa_history")
public final class QaRecord {

    public static final String MODE_RAG = "rag";
    public static final String MODE_CHAT = "chat";

    @Id
    private final String id;
    @Indexed
    private final String userId;
    private final String question;
    private final String answer;
    private final String dataSourceId;
    private final String mode;
    private final List<Map<String, Object>> retrievedChunks;
    private final List<Map<String, Object>> trace;
    private final Map<String, Object> settings;
    private final Instant createdAt;

    @PersistenceCreator
    public QaRecord(String id, String userId, String question, String answer, String dataSourceId, String mode,
                    List<Map<String, Object>> retrievedChunks, List<Map<String, Object>> trace,
                    Map<String, Object> settings, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.question = question;
        this.answer = answer;
        this.dataSourceId = dataSourceId;
        this.mode = mode;
        this.retrievedChunks = retrievedChunks != null ? Collections.unmodifiableList(new ArrayList<>(retrievedChunks)) : List.of();
        this.trace = trace != null ? Collections.unmodifiableList(new ArrayList<>(trace)) : List.of();
        this.settings = settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : Map.of();
        this.createdAt = createdAt;
    }

    public static QaRecord create(String userId, String question, String answer, String dataSourceId, String mode,
                                  List<Map<String, Object>> retrievedChunks, List<Map<String, Object>> trace,
                                  Map<String, Object> settings) {
        return new QaRecord(null, userId, question, answer, dataSourceId, mode, retrievedChunks, trace, settings,
                Instant.now());
    }

    public String getId() { return id; }
    public String getUserId() { return userId; }
    public String getQuestion() { return question; }
    public String getAnswer() { return answer; }
    public String getDataSourceId() { return dataSourceId; }
    public String getMode() { return mode; }
    public List<Map<String, Object>> getRetrievedChunks() { return retrievedChunks; }
    public List<Map<String, Object>> getTrace() { return trace; }
    public Map<String, Object> getSettings() { return settings; }
    public Instant getCreatedAt() { return createdAt; }
}
