package com.jreinhal.zerag.migration;

import com.jreinhal.zerag.cache.SourceVersionRegistry;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.model.SyncState;
import com.jreinhal.zerag.repository.DataSourceRepository;
import com.jreinhal.zerag.vector.ChunkVectorStore;
import com.jreinhal.zerag.vector.EmbeddingService;
import com.mongodb.client.result.UpdateResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Clears stored vectors written with a different embedding dimension than the current model's,
 * and marks every data source for re-sync.
 */
@Service
public class EmbeddingDimensionMigrationService {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingDimensionMigrationService.class);

    static final String MIGRATION_COLLECTION = "system_migrations";
    static final String RESYNC_MESSAGE = "re-sync required: embedding dimension changed";

    private final MongoTemplate mongoTemplate;
    private final ChunkVectorStore vectorStore;
    private final EmbeddingService embeddingService;
    private final DataSourceRepository dataSourceRepository;
    private final SourceVersionRegistry versions;

    public EmbeddingDimensionMigrationService(MongoTemplate mongoTemplate, ChunkVectorStore vectorStore,
                                              EmbeddingService embeddingService,
                                              DataSourceRepository dataSourceRepository,
                                              SourceVersionRegistry versions) {
        this.mongoTemplate = mongoTemplate;
        this.vectorStore = vectorStore;
        this.embeddingService = embeddingService;
        this.dataSourceRepository = dataSourceRepository;
        this.versions = versions;
    }

    public void markCompleted(MigrationResult result) {
        Query query = new Query(Criteria.where("_id").is(migrationId(result.targetDimension())));
        Update update = new Update()
                .set("completedAtEpochMs", System.currentTimeMillis())
                .set("completedAtIso", Instant.now().toString())
                .set("result", Map.of(
                        "storedDimensions", result.storedDimensions(),
                        "targetDimension", result.targetDimension(),
                        "deletedVectors", result.deletedVectors(),
                        "resetSources", result.resetSources()
                ))
                .setOnInsert("createdAtEpochMs", System.currentTimeMillis());
        this.mongoTemplate.upsert(query, update, MIGRATION_COLLECTION);
    }

    public MigrationResult migrate(boolean dryRun) {
        int target = this.embeddingService.dimension();
        List<Integer> stored = this.vectorStore.storedDimensions();
        boolean mismatch = stored.stream().anyMatch(d -> d == null || d != target);
        if (!mismatch) {
            log.info("Embedding dimension migration: stored={} target={} nothing to do", stored, target);
            return new MigrationResult(stored, target, false, 0L, 0L, dryRun);
        }
        if (dryRun) {
            long vectors = this.vectorStore.countVectors(null);
            long sources = this.dataSourceRepository.count();
            log.info("Embedding dimension migration dry-run: stored={} target={} would delete {} vectors and reset {} sources",
                    stored, target, vectors, sources);
            return new MigrationResult(stored, target, true, vectors, sources, true);
        }

        long deleted = this.vectorStore.deleteAll();
        Update reset = new Update()
                .set("syncState", SyncState.PENDING)
                .set("syncProgress", 0)
                .set("syncError", RESYNC_MESSAGE);
        UpdateResult updated = this.mongoTemplate.updateMulti(new Query(), reset, DataSource.class);
        for (DataSource source : this.dataSourceRepository.findAll()) {
            this.versions.bump(source.getId());
        }
        log.warn("Embedding dimension migration: stored={} target={} deleted {} vectors, {} sources need re-sync",
                stored, target, deleted, updated.getModifiedCount());
        return new MigrationResult(stored, target, true, deleted, updated.getModifiedCount(), false);
    }

    private static String migrationId(int targetDimension) {
        return "embedding_dimension_" + targetDimension;
    }

    public record MigrationResult(
            List<Integer> storedDimensions,
            int targetDimension,
            boolean mismatch,
            long deletedVectors,
            long resetSources,
            boolean dryRun) {
    }
}
