package com.jreinhal.zerag.sync;

import com.jreinhal.zerag.cache.SourceVersionRegistry;
import com.jreinhal.zerag.chunking.ChunkStrategy;
import com.jreinhal.zerag.chunking.TextChunker;
import com.jreinhal.zerag.connectors.SourceConnector;
import com.jreinhal.zerag.connectors.SourceConnectorFactory;
import com.jreinhal.zerag.dto.SyncStatus;
import com.jreinhal.zerag.exception.DataSourceNotFoundException;
import com.jreinhal.zerag.exception.ExtractionException;
import com.jreinhal.zerag.exception.SourceConnectorException;
import com.jreinhal.zerag.exception.SyncInProgressException;
import com.jreinhal.zerag.extraction.TextExtractor;
import com.jreinhal.zerag.lexical.LexicalIndexService;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.model.DocumentChunk;
import com.jreinhal.zerag.model.SyncState;
import com.jreinhal.zerag.repository.DataSourceRepository;
import com.jreinhal.zerag.repository.DocumentChunkRepository;
import com.jreinhal.zerag.util.LogSanitizer;
import com.jreinhal.zerag.vector.ChunkVectorStore;
import com.jreinhal.zerag.vector.EmbeddingService;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the chunks and vectors of one data source in the background.
 *
 * <p>State moves {@code PENDING/SYNCED/ERROR -> SYNCING -> SYNCED | ERROR}. Progress is 0 on
 * entry, 5 once acquisition starts, climbs through 10..90 as units complete and ends at 100.
 * A failure resets it to 0. Whatever the outcome, the lexical index of the source is dropped
 * and its version bumped once the run ends.</p>
 *
 * <p>The background task loads its own copy of the data source and writes status through
 * field-level updates, so nothing from the triggering request is shared with it.</p>
 */
@Service
public class SyncService {

    private static final Logger log = LoggerFactory.getLogger(SyncService.class);

    static final int PROGRESS_ACQUIRING = 5;
    static final int PROGRESS_UNITS_START = 10;
    static final int PROGRESS_UNITS_SPAN = 80;
    static final int PROGRESS_DONE = 100;
    static final String INTERRUPTED_MESSAGE = "sync interrupted before completion; start a new sync";

    private final DataSourceRepository dataSourceRepository;
    private final DocumentChunkRepository chunkRepository;
    private final ChunkVectorStore vectorStore;
    private final EmbeddingService embeddingService;
    private final TextChunker chunker;
    private final TextExtractor extractor;
    private final SourceConnectorFactory connectorFactory;
    private final LexicalIndexService lexicalIndex;
    private final SourceVersionRegistry versions;
    private final MongoTemplate mongoTemplate;
    private final ExecutorService executor;

    private final Set<String> activeSyncs = ConcurrentHashMap.newKeySet();

    public SyncService(DataSourceRepository dataSourceRepository, DocumentChunkRepository chunkRepository,
                       ChunkVectorStore vectorStore, EmbeddingService embeddingService, TextChunker chunker,
                       TextExtractor extractor, SourceConnectorFactory connectorFactory, LexicalIndexService lexicalIndex,
                       SourceVersionRegistry versions, MongoTemplate mongoTemplate,
                       @Qualifier("syncExecutor") ExecutorService executor) {
        this.dataSourceRepository = dataSourceRepository;
        this.chunkRepository = chunkRepository;
        this.vectorStore = vectorStore;
        this.embeddingService = embeddingService;
        this.chunker = chunker;
        this.extractor = extractor;
        this.connectorFactory = connectorFactory;
        this.lexicalIndex = lexicalIndex;
        this.versions = versions;
        this.mongoTemplate = mongoTemplate;
        this.executor = executor;
    }

    /**
     * Marks the source {@code SYNCING} and schedules the rebuild. Returns once scheduled.
     *
     * @throws SyncInProgressException when a sync of this source is already running
     */
    public void requestSync(String dataSourceId) {
        DataSource source = this.dataSourceRepository.findById(dataSourceId)
                .orElseThrow(() -> new DataSourceNotFoundException(dataSourceId));
        if (!source.getSyncState().canStartSync() || !this.activeSyncs.add(dataSourceId)) {
            throw new SyncInProgressException(dataSourceId);
        }
        SyncState previousState = source.getSyncState();
        this.updateStatus(dataSourceId, new Update()
                .set("syncState", SyncState.SYNCING)
                .set("syncProgress", 0)
                .set("syncError", null));
        try {
            this.executor.execute(() -> this.runSync(dataSourceId));
        }
        catch (RejectedExecutionException e) {
            this.activeSyncs.remove(dataSourceId);
            this.updateStatus(dataSourceId, new Update().set("syncState", previousState).set("syncProgress", 0));
            throw e;
        }
        log.info("Sync scheduled for data source {} ({})", dataSourceId, source.getKind());
    }

    public SyncStatus syncStatus(String dataSourceId) {
        DataSource source = this.dataSourceRepository.findById(dataSourceId)
                .orElseThrow(() -> new DataSourceNotFoundException(dataSourceId));
        return new SyncStatus(source.getSyncState(), source.getSyncProgress(), source.getSyncError(),
                this.chunkRepository.countByDataSourceId(dataSourceId), source.getLastSyncedAt());
    }

    public boolean isSyncing(String dataSourceId) {
        return this.activeSyncs.contains(dataSourceId);
    }

    /**
     * Body of the background task. Runs on the caller's thread when invoked directly.
     */
    void runSync(String dataSourceId) {
        long start = System.currentTimeMillis();
        try {
            DataSource source = this.dataSourceRepository.findById(dataSourceId)
                    .orElseThrow(() -> new DataSourceNotFoundException(dataSourceId));
            this.updateProgress(dataSourceId, PROGRESS_ACQUIRING);
            this.chunkRepository.deleteByDataSourceId(dataSourceId);
            this.vectorStore.deleteBySource(dataSourceId);

            ChunkStrategy strategy = ChunkStrategy.fromString(source.getChunkStrategy(), source.getKind().defaultStrategy());
            int stored;
            if (source.getKind().isDatabase()) {
                stored = this.syncDatabase(source, strategy);
            }
            else if (source.isFileBacked()) {
                stored = this.syncFiles(source, strategy);
            }
            else {
                stored = this.syncWebPages(source, strategy);
            }

            this.updateStatus(dataSourceId, new Update()
                    .set("syncState", SyncState.SYNCED)
                    .set("syncProgress", PROGRESS_DONE)
                    .set("lastSyncedAt", Instant.now())
                    .set("syncError", null));
            log.info("Sync finished for data source {}: {} chunks in {}ms", dataSourceId, stored,
                    System.currentTimeMillis() - start);
        }
        catch (RuntimeException e) {
            log.error("Sync failed for data source {} after {}ms: {}", dataSourceId, System.currentTimeMillis() - start,
                    e.getMessage(), e);
            this.markFailed(dataSourceId, e);
        }
        catch (Error e) {
            log.error("Sync aborted for data source {} after {}ms: {}", dataSourceId, System.currentTimeMillis() - start,
                    e.toString());
            this.markFailed(dataSourceId, e);
            throw e;
        }
        finally {
            this.lexicalIndex.invalidate(dataSourceId);
            this.versions.bump(dataSourceId);
            this.activeSyncs.remove(dataSourceId);
        }
    }

    private int syncDatabase(DataSource source, ChunkStrategy strategy) {
        int stored = 0;
        try (SourceConnector connector = this.connectorFactory.create(source)) {
            connector.connect();
            List<DataSource.TableConfig> tables = this.resolveTables(source, connector);
            for (int i = 0; i < tables.size(); i++) {
                DataSource.TableConfig table = tables.get(i);
                List<Map<String, Object>> rows;
                try {
                    rows = connector.fetchRows(table.getTable(), table.getColumns());
                }
                catch (SourceConnectorException e) {
                    log.warn("Skipping table '{}' of data source {}: {}", LogSanitizer.sanitize(table.getTable()),
                            source.getId(), e.getMessage());
                    this.updateProgress(source.getId(), unitProgress(i, tables.size()));
                    continue;
                }
                List<DocumentChunk> chunks = new ArrayList<>();
                for (int r = 0; r < rows.size(); r++) {
                    Map<String, Object> row = rows.get(r);
                    String rowId = RowTextFormatter.locator(row, r);
                    List<String> pieces = this.chunker.chunk(RowTextFormatter.format(table.getTable(), row), strategy);
                    for (int p = 0; p < pieces.size(); p++) {
                        chunks.add(new DocumentChunk(source.getId(), table.getTable(), rowId, p, pieces.get(p),
                                Map.of("kind", "row", "table", table.getTable())));
                    }
                }
                stored += this.store(chunks);
                if (log.isDebugEnabled()) {
                    log.debug("Table '{}' of data source {}: {} rows, {} chunks", LogSanitizer.sanitize(table.getTable()),
                            source.getId(), rows.size(), chunks.size());
                }
                this.updateProgress(source.getId(), unitProgress(i, tables.size()));
            }
        }
        return stored;
    }

    private List<DataSource.TableConfig> resolveTables(DataSource source, SourceConnector connector) {
        List<DataSource.TableConfig> configured = source.getTablesConfig();
        if (configured != null && !configured.isEmpty()) {
            return configured;
        }
        List<DataSource.TableConfig> all = new ArrayList<>();
        for (String table : connector.listTables()) {
            all.add(new DataSource.TableConfig(table, null));
        }
        return all;
    }

    private int syncFiles(DataSource source, ChunkStrategy strategy) {
        List<DataSource.UploadedFile> files = source.getUploadedFiles();
        int stored = 0;
        for (int i = 0; i < files.size(); i++) {
            DataSource.UploadedFile file = files.get(i);
            try {
                String text = this.extractor.extractFile(Path.of(file.getPath()));
                stored += this.store(this.documentChunks(source.getId(), file.getFilename(), text, strategy,
                        Map.of("kind", "file", "filename", file.getFilename())));
            }
            catch (ExtractionException e) {
                log.warn("Skipping file '{}' of data source {} ({}): {}", LogSanitizer.sanitize(file.getFilename()),
                        source.getId(), e.getReason(), e.getMessage());
            }
            this.updateProgress(source.getId(), unitProgress(i, files.size()));
        }
        return stored;
    }

    private int syncWebPages(DataSource source, ChunkStrategy strategy) {
        List<String> urls = source.getWebUrls();
        int stored = 0;
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            try {
                String text = this.extractor.extractUrl(url);
                stored += this.store(this.documentChunks(source.getId(), url, text, strategy,
                        Map.of("kind", "web", "url", url)));
            }
            catch (ExtractionException e) {
                log.warn("Skipping page {} of data source {} ({}): {}", LogSanitizer.sanitize(url), source.getId(),
                        e.getReason(), e.getMessage());
            }
            this.updateProgress(source.getId(), unitProgress(i, urls.size()));
        }
        return stored;
    }

    private List<DocumentChunk> documentChunks(String dataSourceId, String unitName, String text, ChunkStrategy strategy,
                                               Map<String, Object> metadata) {
        List<String> pieces = this.chunker.chunk(text, strategy);
        List<DocumentChunk> chunks = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            chunks.add(new DocumentChunk(dataSourceId, unitName, String.valueOf(i), i, pieces.get(i), metadata));
        }
        return chunks;
    }

    /**
     * Saves the chunks, then embeds and stores one vector per chunk. Failures here end the sync.
     */
    private int store(List<DocumentChunk> chunks) {
        if (chunks.isEmpty()) {
            return 0;
        }
        List<DocumentChunk> saved = this.chunkRepository.saveAll(chunks);
        List<float[]> embeddings = this.embeddingService.embedBatch(saved.stream().map(DocumentChunk::getText).toList());
        this.vectorStore.saveVectors(saved, embeddings);
        return saved.size();
    }

    /**
     * Turns sources left in {@code SYNCING} by a previous process into {@code ERROR}, so they can be
     * synced or deleted again. Sources with a sync running in this process are left alone.
     */
    @EventListener(ApplicationReadyEvent.class)
    public long recoverInterruptedSyncs() {
        Criteria orphaned = Criteria.where("syncState").is(SyncState.SYNCING);
        if (!this.activeSyncs.isEmpty()) {
            orphaned = orphaned.and("id").nin(this.activeSyncs);
        }
        long recovered = this.mongoTemplate.updateMulti(Query.query(orphaned), new Update()
                .set("syncState", SyncState.ERROR)
                .set("syncProgress", 0)
                .set("syncError", INTERRUPTED_MESSAGE), DataSource.class).getModifiedCount();
        if (recovered > 0) {
            log.warn("Marked {} interrupted sync(s) as failed", recovered);
        }
        return recovered;
    }

    private void markFailed(String dataSourceId, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            this.updateStatus(dataSourceId, new Update()
                    .set("syncState", SyncState.ERROR)
                    .set("syncProgress", 0)
                    .set("syncError", message));
        }
        catch (RuntimeException e) {
            log.error("Could not record sync failure for data source {}: {}", dataSourceId, e.getMessage());
        }
    }

    private void updateProgress(String dataSourceId, int progress) {
        this.updateStatus(dataSourceId, new Update().set("syncProgress", progress));
    }

    private void updateStatus(String dataSourceId, Update update) {
        this.mongoTemplate.updateFirst(Query.query(Criteria.where("id").is(dataSourceId)), update, DataSource.class);
    }

    static int unitProgress(int index, int total) {
        return PROGRESS_UNITS_START + (PROGRESS_UNITS_SPAN * (index + 1)) / total;
    }
}
