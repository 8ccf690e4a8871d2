package com.jreinhal.zerag.service;

import com.jreinhal.zerag.cache.SourceVersionRegistry;
import com.jreinhal.zerag.chunking.ChunkStrategy;
import com.jreinhal.zerag.connectors.SourceConnector;
import com.jreinhal.zerag.connectors.SourceConnectorFactory;
import com.jreinhal.zerag.exception.DataSourceNotFoundException;
import com.jreinhal.zerag.exception.SyncInProgressException;
import com.jreinhal.zerag.extraction.TextExtractor;
import com.jreinhal.zerag.lexical.LexicalIndexService;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.model.SourceKind;
import com.jreinhal.zerag.model.SyncState;
import com.jreinhal.zerag.repository.DataSourceRepository;
import com.jreinhal.zerag.repository.DocumentChunkRepository;
import com.jreinhal.zerag.sync.SyncService;
import com.jreinhal.zerag.util.LogSanitizer;
import com.jreinhal.zerag.vector.ChunkVectorStore;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Lifecycle of data sources: create, read, update, delete with cascade, connection checks and
 * the uploaded-file bookkeeping of file sources.
 */
@Service
public class DataSourceService {

    private static final Logger log = LoggerFactory.getLogger(DataSourceService.class);

    private final DataSourceRepository repository;
    private final DocumentChunkRepository chunkRepository;
    private final ChunkVectorStore vectorStore;
    private final LexicalIndexService lexicalIndex;
    private final SourceVersionRegistry versions;
    private final SourceConnectorFactory connectorFactory;
    private final SyncService syncService;
    private final MongoTemplate mongoTemplate;

    @Value("${zerag.files.upload-dir:uploads}")
    private String uploadDir = "uploads";

    public DataSourceService(DataSourceRepository repository, DocumentChunkRepository chunkRepository,
                             ChunkVectorStore vectorStore, LexicalIndexService lexicalIndex,
                             SourceVersionRegistry versions, SourceConnectorFactory connectorFactory,
                             SyncService syncService, MongoTemplate mongoTemplate) {
        this.repository = repository;
        this.chunkRepository = chunkRepository;
        this.vectorStore = vectorStore;
        this.lexicalIndex = lexicalIndex;
        this.versions = versions;
        this.connectorFactory = connectorFactory;
        this.syncService = syncService;
        this.mongoTemplate = mongoTemplate;
    }

    @PostConstruct
    public void init() {
        log.info("Data source service initialized (uploadDir={})", Path.of(this.uploadDir).toAbsolutePath());
    }

    public DataSource create(DataSource request, String ownerId) {
        validate(request);
        DataSource source = new DataSource(request.getName().strip(), request.getKind());
        this.copyDescriptor(request, source, new Update());
        source.setOwnerId(ownerId);
        source.setSyncState(SyncState.PENDING);
        source.setCreatedAt(Instant.now());
        DataSource saved = this.repository.save(source);
        if (saved.isFileBacked()) {
            Path dir = this.storageDir(saved.getId());
            try {
                Files.createDirectories(dir);
            }
            catch (IOException e) {
                throw new UncheckedIOException("Could not create storage directory for data source " + saved.getId(), e);
            }
            saved.setFileStoreDir(dir.toString());
            this.patch(saved.getId(), new Update().set("fileStoreDir", saved.getFileStoreDir()));
        }
        log.info("Data source {} created ({}, owner={})", saved.getId(), saved.getKind(), ownerId);
        return saved;
    }

    /**
     * Newest first. Admins see every source, other callers only their own.
     */
    public List<DataSource> list(String userId, boolean admin) {
        if (admin || userId == null) {
            return this.repository.findAllByOrderByCreatedAtDesc();
        }
        return this.repository.findByOwnerIdOrderByCreatedAtDesc(userId);
    }

    public DataSource get(String id) {
        return this.repository.findById(id).orElseThrow(() -> new DataSourceNotFoundException(id));
    }

    /**
     * Applies the non-null fields of {@code patch}. Kind, owner and sync state never change here;
     * only the changed fields are written, so a sync finishing meanwhile keeps its outcome.
     */
    public DataSource update(String id, DataSource patch) {
        DataSource source = this.get(id);
        Update changes = new Update();
        if (patch.getName() != null) {
            if (patch.getName().isBlank()) {
                throw new IllegalArgumentException("Data source name must not be blank");
            }
            source.setName(patch.getName().strip());
            changes.set("name", source.getName());
        }
        this.copyDescriptor(patch, source, changes);
        if (!changes.getUpdateObject().isEmpty()) {
            this.patch(id, changes);
        }
        return source;
    }

    /**
     * Removes the source with its chunks, vectors and stored files.
     *
     * @throws SyncInProgressException while a sync of the source is running
     */
    public void delete(String id) {
        DataSource source = this.get(id);
        if (source.getSyncState() == SyncState.SYNCING || this.syncService.isSyncing(id)) {
            throw new SyncInProgressException(id);
        }
        long chunks = this.chunkRepository.deleteByDataSourceId(id);
        long vectors = this.vectorStore.deleteBySource(id);
        if (source.isFileBacked()) {
            try {
                FileSystemUtils.deleteRecursively(this.storageDir(id));
            }
            catch (IOException e) {
                log.warn("Could not remove stored files of data source {}: {}", id, e.getMessage());
            }
        }
        this.repository.deleteById(id);
        this.lexicalIndex.invalidate(id);
        this.versions.bump(id);
        log.info("Data source {} deleted ({} chunks, {} vectors)", id, chunks, vectors);
    }

    /**
     * File sources: the storage directory exists. Database sources: a {@code SELECT 1} round trip.
     * Web sources have nothing to check.
     */
    public boolean testConnection(String id) {
        DataSource source = this.get(id);
        if (source.isFileBacked()) {
            return Files.isDirectory(this.storageDir(id));
        }
        if (!source.getKind().isDatabase()) {
            return true;
        }
        try (SourceConnector connector = this.connectorFactory.create(source)) {
            connector.connect();
            return connector.testConnection();
        }
        catch (RuntimeException e) {
            log.warn("Connection test failed for data source {}: {}", id, e.getMessage());
            return false;
        }
    }

    /**
     * Stores the file under the source's directory, replacing a same-name upload.
     */
    public DataSource addUploadedFile(String id, String filename, byte[] content) {
        DataSource source = this.requireFileSource(id);
        String name = safeFilename(filename);
        if (!TextExtractor.isSupported(name)) {
            throw new IllegalArgumentException("Unsupported file type: " + name);
        }
        Path dir = this.storageDir(id);
        Path target = dir.resolve(name);
        try {
            Files.createDirectories(dir);
            Files.write(target, content);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Could not store upload for data source " + id, e);
        }
        List<DataSource.UploadedFile> files = new ArrayList<>(source.getUploadedFiles());
        files.removeIf(f -> name.equals(f.getFilename()));
        files.add(new DataSource.UploadedFile(name, target.toString(), content.length));
        source.setUploadedFiles(files);
        source.setFileStoreDir(dir.toString());
        this.patch(id, new Update().set("uploadedFiles", files).set("fileStoreDir", source.getFileStoreDir()));
        log.info("Stored upload '{}' ({} bytes) for data source {}", LogSanitizer.sanitize(name), content.length, id);
        return source;
    }

    public DataSource removeUploadedFile(String id, String filename) {
        DataSource source = this.requireFileSource(id);
        String name = safeFilename(filename);
        List<DataSource.UploadedFile> files = new ArrayList<>(source.getUploadedFiles());
        if (!files.removeIf(f -> name.equals(f.getFilename()))) {
            throw new IllegalArgumentException("No uploaded file named " + name);
        }
        try {
            Files.deleteIfExists(this.storageDir(id).resolve(name));
        }
        catch (IOException e) {
            log.warn("Could not delete stored file '{}' of data source {}: {}", LogSanitizer.sanitize(name), id, e.getMessage());
        }
        source.setUploadedFiles(files);
        this.patch(id, new Update().set("uploadedFiles", files));
        return source;
    }

    Path storageDir(String id) {
        return Path.of(this.uploadDir, "ds_" + id);
    }

    private DataSource requireFileSource(String id) {
        DataSource source = this.get(id);
        if (!source.isFileBacked()) {
            throw new IllegalArgumentException("Data source " + id + " does not accept file uploads");
        }
        return source;
    }

    private void patch(String id, Update changes) {
        this.mongoTemplate.updateFirst(Query.query(Criteria.where("id").is(id)), changes, DataSource.class);
    }

    private void copyDescriptor(DataSource from, DataSource to, Update changes) {
        if (from.getHost() != null) {
            to.setHost(from.getHost());
            changes.set("host", to.getHost());
        }
        if (from.getPort() != null) {
            to.setPort(from.getPort());
            changes.set("port", to.getPort());
        }
        if (from.getDatabaseName() != null) {
            to.setDatabaseName(from.getDatabaseName());
            changes.set("databaseName", to.getDatabaseName());
        }
        if (from.getUsername() != null) {
            to.setUsername(from.getUsername());
            changes.set("username", to.getUsername());
        }
        if (from.getPassword() != null && !from.getPassword().isBlank()) {
            to.setPassword(from.getPassword());
            changes.set("password", to.getPassword());
        }
        if (from.getSqlitePath() != null) {
            to.setSqlitePath(from.getSqlitePath());
            changes.set("sqlitePath", to.getSqlitePath());
        }
        if (from.getTablesConfig() != null && !from.getTablesConfig().isEmpty()) {
            to.setTablesConfig(from.getTablesConfig());
            changes.set("tablesConfig", to.getTablesConfig());
        }
        if (from.getWebUrls() != null && !from.getWebUrls().isEmpty()) {
            to.setWebUrls(from.getWebUrls());
            changes.set("webUrls", to.getWebUrls());
        }
        if (from.getChunkStrategy() != null) {
            to.setChunkStrategy(from.getChunkStrategy());
            changes.set("chunkStrategy", to.getChunkStrategy());
        }
    }

    private static void validate(DataSource request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Data source name is required");
        }
        SourceKind kind = request.getKind();
        if (kind == null) {
            throw new IllegalArgumentException("Data source kind is required");
        }
        if (kind == SourceKind.SQLITE && (request.getSqlitePath() == null || request.getSqlitePath().isBlank())) {
            throw new IllegalArgumentException("SQLite sources need a database file path");
        }
        ChunkStrategy.fromString(request.getChunkStrategy(), kind.defaultStrategy());
        if ((kind == SourceKind.MYSQL || kind == SourceKind.POSTGRESQL)
                && (request.getHost() == null || request.getDatabaseName() == null)) {
            throw new IllegalArgumentException("Database sources need a host and a database name");
        }
    }

    private static String safeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("File name is required");
        }
        String name = Path.of(filename.strip()).getFileName().toString();
        if (name.equals("..") || name.equals(".")) {
            throw new IllegalArgumentException("Invalid file name");
        }
        return name;
    }
}
