package com.jreinhal.zerag.service;

import com.jreinhal.zerag.cache.SourceVersionRegistry;
import com.jreinhal.zerag.connectors.SourceConnectorFactory;
import com.jreinhal.zerag.exception.DataSourceNotFoundException;
import com.jreinhal.zerag.exception.SyncInProgressException;
import com.jreinhal.zerag.lexical.LexicalIndexService;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.model.SourceKind;
import com.jreinhal.zerag.model.SyncState;
import com.jreinhal.zerag.repository.DataSourceRepository;
import com.jreinhal.zerag.repository.DocumentChunkRepository;
import com.jreinhal.zerag.sync.SyncService;
import com.jreinhal.zerag.vector.ChunkVectorStore;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DataSourceServiceTest {

    @TempDir
    Path tempDir;

    private DataSourceRepository repository;
    private DocumentChunkRepository chunkRepository;
    private ChunkVectorStore vectorStore;
    private LexicalIndexService lexicalIndex;
    private SourceVersionRegistry versions;
    private SyncService syncService;
    private MongoTemplate mongoTemplate;
    private DataSourceService service;

    @BeforeEach
    void setUp() {
        repository = mock(DataSourceRepository.class);
        chunkRepository = mock(DocumentChunkRepository.class);
        vectorStore = mock(ChunkVectorStore.class);
        lexicalIndex = mock(LexicalIndexService.class);
        versions = new SourceVersionRegistry();
        syncService = mock(SyncService.class);
        mongoTemplate = mock(MongoTemplate.class);
        service = new DataSourceService(repository, chunkRepository, vectorStore, lexicalIndex, versions,
                new SourceConnectorFactory(), syncService, mongoTemplate);
        ReflectionTestUtils.setField(service, "uploadDir", tempDir.toString());
        when(repository.save(any(DataSource.class))).thenAnswer(inv -> {
            DataSource source = inv.getArgument(0);
            if (source.getId() == null) {
                source.setId("ds-new");
            }
            return source;
        });
    }

    @Test
    void fileSourceGetsItsOwnStorageDirectory() {
        DataSource created = service.create(new DataSource(" manuals ", SourceKind.FILE), "alice");

        assertEquals("manuals", created.getName());
        assertEquals("alice", created.getOwnerId());
        assertEquals(SyncState.PENDING, created.getSyncState());
        assertEquals(tempDir.resolve("ds_ds-new").toString(), created.getFileStoreDir());
        when(repository.findById("ds-new")).thenReturn(Optional.of(created));
        assertTrue(service.testConnection("ds-new"));
    }

    @Test
    void incompleteDescriptorsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.create(new DataSource("db", SourceKind.SQLITE), "a"));
        assertThrows(IllegalArgumentException.class, () -> service.create(new DataSource("db", SourceKind.MYSQL), "a"));
        assertThrows(IllegalArgumentException.class, () -> service.create(new DataSource(" ", SourceKind.FILE), "a"));
        DataSource badStrategy = new DataSource("docs", SourceKind.FILE);
        badStrategy.setChunkStrategy("chapters");
        assertThrows(IllegalArgumentException.class, () -> service.create(badStrategy, "a"));
    }

    @Test
    void uploadReplacesSameNameAndStripsDirectories() throws Exception {
        DataSource source = fileSource();

        service.addUploadedFile("ds-1", "notes.txt", "v1".getBytes(StandardCharsets.UTF_8));
        service.addUploadedFile("ds-1", "../../notes.txt", "version 2".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, source.getUploadedFiles().size());
        DataSource.UploadedFile file = source.getUploadedFiles().get(0);
        assertEquals("notes.txt", file.getFilename());
        assertEquals(9L, file.getSize());
        assertEquals("version 2", Files.readString(tempDir.resolve("ds_ds-1").resolve("notes.txt")));
    }

    @Test
    void unsupportedUploadIsRejected() {
        fileSource();

        assertThrows(IllegalArgumentException.class,
                () -> service.addUploadedFile("ds-1", "tool.exe", new byte[] {1, 2}));
    }

    @Test
    void removingUploadDeletesFile() throws Exception {
        DataSource source = fileSource();
        service.addUploadedFile("ds-1", "a.md", "# a".getBytes(StandardCharsets.UTF_8));

        service.removeUploadedFile("ds-1", "a.md");

        assertTrue(source.getUploadedFiles().isEmpty());
        assertFalse(Files.exists(tempDir.resolve("ds_ds-1").resolve("a.md")));
        assertThrows(IllegalArgumentException.class, () -> service.removeUploadedFile("ds-1", "a.md"));
    }

    @Test
    void deleteCascadesAndInvalidates() throws Exception {
        fileSource();
        Files.createDirectories(tempDir.resolve("ds_ds-1"));

        service.delete("ds-1");

        verify(chunkRepository).deleteByDataSourceId("ds-1");
        verify(vectorStore).deleteBySource("ds-1");
        verify(repository).deleteById("ds-1");
        verify(lexicalIndex).invalidate("ds-1");
        assertEquals(1L, versions.current("ds-1"));
        assertFalse(Files.exists(tempDir.resolve("ds_ds-1")));
    }

    @Test
    void deleteWhileSyncingIsRejected() {
        DataSource source = fileSource();
        source.setSyncState(SyncState.SYNCING);

        assertThrows(SyncInProgressException.class, () -> service.delete("ds-1"));
        verify(repository, never()).deleteById(anyString());
    }

    @Test
    void sqliteConnectionCheckRunsRoundTrip() {
        DataSource db = new DataSource("local", SourceKind.SQLITE);
        db.setId("ds-db");
        db.setSqlitePath(tempDir.resolve("local.db").toString());
        when(repository.findById("ds-db")).thenReturn(Optional.of(db));

        assertTrue(service.testConnection("ds-db"));
    }

    @Test
    void listingIsScopedToOwnerUnlessAdmin() {
        service.list("alice", false);
        verify(repository).findByOwnerIdOrderByCreatedAtDesc("alice");

        service.list("root", true);
        verify(repository).findAllByOrderByCreatedAtDesc();
    }

    @Test
    void partialUpdateKeepsUntouchedFields() {
        DataSource db = new DataSource("crm", SourceKind.POSTGRESQL);
        db.setId("ds-pg");
        db.setHost("db.internal");
        db.setPassword("secret");
        when(repository.findById("ds-pg")).thenReturn(Optional.of(db));
        DataSource patch = new DataSource();
        patch.setPort(5433);
        patch.setPassword("");

        DataSource updated = service.update("ds-pg", patch);

        assertEquals("crm", updated.getName());
        assertEquals("db.internal", updated.getHost());
        assertEquals(5433, updated.getPort());
        assertEquals("secret", updated.getPassword());
        Document set = lastSet();
        assertEquals(5433, set.get("port"));
        assertFalse(set.containsKey("password"));
        assertFalse(set.containsKey("host"));
    }

    @Test
    void updateDuringSyncNeverWritesSyncFields() {
        DataSource db = new DataSource("crm", SourceKind.POSTGRESQL);
        db.setId("ds-pg");
        db.setSyncState(SyncState.SYNCING);
        db.setSyncProgress(40);
        when(repository.findById("ds-pg")).thenReturn(Optional.of(db));
        DataSource patch = new DataSource();
        patch.setName("crm replica");
        patch.setHost("replica.internal");

        service.update("ds-pg", patch);

        Document set = lastSet();
        assertEquals("crm replica", set.get("name"));
        assertEquals("replica.internal", set.get("host"));
        assertFalse(set.containsKey("syncState"));
        assertFalse(set.containsKey("syncProgress"));
        assertFalse(set.containsKey("syncError"));
        assertFalse(set.containsKey("lastSyncedAt"));
        verify(repository, never()).save(any(DataSource.class));
    }

    @Test
    void uploadDuringSyncOnlyWritesFileFields() {
        DataSource source = fileSource();
        source.setSyncState(SyncState.SYNCING);

        service.addUploadedFile("ds-1", "notes.txt", "v1".getBytes(StandardCharsets.UTF_8));
        assertEquals(Set.of("uploadedFiles", "fileStoreDir"), lastSet().keySet());

        service.removeUploadedFile("ds-1", "notes.txt");
        assertEquals(Set.of("uploadedFiles"), lastSet().keySet());
        verify(repository, never()).save(any(DataSource.class));
    }

    @Test
    void unknownSourceIsNotFound() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThrows(DataSourceNotFoundException.class, () -> service.get("nope"));
    }

    private Document lastSet() {
        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate, atLeastOnce()).updateFirst(any(Query.class), captor.capture(), eq(DataSource.class));
        List<Update> updates = captor.getAllValues();
        return (Document) updates.get(updates.size() - 1).getUpdateObject().get("$set");
    }

    private DataSource fileSource() {
        DataSource source = new DataSource("docs", SourceKind.FILE);
        source.setId("ds-1");
        source.setUploadedFiles(List.of());
        when(repository.findById("ds-1")).thenReturn(Optional.of(source));
        return source;
    }
}
