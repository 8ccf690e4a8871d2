package com.jreinhal.zerag.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A logical source of indexed content: a database, a set of uploaded files, or a list of web pages.
 */
@Document(collection = "data_sources")
public class DataSource {

    @Id
    private String id;
    private String name;
    private SourceKind kind;
    private String ownerId;

    // database descriptor
    private String host;
    private Integer port;
    private String databaseName;
    private String username;
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;
    private String sqlitePath;
    private List<TableConfig> tablesConfig = new ArrayList<>();

    // file / web descriptor
    private String fileStoreDir;
    private List<UploadedFile> uploadedFiles = new ArrayList<>();
    private List<String> webUrls = new ArrayList<>();

    private String chunkStrategy;

    private SyncState syncState = SyncState.PENDING;
    private int syncProgress;
    private Instant lastSyncedAt;
    private String syncError;
    private Instant createdAt;

    public DataSource() {
    }

    public DataSource(String name, SourceKind kind) {
        this.name = name;
        this.kind = kind;
        this.createdAt = Instant.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public SourceKind getKind() { return kind; }
    public void setKind(SourceKind kind) { this.kind = kind; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }

    public String getDatabaseName() { return databaseName; }
    public void setDatabaseName(String databaseName) { this.databaseName = databaseName; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getSqlitePath() { return sqlitePath; }
    public void setSqlitePath(String sqlitePath) { this.sqlitePath = sqlitePath; }

    public List<TableConfig> getTablesConfig() { return tablesConfig; }
    public void setTablesConfig(List<TableConfig> tablesConfig) {
        this.tablesConfig = tablesConfig != null ? new ArrayList<>(tablesConfig) : new ArrayList<>();
    }

    public String getFileStoreDir() { return fileStoreDir; }
    public void setFileStoreDir(String fileStoreDir) { this.fileStoreDir = fileStoreDir; }

    public List<UploadedFile> getUploadedFiles() { return uploadedFiles; }
    public void setUploadedFiles(List<UploadedFile> uploadedFiles) {
        this.uploadedFiles = uploadedFiles != null ? new ArrayList<>(uploadedFiles) : new ArrayList<>();
    }

    public List<String> getWebUrls() { return webUrls; }
    public void setWebUrls(List<String> webUrls) {
        this.webUrls = webUrls != null ? new ArrayList<>(webUrls) : new ArrayList<>();
    }

    public String getChunkStrategy() { return chunkStrategy; }
    public void setChunkStrategy(String chunkStrategy) { this.chunkStrategy = chunkStrategy; }

    public SyncState getSyncState() { return syncState; }
    public void setSyncState(SyncState syncState) { this.syncState = syncState; }

    public int getSyncProgress() { return syncProgress; }
    public void setSyncProgress(int syncProgress) { this.syncProgress = syncProgress; }

    public Instant getLastSyncedAt() { return lastSyncedAt; }
    public void setLastSyncedAt(Instant lastSyncedAt) { this.lastSyncedAt = lastSyncedAt; }

    public String getSyncError() { return syncError; }
    public void setSyncError(String syncError) { this.syncError = syncError; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean isFileBacked() {
        return this.kind == SourceKind.FILE;
    }

    public static class TableConfig {
        private String table;
        private List<String> columns;

        public TableConfig() {
        }

        public TableConfig(String table, List<String> columns) {
            this.table = table;
            this.columns = columns;
        }

        public String getTable() { return table; }
        public void setTable(String table) { this.table = table; }

        public List<String> getColumns() { return columns; }
        public void setColumns(List<String> columns) { this.columns = columns; }
    }

    public static class UploadedFile {
        private String filename;
        private String path;
        private long size;

        public UploadedFile() {
        }

        public UploadedFile(String filename, String path, long size) {
            this.filename = filename;
            this.path = path;
            this.size = size;
        }

        public String getFilename() { return filename; }
        public void setFilename(String filename) { this.filename = filename; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public long getSize() { return size; }
        public void setSize(long size) { this.size = size; }
    }
}
