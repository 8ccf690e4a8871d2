package com.jreinhal.zerag.model;

import com.jreinhal.zerag.chunking.ChunkStrategy;
import java.util.Locale;

public enum SourceKind {
    MYSQL,
    POSTGRESQL,
    SQLITE,
    FILE,
    WEB;

    public boolean isDatabase() {
        return this == MYSQL || this == POSTGRESQL || this == SQLITE;
    }

    public ChunkStrategy defaultStrategy() {
        return this.isDatabase() ? ChunkStrategy.FIXED : ChunkStrategy.SMART;
    }

    public static SourceKind fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Data source kind is required");
        }
        try {
            return SourceKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported data source kind: " + value);
        }
    }
}
