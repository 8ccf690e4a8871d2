package com.jreinhal.zerag.dto;

import com.jreinhal.zerag.model.SyncState;
import java.time.Instant;

public record SyncStatus(SyncState state, int progress, String error, long chunkCount, Instant lastSyncedAt) {
}
