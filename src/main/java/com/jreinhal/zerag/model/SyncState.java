package com.jreinhal.zerag.model;

/**
 * Lifecycle of one data source's index. {@code PENDING -> SYNCING -> (SYNCED | ERROR)};
 * both terminal states re-enter {@code SYNCING} only through a new sync request.
 */
public enum SyncState {
    PENDING,
    SYNCING,
    SYNCED,
    ERROR;

    public boolean canStartSync() {
        return this != SYNCING;
    }
}
