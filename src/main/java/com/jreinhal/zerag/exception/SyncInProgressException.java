package com.jreinhal.zerag.exception;

/**
 * A sync was requested while another one is still running for the same data source.
 */
public class SyncInProgressException extends RuntimeException {

    private final String dataSourceId;

    public SyncInProgressException(String dataSourceId) {
        super("Sync already in progress for data source " + dataSourceId);
        this.dataSourceId = dataSourceId;
    }

    public String getDataSourceId() {
        return this.dataSourceId;
    }
}
