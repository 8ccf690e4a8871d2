package com.jreinhal.zerag.connectors;

import java.util.List;
import java.util.Map;

/**
 * Read access to a database-backed data source. Instances are single-use: the caller connects,
 * works, and closes on every path. Failures surface as
 * {@link com.jreinhal.zerag.exception.SourceConnectorException}.
 */
public interface SourceConnector extends AutoCloseable {

    void connect();

    @Override
    void close();

    List<String> listTables();

    List<String> listColumns(String table);

    /**
     * All rows of the table; {@code columns} empty or null selects every column.
     */
    List<Map<String, Object>> fetchRows(String table, List<String> columns);

    /**
     * Runs a caller-supplied statement and returns at most {@code maxRows} rows.
     */
    List<Map<String, Object>> executeQuery(String sql, int maxRows);

    boolean testConnection();

    /**
     * Dialect name handed to the query generator.
     */
    String dialect();
}
