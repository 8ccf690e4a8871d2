package com.jreinhal.zerag.connectors;

import com.jreinhal.zerag.exception.SourceConnectorException;
import com.jreinhal.zerag.model.DataSource;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Shared JDBC plumbing. Subclasses supply the URL, the catalog queries and identifier quoting.
 * Connections are opened per statement by {@link DriverManagerDataSource}, so nothing outlives
 * {@link #close()}.
 */
public abstract class JdbcSourceConnector implements SourceConnector {

    private static final Logger log = LoggerFactory.getLogger(JdbcSourceConnector.class);

    protected final DataSource source;
    private JdbcTemplate jdbcTemplate;
    private DriverManagerDataSource jdbcDataSource;

    protected JdbcSourceConnector(DataSource source) {
        this.source = source;
    }

    protected abstract String jdbcUrl();

    protected abstract String driverClassName();

    protected abstract String listTablesSql();

    protected abstract List<String> queryColumns(JdbcTemplate jdbc, String table);

    protected abstract String quoteIdentifier(String identifier);

    @Override
    public void connect() {
        if (this.jdbcTemplate != null) {
            return;
        }
        DriverManagerDataSource ds = new DriverManagerDataSource(this.jdbcUrl(), nullToEmpty(this.source.getUsername()),
                nullToEmpty(this.source.getPassword()));
        ds.setDriverClassName(this.driverClassName());
        this.jdbcDataSource = ds;
        this.jdbcTemplate = new JdbcTemplate(ds);
        if (log.isDebugEnabled()) {
            log.debug("Connector {} opened for data source {}", this.dialect(), this.source.getId());
        }
    }

    @Override
    public void close() {
        this.jdbcTemplate = null;
        this.jdbcDataSource = null;
    }

    @Override
    public List<String> listTables() {
        return this.run("listTables", jdbc -> jdbc.queryForList(this.listTablesSql(), String.class));
    }

    @Override
    public List<String> listColumns(String table) {
        return this.run("listColumns", jdbc -> this.queryColumns(jdbc, table));
    }

    @Override
    public List<Map<String, Object>> fetchRows(String table, List<String> columns) {
        String projection = columns == null || columns.isEmpty()
                ? "*"
                : columns.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
        String sql = "SELECT " + projection + " FROM " + this.quoteIdentifier(table);
        return this.run("fetchRows", jdbc -> jdbc.queryForList(sql));
    }

    @Override
    public List<Map<String, Object>> executeQuery(String sql, int maxRows) {
        return this.run("executeQuery", jdbc -> {
            JdbcTemplate limited = new JdbcTemplate(this.jdbcDataSource);
            limited.setMaxRows(Math.max(1, maxRows));
            return limited.queryForList(sql);
        });
    }

    @Override
    public boolean testConnection() {
        try {
            Integer one = this.run("testConnection", jdbc -> jdbc.queryForObject("SELECT 1", Integer.class));
            return one != null && one == 1;
        }
        catch (SourceConnectorException e) {
            log.warn("Connection test failed for data source {}: {}", this.source.getId(), e.getMessage());
            return false;
        }
    }

    private <T> T run(String operation, JdbcCall<T> call) {
        if (this.jdbcTemplate == null) {
            throw new SourceConnectorException("Connector not connected: " + operation);
        }
        try {
            return call.apply(this.jdbcTemplate);
        }
        catch (DataAccessException e) {
            throw new SourceConnectorException(this.dialect() + " " + operation + " failed for data source "
                    + this.source.getId() + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    protected static String quoteWith(String identifier, char quote) {
        String q = String.valueOf(quote);
        return q + identifier.replace(q, q + q) + q;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    @FunctionalInterface
    private interface JdbcCall<T> {
        T apply(JdbcTemplate jdbc);
    }
}
