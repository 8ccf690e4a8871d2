package com.jreinhal.zerag.connectors;

import com.jreinhal.zerag.exception.SourceConnectorException;
import com.jreinhal.zerag.model.DataSource;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

public class SqliteSourceConnector extends JdbcSourceConnector {

    public SqliteSourceConnector(DataSource source) {
        super(source);
        if (source.getSqlitePath() == null || source.getSqlitePath().isBlank()) {
            throw new SourceConnectorException("SQLite data source " + source.getId() + " has no database path");
        }
    }

    @Override
    protected String jdbcUrl() {
        return "jdbc:sqlite:" + this.source.getSqlitePath();
    }

    @Override
    protected String driverClassName() {
        return "org.sqlite.JDBC";
    }

    @Override
    protected String listTablesSql() {
        return "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name";
    }

    @Override
    protected List<String> queryColumns(JdbcTemplate jdbc, String table) {
        return jdbc.query("PRAGMA table_info(" + this.quoteIdentifier(table) + ")", (rs, rowNum) -> rs.getString("name"));
    }

    @Override
    protected String quoteIdentifier(String identifier) {
        return quoteWith(identifier, '"');
    }

    @Override
    public String dialect() {
        return "sqlite";
    }
}
