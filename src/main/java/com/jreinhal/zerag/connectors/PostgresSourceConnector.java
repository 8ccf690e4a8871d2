package com.jreinhal.zerag.connectors;

import com.jreinhal.zerag.model.DataSource;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Reads the {@code public} schema.
 */
public class PostgresSourceConnector extends JdbcSourceConnector {

    public PostgresSourceConnector(DataSource source) {
        super(source);
    }

    @Override
    protected String jdbcUrl() {
        int port = this.source.getPort() != null ? this.source.getPort() : 5432;
        return "jdbc:postgresql://" + this.source.getHost() + ":" + port + "/" + this.source.getDatabaseName();
    }

    @Override
    protected String driverClassName() {
        return "org.postgresql.Driver";
    }

    @Override
    protected String listTablesSql() {
        return "SELECT table_name FROM information_schema.tables "
                + "WHERE table_schema = 'public' AND table_type = 'BASE TABLE' ORDER BY table_name";
    }

    @Override
    protected List<String> queryColumns(JdbcTemplate jdbc, String table) {
        return jdbc.queryForList("SELECT column_name FROM information_schema.columns "
                + "WHERE table_schema = 'public' AND table_name = ? ORDER BY ordinal_position", String.class, table);
    }

    @Override
    protected String quoteIdentifier(String identifier) {
        return quoteWith(identifier, '"');
    }

    @Override
    public String dialect() {
        return "postgresql";
    }
}
