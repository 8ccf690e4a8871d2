package com.jreinhal.zerag.connectors;

import com.jreinhal.zerag.model.DataSource;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

public class MySqlSourceConnector extends JdbcSourceConnector {

    public MySqlSourceConnector(DataSource source) {
        super(source);
    }

    @Override
    protected String jdbcUrl() {
        int port = this.source.getPort() != null ? this.source.getPort() : 3306;
        return "jdbc:mysql://" + this.source.getHost() + ":" + port + "/" + this.source.getDatabaseName()
                + "?useUnicode=true&characterEncoding=utf8";
    }

    @Override
    protected String driverClassName() {
        return "com.mysql.cj.jdbc.Driver";
    }

    @Override
    protected String listTablesSql() {
        return "SELECT table_name FROM information_schema.tables "
                + "WHERE table_schema = DATABASE() AND table_type = 'BASE TABLE' ORDER BY table_name";
    }

    @Override
    protected List<String> queryColumns(JdbcTemplate jdbc, String table) {
        return jdbc.queryForList("SELECT column_name FROM information_schema.columns "
                + "WHERE table_schema = DATABASE() AND table_name = ? ORDER BY ordinal_position", String.class, table);
    }

    @Override
    protected String quoteIdentifier(String identifier) {
        return quoteWith(identifier, '`');
    }

    @Override
    public String dialect() {
        return "mysql";
    }
}
