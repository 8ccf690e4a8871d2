package com.jreinhal.zerag.connectors;

import com.jreinhal.zerag.model.DataSource;
import org.springframework.stereotype.Component;

/**
 * Picks the connector variant for a data source's kind. Each call returns a fresh,
 * unconnected instance owned by the caller.
 */
@Component
public class SourceConnectorFactory {

    public SourceConnector create(DataSource source) {
        if (source.getKind() == null || !source.getKind().isDatabase()) {
            throw new IllegalArgumentException("Data source " + source.getId() + " is not database-backed: " + source.getKind());
        }
        return switch (source.getKind()) {
            case MYSQL -> new MySqlSourceConnector(source);
            case POSTGRESQL -> new PostgresSourceConnector(source);
            case SQLITE -> new SqliteSourceConnector(source);
            default -> throw new IllegalArgumentException("No connector for kind " + source.getKind());
        };
    }
}
