package com.jreinhal.zerag.connectors;

import com.jreinhal.zerag.exception.SourceConnectorException;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.model.SourceKind;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteSourceConnectorTest {

    @TempDir
    Path tempDir;

    private SourceConnector connector;

    @BeforeEach
    void setUp() {
        DataSource source = new DataSource("hr", SourceKind.SQLITE);
        source.setId("ds-sqlite");
        source.setSqlitePath(tempDir.resolve("hr.db").toString());
        JdbcTemplate setup = new JdbcTemplate(new DriverManagerDataSource("jdbc:sqlite:" + source.getSqlitePath()));
        setup.execute("CREATE TABLE employees (id INTEGER PRIMARY KEY, name TEXT, role TEXT)");
        setup.execute("INSERT INTO employees (id, name, role) VALUES (1, 'Ada', 'engineer'), (2, 'Lin', 'analyst'), (3, 'Sam', NULL)");
        setup.execute("CREATE TABLE \"odd \"\"name\"\"\" (k TEXT)");
        connector = new SourceConnectorFactory().create(source);
        connector.connect();
    }

    @AfterEach
    void tearDown() {
        connector.close();
    }

    @Test
    void factorySelectsVariantByKind() {
        assertInstanceOf(SqliteSourceConnector.class, connector);
        assertEquals("sqlite", connector.dialect());
    }

    @Test
    void listsTablesAndColumns() {
        assertEquals(List.of("employees", "odd \"name\""), connector.listTables());
        assertEquals(List.of("id", "name", "role"), connector.listColumns("employees"));
    }

    @Test
    void fetchesSelectedColumns() {
        List<Map<String, Object>> rows = connector.fetchRows("employees", List.of("name"));

        assertEquals(3, rows.size());
        assertEquals(Map.of("name", "Ada"), rows.get(0));
    }

    @Test
    void fetchesAllColumnsWhenNoneGiven() {
        List<Map<String, Object>> rows = connector.fetchRows("employees", null);

        assertEquals(3, rows.get(0).size());
    }

    @Test
    void executeQueryCapsRowCount() {
        assertEquals(2, connector.executeQuery("SELECT * FROM employees", 2).size());
    }

    @Test
    void connectionTestRoundTrips() {
        assertTrue(connector.testConnection());
    }

    @Test
    void badSqlIsWrapped() {
        assertThrows(SourceConnectorException.class, () -> connector.executeQuery("SELECT * FROM missing_table", 10));
    }

    @Test
    void closedConnectorRefusesWork() {
        connector.close();
        assertThrows(SourceConnectorException.class, connector::listTables);
        assertFalse(connector.testConnection());
    }

    @Test
    void nonDatabaseKindHasNoConnector() {
        DataSource files = new DataSource("docs", SourceKind.FILE);
        assertThrows(IllegalArgumentException.class, () -> new SourceConnectorFactory().create(files));
    }
}
