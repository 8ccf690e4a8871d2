package com.jreinhal.zerag.rag.fallback;

import com.jreinhal.zerag.connectors.SourceConnector;
import com.jreinhal.zerag.connectors.SourceConnectorFactory;
import com.jreinhal.zerag.generation.GenerationService;
import com.jreinhal.zerag.generation.GenerationService.TableSchema;
import com.jreinhal.zerag.model.DataSource;
import com.jreinhal.zerag.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Answers from the live database when passage retrieval is weak: the chat model writes a SQL
 * query over the source's schemas and the rows it returns join the answer context.
 * <p>
 * The generated statement is executed as-is apart from the row cap. It is not validated or
 * sandboxed, so the source credentials should be read-only.
 */
@Component
public class StructuredQueryFallback {

    private static final Logger log = LoggerFactory.getLogger(StructuredQueryFallback.class);

    private final SourceConnectorFactory connectorFactory;
    private final GenerationService generationService;

    @Value("${zerag.fallback.similarity-threshold:0.45}")
    private double similarityThreshold = 0.45;

    @Value("${zerag.fallback.max-tables:20}")
    private int maxTables = 20;

    @Value("${zerag.fallback.max-rows:10}")
    private int maxRows = 10;

    public StructuredQueryFallback(SourceConnectorFactory connectorFactory, GenerationService generationService) {
        this.connectorFactory = connectorFactory;
        this.generationService = generationService;
    }

    @PostConstruct
    public void init() {
        log.info("Structured query fallback initialized (threshold={}, maxTables={}, maxRows={})",
                this.similarityThreshold, this.maxTables, this.maxRows);
    }

    /**
     * True when a non-file source is in scope, lexical search found nothing and the best
     * vector-sourced similarity is under the threshold.
     */
    public boolean shouldTrigger(DataSource source, int lexicalHits, double maxVectorSimilarity) {
        return source != null
                && !source.isFileBacked()
                && source.getKind() != null
                && source.getKind().isDatabase()
                && lexicalHits == 0
                && maxVectorSimilarity < this.similarityThreshold;
    }

    /**
     * Rows returned by the generated query, or an empty list if any step fails.
     */
    public List<Map<String, Object>> run(String question, DataSource source) {
        List<TableSchema> schemas;
        String dialect;
        try (SourceConnector connector = this.connectorFactory.create(source)) {
            connector.connect();
            dialect = connector.dialect();
            schemas = this.readSchemas(connector, source.getId());
        }
        catch (RuntimeException e) {
            log.error("Structured fallback schema fetch failed for data source {}: {}", source.getId(), e.getMessage());
            return List.of();
        }
        if (schemas.isEmpty()) {
            log.info("Structured fallback skipped for data source {}: no readable tables", source.getId());
            return List.of();
        }

        Optional<String> sql;
        try {
            sql = this.generationService.generateStructuredQuery(question, schemas, dialect, this.maxRows);
        }
        catch (RuntimeException e) {
            log.error("Structured fallback query generation failed for data source {} ('{}'): {}", source.getId(),
                    LogSanitizer.prefix(question), e.getMessage());
            return List.of();
        }
        if (sql.isEmpty()) {
            log.info("Structured fallback: model could not write a query for data source {}", source.getId());
            return List.of();
        }
        log.info("Structured fallback generated for data source {}: {}", source.getId(), LogSanitizer.sanitize(sql.get()));

        try (SourceConnector connector = this.connectorFactory.create(source)) {
            connector.connect();
            List<Map<String, Object>> rows = connector.executeQuery(sql.get(), this.maxRows);
            log.info("Structured fallback returned {} rows for data source {}", rows.size(), source.getId());
            return rows;
        }
        catch (RuntimeException e) {
            log.error("Structured fallback execution failed for data source {}: {}", source.getId(), e.getMessage());
            return List.of();
        }
    }

    private List<TableSchema> readSchemas(SourceConnector connector, String dataSourceId) {
        List<String> tables = connector.listTables();
        List<TableSchema> schemas = new ArrayList<>();
        for (String table : tables.subList(0, Math.min(this.maxTables, tables.size()))) {
            try {
                schemas.add(new TableSchema(table, connector.listColumns(table)));
            }
            catch (RuntimeException e) {
                log.warn("Skipping table {} of data source {} in fallback schema: {}", LogSanitizer.sanitize(table),
                        dataSourceId, e.getMessage());
            }
        }
        return schemas;
    }

    public int maxRows() {
        return this.maxRows;
    }
}
