package com.jreinhal.zerag.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class EmbeddingDimensionMigrationRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingDimensionMigrationRunner.class);

    private final EmbeddingDimensionMigrationService migrationService;

    @Value("${zerag.migration.embedding-dimension.enabled:false}")
    private boolean enabled;

    @Value("${zerag.migration.embedding-dimension.dry-run:true}")
    private boolean dryRun = true;

    public EmbeddingDimensionMigrationRunner(EmbeddingDimensionMigrationService migrationService) {
        this.migrationService = migrationService;
    }

    @Override
    public void run(String... args) {
        if (!this.enabled) {
            return;
        }
        EmbeddingDimensionMigrationService.MigrationResult result = this.migrationService.migrate(this.dryRun);
        if (this.dryRun) {
            log.info("Embedding dimension migration dry-run complete: {}", result);
            return;
        }
        if (!result.mismatch()) {
            return;
        }
        this.migrationService.markCompleted(result);
        log.info("Embedding dimension migration completed and marked: {}", result);
    }
}
