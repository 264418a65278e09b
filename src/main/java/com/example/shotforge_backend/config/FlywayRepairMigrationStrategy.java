package com.example.shotforge_backend.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.RepairResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Repairs the schema history (checksum drift of already applied scripts) before migrating.
 * Disable with {@code flyway-repair.enabled=false} to let Flyway fail on drift instead.
 */
@Configuration
@ConditionalOnProperty(prefix = "flyway-repair", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlywayRepairMigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlywayRepairMigrationStrategy.class);

    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            RepairResult repair = flyway.repair();
            if (!repair.migrationsAligned.isEmpty() || !repair.migrationsRemoved.isEmpty()) {
                LOGGER.warn("FLYWAY repaired aligned={} removed={}",
                        repair.migrationsAligned.size(), repair.migrationsRemoved.size());
            }
            var result = flyway.migrate();
            LOGGER.info("FLYWAY migrated executed={} targetVersion={}", result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
