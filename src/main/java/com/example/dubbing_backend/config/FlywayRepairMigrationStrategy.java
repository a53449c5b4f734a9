package com.example.dubbing_backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the job/queue schema on startup, repairing the history table first when enabled
 * (checksums of edited migrations, entries left by a failed run).
 */
@Configuration
public class FlywayRepairMigrationStrategy {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlywayRepairMigrationStrategy.class);

    @Bean
    public FlywayMigrationStrategy dubbingMigrationStrategy(
            @Value("${dubbing.flyway.repair-on-start:true}") boolean repairOnStart) {
        return flyway -> {
            if (repairOnStart) {
                var repair = flyway.repair();
                LOGGER.info("FLYWAY REPAIR removed={} aligned={}",
                        repair.migrationsRemoved.size(), repair.migrationsAligned.size());
            }
            var result = flyway.migrate();
            LOGGER.info("FLYWAY MIGRATE applied={} schemaVersion={}", result.migrationsExecuted, result.targetSchemaVersion);
        };
    }
}
