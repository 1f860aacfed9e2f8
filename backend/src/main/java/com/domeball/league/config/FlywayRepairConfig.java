package com.domeball.league.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "spring.flyway.enabled", havingValue = "true", matchIfMissing = true)
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    // Repair clears failed entries from the schema history before migrating
    @Bean
    public FlywayMigrationStrategy leagueFlywayMigrationStrategy() {
        return flyway -> {
            try {
                log.info("[FLYWAY] Repairing schema history before migrating league schema");
                flyway.repair();
            } catch (Exception ex) {
                log.warn("[FLYWAY] Repair failed or not needed: {}", ex.getMessage());
            }
            var result = flyway.migrate();
            log.info("[FLYWAY] Applied {} migration(s)", result.migrationsExecuted);
        };
    }
}
