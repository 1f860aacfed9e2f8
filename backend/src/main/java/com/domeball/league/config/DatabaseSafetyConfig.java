package com.domeball.league.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Startup guard against destructive schema handling outside tests.
 *
 * A rollover rewrites every team's division, so losing the schema on restart would wipe the
 * league. If ddl-auto is create or create-drop and no active profile contains "test", startup
 * aborts with an IllegalStateException. In-memory datasources are logged as a warning.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    @Value("${spring.profiles.active:default}")
    private String activeProfiles;

    @Value("${spring.jpa.hibernate.ddl-auto:validate}")
    private String ddlAuto;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    public DatabaseSafetyConfig() {}

    DatabaseSafetyConfig(String activeProfiles, String ddlAuto, String datasourceUrl) {
        this.activeProfiles = activeProfiles;
        this.ddlAuto = ddlAuto;
        this.datasourceUrl = datasourceUrl;
    }

    @PostConstruct
    public void verifyHibernateDdlAutoSafety() {
        String profiles = safeLower(activeProfiles);
        String ddl = safeLower(ddlAuto).replace('_', '-');
        String dsUrl = datasourceUrl == null ? "" : datasourceUrl;

        log.info("[DB_SAFETY] Active profiles='{}', ddl-auto='{}', datasource='{}'", activeProfiles, ddlAuto, dsUrl);

        boolean dangerous = "create".equals(ddl) || "create-drop".equals(ddl);
        if (dangerous && !profiles.contains("test")) {
            throw new IllegalStateException("Dangerous ddl-auto '" + ddlAuto + "' in non-test profile, aborting startup to protect league data.");
        }

        if (dsUrl.toLowerCase().contains("mem:")) {
            log.warn("[DB_SAFETY] In-memory database detected, league state will not survive a restart.");
        }
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase();
    }
}
