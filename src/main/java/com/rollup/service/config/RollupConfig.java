package com.rollup.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the rollup service.
 *
 * Contains the master switch, feature flags and the Neo4j connection.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "rollup")
public class RollupConfig {

    /**
     * Enable or disable event ingestion and reporting.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    /**
     * Neo4j connection settings, used when {@code features.neo4j-enabled} is set.
     */
    private Neo4j neo4j = new Neo4j();

    @Getter
    @Setter
    public static class Features {

        /**
         * Persist rollups to Neo4j. When disabled an in-memory repository is used.
         */
        private boolean neo4jEnabled = false;

        /**
         * Write drained raw events to gzipped JSON lines files.
         */
        private boolean rawExportEnabled = true;

        /**
         * Enable metrics collection.
         */
        private boolean metricsEnabled = true;
    }

    @Getter
    @Setter
    public static class Neo4j {

        private String uri = "bolt://localhost:7687";

        private String username = "neo4j";

        private String password = "password";
    }
}
