package com.rollup.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.neo4j.Neo4jAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Event Rollup Service - entry point for the Spring Boot application.
 *
 * Ingests analytics events into an in-memory rollup buffer, flushes the rollups to the
 * configured store on a fixed interval and serves traffic statistics from the stored rollups.
 * The Neo4j driver is managed by the rollup engine itself, hence the excluded auto-configuration.
 */
@SpringBootApplication(exclude = Neo4jAutoConfiguration.class)
@EnableScheduling
@ConfigurationPropertiesScan("com.rollup.service.config")
public class RollupServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RollupServiceApplication.class, args);
    }
}
