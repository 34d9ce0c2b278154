package com.rollup.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollup.service.buffer.InMemoryRollupBuffer;
import com.rollup.service.buffer.RollupBuffer;
import com.rollup.service.flush.JsonLinesRawEventExporter;
import com.rollup.service.flush.RawEventExporter;
import com.rollup.service.flush.RollupFlusher;
import com.rollup.service.ingest.EventIngestService;
import com.rollup.service.persistence.InMemoryRollupRepository;
import com.rollup.service.persistence.Neo4jRollupRepository;
import com.rollup.service.persistence.RollupRepository;
import com.rollup.service.persistence.SketchMerger;
import com.rollup.service.stats.RollupStatsService;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.GraphDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the rollup engine: buffer, repository, raw exporter and flusher.
 *
 * Every component is constructed once here and injected where needed. The flusher starts
 * with the context and its final flush runs when the context closes.
 */
@Slf4j
@Configuration
public class RollupEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== Buffer ====================

    @Bean
    public RollupBuffer rollupBuffer(BufferConfig bufferConfig, RollupConfig rollupConfig, MetricsConfig metricsConfig) {
        var buffer = new InMemoryRollupBuffer(bufferConfig.getMaxRawBytes(), bufferConfig.getSketchPrecision());
        if (rollupConfig.getFeatures().isMetricsEnabled()) {
            metricsConfig.registerBufferGauge("rollup.buffer.raw.events",
                    "Raw events waiting for export", buffer::size);
            metricsConfig.registerBufferGauge("rollup.buffer.raw.bytes",
                    "Estimated size of the raw event list", buffer::rawSize);
            metricsConfig.registerBufferGauge("rollup.buffer.aggregations",
                    "Live path rollups", buffer::aggregationCount);
        }
        return buffer;
    }

    // ==================== Repository ====================

    @Bean
    public SketchMerger sketchMerger(MetricsConfig metricsConfig) {
        return new SketchMerger(metricsConfig.getSketchMergeFailures());
    }

    @Bean(initMethod = "init", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "rollup.features", name = "neo4j-enabled", havingValue = "true")
    public Neo4jRollupRepository neo4jRollupRepository(RollupConfig rollupConfig, SketchMerger sketchMerger) {
        var neo4j = rollupConfig.getNeo4j();
        log.info("Using Neo4j rollup store at {}", neo4j.getUri());
        var driver = GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
        return new Neo4jRollupRepository(driver, sketchMerger);
    }

    @Bean
    @ConditionalOnProperty(prefix = "rollup.features", name = "neo4j-enabled", havingValue = "false", matchIfMissing = true)
    public InMemoryRollupRepository inMemoryRollupRepository(SketchMerger sketchMerger) {
        log.info("Neo4j persistence is disabled, rollups are kept in memory");
        return new InMemoryRollupRepository(sketchMerger);
    }

    // ==================== Flush ====================

    @Bean
    public RawEventExporter rawEventExporter(RollupConfig rollupConfig, FlushConfig flushConfig, ObjectMapper objectMapper) {
        if (!rollupConfig.getFeatures().isRawExportEnabled()) {
            log.info("Raw event export is disabled");
            return RawEventExporter.discarding();
        }
        return new JsonLinesRawEventExporter(Path.of(flushConfig.getRawExport().getDirectory()), objectMapper);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RollupFlusher rollupFlusher(RollupBuffer rollupBuffer,
                                       RollupRepository rollupRepository,
                                       RawEventExporter rawEventExporter,
                                       MetricsConfig metricsConfig,
                                       FlushConfig flushConfig) {
        return new RollupFlusher(rollupBuffer, rollupRepository, rawEventExporter, metricsConfig,
                Duration.ofMillis(flushConfig.getIntervalMs()));
    }

    // ==================== Services ====================

    @Bean
    public EventIngestService eventIngestService(RollupBuffer rollupBuffer, MetricsConfig metricsConfig, Clock clock) {
        return new EventIngestService(rollupBuffer, metricsConfig, clock);
    }

    @Bean
    public RollupStatsService rollupStatsService(RollupRepository rollupRepository) {
        return new RollupStatsService(rollupRepository);
    }
}
