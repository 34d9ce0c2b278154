package com.rollup.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the rollup service.
 *
 * Provides custom metrics for ingestion, flush and raw export operations.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter eventsPushed;
    private final Counter flushesCompleted;
    private final Counter flushFailures;
    private final Counter flushRestores;
    private final Counter rawExportsCompleted;
    private final Counter rawExportFailures;
    private final Counter sketchMergeFailures;

    // Timers
    private final Timer flushTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.eventsPushed = Counter.builder("rollup.events.pushed")
                .description("Number of events pushed into the rollup buffer")
                .register(registry);

        this.flushesCompleted = Counter.builder("rollup.flush.count")
                .description("Number of flushes that committed all drained rollups")
                .register(registry);

        this.flushFailures = Counter.builder("rollup.flush.failures")
                .description("Number of failed flush attempts")
                .register(registry);

        this.flushRestores = Counter.builder("rollup.flush.restored")
                .description("Number of times drained rollups were restored into the buffer")
                .register(registry);

        this.rawExportsCompleted = Counter.builder("rollup.raw.export.count")
                .description("Number of raw event batches exported")
                .register(registry);

        this.rawExportFailures = Counter.builder("rollup.raw.export.failures")
                .description("Number of raw event exports that failed")
                .register(registry);

        this.sketchMergeFailures = Counter.builder("rollup.sketch.merge.failures")
                .description("Number of sketch unions that fell back to a degraded merge")
                .register(registry);

        this.flushTimer = Timer.builder("rollup.flush.duration")
                .description("Time taken to commit drained rollups")
                .register(registry);
    }

    /**
     * Registers a gauge for buffer size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerBufferGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
