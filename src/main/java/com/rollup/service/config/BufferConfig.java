package com.rollup.service.config;

import com.rollup.service.sketch.CardinalitySketch;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the in-memory rollup buffer.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "rollup.buffer")
public class BufferConfig {

    /**
     * Estimated raw buffer size in bytes at which a raw export is attempted (default: 16 MiB).
     */
    private int maxRawBytes = 16 * 1024 * 1024;

    /**
     * HyperLogLog precision for unique visitor sketches (4..18).
     */
    private int sketchPrecision = CardinalitySketch.DEFAULT_PRECISION;
}
