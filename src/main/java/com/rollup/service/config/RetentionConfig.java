package com.rollup.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for rollup retention in the durable store.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "rollup.retention")
public class RetentionConfig {

    /**
     * Days of rollups to keep (0 = keep forever).
     */
    private int days = 90;

    /**
     * Pruning check interval in milliseconds.
     */
    private long intervalMs = 3600000; // 1 hour
}
