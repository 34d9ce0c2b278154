package com.rollup.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the periodic flush.
 *
 * Controls the flush interval, retry behaviour and the raw export target.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "rollup.flush")
public class FlushConfig {

    /**
     * Flush interval in milliseconds.
     */
    private long intervalMs = 10000;

    /**
     * Retry settings for explicit flushes.
     */
    private RetryConfig retry = new RetryConfig();

    /**
     * Raw export settings.
     */
    private RawExportConfig rawExport = new RawExportConfig();

    @Getter
    @Setter
    public static class RetryConfig {

        /**
         * Retries after the first attempt.
         */
        private int maxRetries = 3;

        /**
         * Base delay for exponential backoff in milliseconds.
         */
        private long delayMs = 500;
    }

    @Getter
    @Setter
    public static class RawExportConfig {

        /**
         * Directory receiving raw event files, one sub-directory per day.
         */
        private String directory = "./data/raw-events";
    }
}
