package com.rollup.service.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A single analytics event as handed to the rollup buffer.
 *
 * Instances are created by the ingestion layer after validation, classification
 * (browser/os/device) and path normalization, and are never mutated afterwards.
 */
@Value
@Builder
public class AnalyticsEvent {

    String id;

    /**
     * Event name, e.g. {@code pageview}.
     */
    String name;

    Instant timestamp;

    String sessionId;

    String userId;

    /**
     * Normalized request path.
     */
    String path;

    String query;

    String referrer;

    String title;

    String userAgent;

    String browser;

    String os;

    String device;

    String language;

    /**
     * Optional dwell time on the page in milliseconds.
     */
    Long durationMs;

    Map<String, Object> properties;
}
