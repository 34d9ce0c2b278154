package com.rollup.service.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * DTO for analytics event ingestion requests.
 *
 * Represents a batch of already classified events (browser, os and device resolved by
 * the client, path normalized).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventIngestRequest {

    /**
     * Events in this batch.
     */
    @NotEmpty(message = "events cannot be empty")
    private List<@Valid EventDto> events;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventDto {

        /**
         * Client side event id, generated when absent.
         */
        private String eventId;

        /**
         * Event name, e.g. pageview.
         */
        @Builder.Default
        private String name = "pageview";

        /**
         * When the event happened; defaults to the time of receipt.
         */
        private Instant timestamp;

        /**
         * Session identifier, counted for unique visitors.
         */
        @NotBlank(message = "sessionId is required")
        private String sessionId;

        private String userId;

        /**
         * Normalized page path.
         */
        @NotBlank(message = "path is required")
        private String path;

        private String query;

        private String referrer;

        private String title;

        private String userAgent;

        private String browser;

        private String os;

        private String device;

        private String language;

        /**
         * Time spent on the page in milliseconds.
         */
        @PositiveOrZero(message = "durationMs must not be negative")
        private Long durationMs;

        /**
         * Free-form event properties.
         */
        private Map<String, Object> properties;
    }
}
