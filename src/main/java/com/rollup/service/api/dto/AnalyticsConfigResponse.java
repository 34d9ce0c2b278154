package com.rollup.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO exposing the effective analytics settings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsConfigResponse {

    private boolean enabled;

    private long flushIntervalMs;

    private int retentionDays;

    private boolean rawExportEnabled;

    private boolean neo4jEnabled;
}
