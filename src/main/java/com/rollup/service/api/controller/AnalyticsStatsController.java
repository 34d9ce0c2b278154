package com.rollup.service.api.controller;

import com.rollup.service.api.dto.AnalyticsConfigResponse;
import com.rollup.service.api.dto.ApiResponse;
import com.rollup.service.api.dto.DeviceBreakdownResponse;
import com.rollup.service.api.dto.FlushStatusResponse;
import com.rollup.service.api.dto.StatsResponse;
import com.rollup.service.api.dto.TopPagesResponse;
import com.rollup.service.api.dto.TopSourcesResponse;
import com.rollup.service.buffer.RollupBuffer;
import com.rollup.service.config.FlushConfig;
import com.rollup.service.config.RetentionConfig;
import com.rollup.service.config.RollupConfig;
import com.rollup.service.flush.RollupFlusher;
import com.rollup.service.ingest.AnalyticsDisabledException;
import com.rollup.service.persistence.DateRange;
import com.rollup.service.stats.RollupStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;

/**
 * Controller for analytics statistics and engine operations.
 */
@Slf4j
@RestController
@RequestMapping("/api/analytics")
@Tag(name = "Analytics", description = "Traffic statistics served from committed rollups")
@RequiredArgsConstructor
public class AnalyticsStatsController {

    private final RollupStatsService statsService;
    private final RollupFlusher flusher;
    private final RollupBuffer buffer;
    private final RollupConfig rollupConfig;
    private final FlushConfig flushConfig;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    // ==================== Statistics ====================

    @GetMapping("/stats")
    @Operation(summary = "Traffic summary", description = "Total pageviews, unique visitors and a daily series")
    public ResponseEntity<ApiResponse<StatsResponse>> getStats(
            @Parameter(description = "today, 7d, 30d or 90d") @RequestParam(required = false) String range) {
        requireEnabled();
        return ResponseEntity.ok(ApiResponse.success(statsService.stats(resolve(range))));
    }

    @GetMapping("/top-pages")
    @Operation(summary = "Top pages", description = "Pages ranked by pageviews")
    public ResponseEntity<ApiResponse<TopPagesResponse>> getTopPages(
            @Parameter(description = "today, 7d, 30d or 90d") @RequestParam(required = false) String range,
            @Parameter(description = "Maximum entries, 1 to 100") @RequestParam(required = false) String limit) {
        requireEnabled();
        return ResponseEntity.ok(ApiResponse.success(statsService.topPages(resolve(range), parseLimit(limit))));
    }

    @GetMapping("/top-sources")
    @Operation(summary = "Top sources", description = "Referrer domains ranked by visitors")
    public ResponseEntity<ApiResponse<TopSourcesResponse>> getTopSources(
            @Parameter(description = "today, 7d, 30d or 90d") @RequestParam(required = false) String range,
            @Parameter(description = "Maximum entries, 1 to 100") @RequestParam(required = false) String limit) {
        requireEnabled();
        return ResponseEntity.ok(ApiResponse.success(statsService.topSources(resolve(range), parseLimit(limit))));
    }

    @GetMapping("/devices")
    @Operation(summary = "Device breakdown", description = "Visitors grouped by browser and by operating system")
    public ResponseEntity<ApiResponse<DeviceBreakdownResponse>> getDevices(
            @Parameter(description = "today, 7d, 30d or 90d") @RequestParam(required = false) String range) {
        requireEnabled();
        return ResponseEntity.ok(ApiResponse.success(statsService.devices(resolve(range))));
    }

    // ==================== Operations ====================

    @PostMapping("/flush")
    @Operation(summary = "Flush now", description = "Commits buffered rollups with the configured retry policy")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Rollups committed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Store unavailable, rollups kept in buffer")
    })
    public ResponseEntity<ApiResponse<FlushStatusResponse>> flush() {
        requireEnabled();
        var retry = flushConfig.getRetry();
        flusher.flushWithRetry(retry.getMaxRetries(), Duration.ofMillis(retry.getDelayMs()));

        log.info("Manual flush completed");
        return ResponseEntity.ok(ApiResponse.success(FlushStatusResponse.builder()
                .bufferedEvents(buffer.size())
                .pendingRollups(buffer.aggregationCount() + buffer.sourceAggregationCount()
                        + buffer.deviceAggregationCount())
                .lastSuccessfulFlush(flusher.getLastSuccessfulFlush())
                .build()));
    }

    @GetMapping("/config")
    @Operation(summary = "Analytics settings", description = "Effective analytics configuration")
    public ResponseEntity<ApiResponse<AnalyticsConfigResponse>> getConfig() {
        var features = rollupConfig.getFeatures();
        return ResponseEntity.ok(ApiResponse.success(AnalyticsConfigResponse.builder()
                .enabled(rollupConfig.isEnabled())
                .flushIntervalMs(flusher.getInterval().toMillis())
                .retentionDays(retentionConfig.getDays())
                .rawExportEnabled(features.isRawExportEnabled())
                .neo4jEnabled(features.isNeo4jEnabled())
                .build()));
    }

    // ==================== Helper Methods ====================

    private void requireEnabled() {
        if (!rollupConfig.isEnabled()) {
            throw new AnalyticsDisabledException();
        }
    }

    private DateRange resolve(String range) {
        return DateRange.parse(range, clock);
    }

    /**
     * Missing, malformed or non-positive limits mean the default.
     */
    static int parseLimit(String limit) {
        if (limit == null || limit.isBlank()) {
            return RollupStatsService.clampLimit(0);
        }
        try {
            return RollupStatsService.clampLimit(Integer.parseInt(limit.trim()));
        } catch (NumberFormatException e) {
            return RollupStatsService.clampLimit(0);
        }
    }
}
