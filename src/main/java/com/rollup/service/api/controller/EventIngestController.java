package com.rollup.service.api.controller;

import com.rollup.service.api.dto.ApiResponse;
import com.rollup.service.api.dto.EventIngestRequest;
import com.rollup.service.config.RollupConfig;
import com.rollup.service.ingest.AnalyticsDisabledException;
import com.rollup.service.ingest.EventIngestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for analytics event ingestion.
 *
 * Handles POST /api/analytics/events. Events are pushed straight into the rollup buffer.
 */
@Slf4j
@RestController
@RequestMapping("/api/analytics/events")
@Tag(name = "Event Ingestion", description = "Endpoints for ingesting analytics events")
@RequiredArgsConstructor
public class EventIngestController {

    private final EventIngestService ingestService;
    private final RollupConfig rollupConfig;

    /**
     * Ingests a batch of events.
     *
     * @param request the event batch
     * @return 202 Accepted with the number of buffered events
     */
    @PostMapping
    @Operation(
            summary = "Ingest analytics events",
            description = "Buffers a batch of events. Rollups become visible to the stats endpoints after the next flush."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Events buffered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Analytics disabled")
    })
    public ResponseEntity<ApiResponse<Integer>> ingestEvents(@Valid @RequestBody EventIngestRequest request) {
        if (!rollupConfig.isEnabled()) {
            throw new AnalyticsDisabledException();
        }

        int accepted = ingestService.ingest(request);

        log.debug("Accepted {} analytics events", accepted);
        return ResponseEntity.accepted()
                .body(ApiResponse.success(accepted));
    }
}
