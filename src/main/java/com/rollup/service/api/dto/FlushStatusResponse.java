package com.rollup.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO describing the buffer after a manual flush.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlushStatusResponse {

    /**
     * Raw events still buffered (raw export runs on its own threshold).
     */
    private int bufferedEvents;

    /**
     * Rollups accumulated since the flush drained the buffer.
     */
    private int pendingRollups;

    private Instant lastSuccessfulFlush;
}
