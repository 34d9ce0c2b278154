package com.rollup.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for the top referrer sources of a date range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopSourcesResponse {

    private List<SourceEntry> sources;

    private String startDate;

    private String endDate;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceEntry {
        private String source;
        private long visitors;
    }
}
