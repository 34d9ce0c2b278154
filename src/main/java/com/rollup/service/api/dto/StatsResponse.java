package com.rollup.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for the traffic summary of a date range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsResponse {

    private Summary summary;

    /**
     * One entry per day that has data, ascending by date.
     */
    private List<DailyStat> daily;

    private String startDate;

    private String endDate;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {

        /**
         * Total pageviews in the range.
         */
        private long totalPv;

        /**
         * Unique visitors across the whole range, estimated from merged daily sketches.
         */
        private long totalUv;

        /**
         * Average time on page in milliseconds, 0 without samples.
         */
        private long avgDurationMs;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyStat {
        private String date;
        private long pv;
        private long uv;
    }
}
