package com.rollup.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for the most viewed pages of a date range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopPagesResponse {

    private List<PageEntry> pages;

    private String startDate;

    private String endDate;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PageEntry {
        private String path;
        private long pv;
        private long visitors;
    }
}
