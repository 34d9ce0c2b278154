package com.rollup.service.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for visitor counts grouped by browser and by operating system.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceBreakdownResponse {

    private List<NamedCount> browsers;

    private List<NamedCount> os;

    private String startDate;

    private String endDate;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NamedCount {
        private String name;
        private long visitors;
    }
}
