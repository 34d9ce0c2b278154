package com.rollup.service.persistence;

import com.rollup.service.model.DeviceAggregation;

/**
 * Rollup row for one date and browser/os pair.
 */
public record DeviceRollup(String id, String date, String browser, String os, long visitors) {

    public static DeviceRollup from(DeviceAggregation aggregation) {
        return new DeviceRollup(aggregation.key(), aggregation.getDate(),
                aggregation.getBrowser(), aggregation.getOs(), aggregation.getVisitors());
    }
}
