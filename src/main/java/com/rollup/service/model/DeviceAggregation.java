package com.rollup.service.model;

import lombok.Getter;

/**
 * Rollup of traffic for one date and browser/OS pair.
 */
@Getter
public class DeviceAggregation {

    private final String date;
    private final String browser;
    private final String os;
    private long visitors;

    public DeviceAggregation(String date, String browser, String os) {
        this(date, browser, os, 0);
    }

    public DeviceAggregation(String date, String browser, String os, long visitors) {
        this.date = date;
        this.browser = browser;
        this.os = os;
        this.visitors = visitors;
    }

    public void increment() {
        visitors++;
    }

    public void addCounters(DeviceAggregation other) {
        visitors += other.visitors;
    }

    public String key() {
        return RollupKeys.deviceKey(date, browser, os);
    }
}
