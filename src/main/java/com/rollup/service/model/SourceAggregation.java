package com.rollup.service.model;

import lombok.Getter;

/**
 * Rollup of referred traffic for one date and source domain.
 */
@Getter
public class SourceAggregation {

    private final String date;
    private final String source;
    private long visitors;

    public SourceAggregation(String date, String source) {
        this(date, source, 0);
    }

    public SourceAggregation(String date, String source, long visitors) {
        this.date = date;
        this.source = source;
        this.visitors = visitors;
    }

    public void increment() {
        visitors++;
    }

    public void addCounters(SourceAggregation other) {
        visitors += other.visitors;
    }

    public String key() {
        return RollupKeys.sourceKey(date, source);
    }
}
