package com.rollup.service.persistence;

import com.rollup.service.model.SourceAggregation;

/**
 * Rollup row for one date and referrer source.
 */
public record SourceRollup(String id, String date, String source, long visitors) {

    public static SourceRollup from(SourceAggregation aggregation) {
        return new SourceRollup(aggregation.key(), aggregation.getDate(),
                aggregation.getSource(), aggregation.getVisitors());
    }
}
