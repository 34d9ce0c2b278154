package com.rollup.service.persistence;

import com.rollup.service.model.PathAggregation;

/**
 * Stored (or to-be-stored) rollup row for one date and path.
 *
 * @param id          row id, {@code date|path}
 * @param sketch      serialized unique-visitor sketch, may be null
 */
public record PathRollup(String id, String date, String path, long pageviews, long visitors,
                         long durationSum, long sampleCount, byte[] sketch) {

    public static PathRollup from(PathAggregation aggregation) {
        var sketch = aggregation.getSketch();
        return new PathRollup(
                aggregation.key(),
                aggregation.getDate(),
                aggregation.getPath(),
                aggregation.getPageviews(),
                aggregation.visitors(),
                aggregation.getDurationSum(),
                aggregation.getSampleCount(),
                sketch == null || sketch.isEmpty() ? null : sketch.serialize());
    }

    public boolean hasSketch() {
        return sketch != null && sketch.length > 0;
    }
}
