package com.rollup.service.model;

import com.rollup.service.sketch.CardinalitySketch;
import lombok.Getter;

/**
 * Rollup of all events for one date and path.
 *
 * Mutable; a live instance is only touched under the owning buffer's write lock, a
 * drained instance belongs to whoever drained it.
 */
@Getter
public class PathAggregation {

    private final String date;
    private final String path;
    private long pageviews;
    private long visits;
    private long durationSum;
    private long sampleCount;
    private CardinalitySketch sketch;

    public PathAggregation(String date, String path, int sketchPrecision) {
        this(date, path, 0, 0, 0, 0, new CardinalitySketch(sketchPrecision));
    }

    public PathAggregation(String date, String path, long pageviews, long visits,
                           long durationSum, long sampleCount, CardinalitySketch sketch) {
        this.date = date;
        this.path = path;
        this.pageviews = pageviews;
        this.visits = visits;
        this.durationSum = durationSum;
        this.sampleCount = sampleCount;
        this.sketch = sketch;
    }

    public void record(AnalyticsEvent event) {
        pageviews++;
        visits++;
        Long duration = event.getDurationMs();
        if (duration != null && duration > 0) {
            durationSum += duration;
            sampleCount++;
        }
        sketch.add(event.getSessionId());
    }

    /**
     * Adds the counters of an older snapshot for the same key.
     */
    public void addCounters(PathAggregation other) {
        pageviews += other.pageviews;
        visits += other.visits;
        durationSum += other.durationSum;
        sampleCount += other.sampleCount;
    }

    public void replaceSketch(CardinalitySketch replacement) {
        this.sketch = replacement;
    }

    public String key() {
        return RollupKeys.pathKey(date, path);
    }

    /**
     * Unique visitors: the sketch estimate, or the raw visit count when no session id
     * was ever recorded.
     */
    public long visitors() {
        return sketch == null || sketch.isEmpty() ? visits : sketch.estimate();
    }
}
