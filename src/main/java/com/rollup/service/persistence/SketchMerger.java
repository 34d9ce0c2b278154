package com.rollup.service.persistence;

import com.rollup.service.sketch.CardinalitySketch;
import com.rollup.service.sketch.SketchFormatException;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;

/**
 * Combines a stored path row with an incoming one.
 *
 * Sketches are unioned and visitors re-estimated from the union. When either sketch
 * cannot be read the merge degrades: the most recent valid sketch is kept and visitors
 * are added. Pageviews are never affected by a sketch failure.
 */
@Slf4j
public class SketchMerger {

    private final Counter degradedMerges;

    public SketchMerger() {
        this(null);
    }

    public SketchMerger(Counter degradedMerges) {
        this.degradedMerges = degradedMerges;
    }

    /**
     * @param stored   current row, null when the id is new
     * @param incoming row being upserted
     * @return the row to store
     */
    public PathRollup merge(PathRollup stored, PathRollup incoming) {
        if (stored == null) {
            return incoming;
        }
        var sketch = mergeSketches(stored, incoming);
        return new PathRollup(
                incoming.id(),
                incoming.date(),
                incoming.path(),
                stored.pageviews() + incoming.pageviews(),
                sketch.visitors,
                stored.durationSum() + incoming.durationSum(),
                stored.sampleCount() + incoming.sampleCount(),
                sketch.bytes);
    }

    private MergedSketch mergeSketches(PathRollup stored, PathRollup incoming) {
        long additive = stored.visitors() + incoming.visitors();

        if (!incoming.hasSketch()) {
            return new MergedSketch(stored.sketch(), additive);
        }
        if (!stored.hasSketch()) {
            return new MergedSketch(incoming.sketch(), additive);
        }

        try {
            var union = CardinalitySketch.deserialize(stored.sketch());
            union.merge(incoming.sketch());
            return new MergedSketch(union.serialize(), union.estimate());
        } catch (SketchFormatException e) {
            return degrade(stored, incoming, additive, e);
        }
    }

    private MergedSketch degrade(PathRollup stored, PathRollup incoming, long additive, SketchFormatException e) {
        log.warn("Sketch union failed for {}, falling back to additive visitors: {}", incoming.id(), e.getMessage());
        if (degradedMerges != null) {
            degradedMerges.increment();
        }
        byte[] kept = isValid(incoming.sketch()) ? incoming.sketch()
                : isValid(stored.sketch()) ? stored.sketch() : null;
        return new MergedSketch(kept, additive);
    }

    static boolean isValid(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return false;
        }
        try {
            CardinalitySketch.deserialize(bytes);
            return true;
        } catch (SketchFormatException e) {
            return false;
        }
    }

    private record MergedSketch(byte[] bytes, long visitors) {
    }
}
