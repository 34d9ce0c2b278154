package com.rollup.service.buffer;

import com.rollup.service.model.AnalyticsEvent;
import com.rollup.service.model.DeviceAggregation;
import com.rollup.service.model.PathAggregation;
import com.rollup.service.model.SourceAggregation;

import java.util.List;
import java.util.Map;

/**
 * Interface for the in-memory rollup buffer.
 *
 * Every pushed event forks into a raw append-only list and three rollup maps
 * (by date+path, date+source, date+browser/os). Drained collections are handed over to
 * the caller and are no longer referenced by the buffer; the caller must either commit
 * them or give them back through the matching restore method.
 */
public interface RollupBuffer {

    /**
     * Adds an event to the raw list and updates all rollups. A null event is ignored.
     *
     * @param event the event to record
     */
    void push(AnalyticsEvent event);

    /**
     * Takes the raw event list and resets it, along with the raw size estimate.
     *
     * @return the events pushed since the last raw drain
     */
    List<AnalyticsEvent> drainRaw();

    /**
     * Takes the path rollups and replaces them with an empty map.
     *
     * @return rollups keyed by {@code date|path}
     */
    Map<String, PathAggregation> drainAggregations();

    /**
     * Takes the source rollups and replaces them with an empty map.
     *
     * @return rollups keyed by {@code date|source}
     */
    Map<String, SourceAggregation> drainSourceAggregations();

    /**
     * Takes the device rollups and replaces them with an empty map.
     *
     * @return rollups keyed by {@code date|browser|os}
     */
    Map<String, DeviceAggregation> drainDeviceAggregations();

    /**
     * Merges previously drained path rollups back into the live map. Counters are
     * added and sketches unioned for keys that accumulated new data since the drain.
     *
     * @param aggregations drained rollups, may be null or empty
     */
    void restoreAggregations(Map<String, PathAggregation> aggregations);

    /**
     * Merges previously drained source rollups back into the live map.
     *
     * @param aggregations drained rollups, may be null or empty
     */
    void restoreSourceAggregations(Map<String, SourceAggregation> aggregations);

    /**
     * Merges previously drained device rollups back into the live map.
     *
     * @param aggregations drained rollups, may be null or empty
     */
    void restoreDeviceAggregations(Map<String, DeviceAggregation> aggregations);

    /**
     * Whether the raw size estimate has reached the configured threshold.
     */
    boolean shouldFlushRaw();

    /**
     * Number of events in the raw list.
     */
    int size();

    /**
     * Estimated raw list size in bytes.
     */
    long rawSize();

    /**
     * Number of live path rollups.
     */
    int aggregationCount();

    /**
     * Number of live source rollups.
     */
    int sourceAggregationCount();

    /**
     * Number of live device rollups.
     */
    int deviceAggregationCount();
}
