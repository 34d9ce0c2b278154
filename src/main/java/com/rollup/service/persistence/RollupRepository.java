package com.rollup.service.persistence;

import java.time.LocalDate;
import java.util.List;

/**
 * Durable store for committed rollups.
 *
 * Upserts are additive: writing a row whose id already exists adds the incoming counters
 * to the stored ones and unions the path sketches. An upsert never overwrites counters.
 */
public interface RollupRepository {

    /**
     * Adds a path rollup to the stored row for the same id.
     *
     * @throws RepositoryException if the write failed
     */
    void upsertPathRollup(PathRollup rollup);

    /**
     * Adds a source rollup to the stored row for the same id.
     *
     * @throws RepositoryException if the write failed
     */
    void upsertSourceRollup(SourceRollup rollup);

    /**
     * Adds a device rollup to the stored row for the same id.
     *
     * @throws RepositoryException if the write failed
     */
    void upsertDeviceRollup(DeviceRollup rollup);

    /**
     * Path rollups within the range, ordered by date.
     */
    List<PathRollup> queryPathRollups(DateRange range);

    /**
     * Paths with the most pageviews within the range.
     *
     * @param limit maximum rows, non-positive means 10
     */
    List<PathTotal> queryTopPaths(DateRange range, int limit);

    /**
     * Referrer sources with the most visitors within the range.
     *
     * @param limit maximum rows, non-positive means 10
     */
    List<SourceTotal> queryTopSources(DateRange range, int limit);

    /**
     * Visitors per browser/os pair within the range, most visitors first.
     */
    List<DeviceTotal> queryDeviceBreakdown(DateRange range);

    /**
     * Serialized path sketches within the range, for cross-day unique visitor merging.
     */
    List<byte[]> queryCardinalitySketches(DateRange range);

    /**
     * Deletes every row dated strictly before the cutoff.
     *
     * @return number of rows removed
     */
    long deleteOlderThan(LocalDate cutoff);

    /**
     * Default limit applied when a caller passes a non-positive one.
     */
    int DEFAULT_LIMIT = 10;

    static int effectiveLimit(int limit) {
        return limit <= 0 ? DEFAULT_LIMIT : limit;
    }
}
