package com.rollup.service.persistence;

import java.util.List;

/**
 * Cypher statements used by the Neo4j rollup store.
 *
 * Rollups are stored as standalone nodes labelled PathRollup, SourceRollup and DeviceRollup,
 * unique by {@code id}. All statements are parameterized.
 */
final class RollupCypher {

    static final String PATH_LABEL = "PathRollup";
    static final String SOURCE_LABEL = "SourceRollup";
    static final String DEVICE_LABEL = "DeviceRollup";

    private RollupCypher() {
    }

    // ==================== Schema ====================

    static List<String> constraints() {
        return List.of(PATH_LABEL, SOURCE_LABEL, DEVICE_LABEL).stream()
                .map(label -> "CREATE CONSTRAINT %s_id IF NOT EXISTS FOR (r:%s) REQUIRE r.id IS UNIQUE"
                        .formatted(label.toLowerCase(), label))
                .toList();
    }

    // ==================== Upserts ====================

    /**
     * Creates an empty row when the id is new and write-locks the node before reading it, so
     * concurrent path upserts on one id run one after the other.
     */
    static final String LOCK_PATH_ROLLUP = """
            MERGE (r:PathRollup {id: $id}) \
            ON CREATE SET r.date = $date, r.path = $path, r.pageviews = 0, r.visitors = 0, \
            r.durationSum = 0, r.sampleCount = 0 \
            SET r.updatedAt = timestamp() \
            RETURN r.id AS id, r.date AS date, r.path AS path, r.pageviews AS pageviews, \
            r.visitors AS visitors, r.durationSum AS durationSum, r.sampleCount AS sampleCount, \
            r.sketch AS sketch""";

    static final String WRITE_PATH_ROLLUP = """
            MERGE (r:PathRollup {id: $id}) \
            SET r.date = $date, r.path = $path, r.pageviews = $pageviews, r.visitors = $visitors, \
            r.durationSum = $durationSum, r.sampleCount = $sampleCount, r.sketch = $sketch, \
            r.updatedAt = timestamp()""";

    static final String UPSERT_SOURCE_ROLLUP = """
            MERGE (r:SourceRollup {id: $id}) \
            ON CREATE SET r.date = $date, r.source = $source, r.visitors = $visitors \
            ON MATCH SET r.visitors = r.visitors + $visitors \
            SET r.updatedAt = timestamp()""";

    static final String UPSERT_DEVICE_ROLLUP = """
            MERGE (r:DeviceRollup {id: $id}) \
            ON CREATE SET r.date = $date, r.browser = $browser, r.os = $os, r.visitors = $visitors \
            ON MATCH SET r.visitors = r.visitors + $visitors \
            SET r.updatedAt = timestamp()""";

    // ==================== Queries ====================

    static final String QUERY_PATH_ROLLUPS = """
            MATCH (r:PathRollup) WHERE r.date >= $start AND r.date <= $end \
            RETURN r.id AS id, r.date AS date, r.path AS path, r.pageviews AS pageviews, \
            r.visitors AS visitors, r.durationSum AS durationSum, r.sampleCount AS sampleCount, \
            r.sketch AS sketch \
            ORDER BY r.date, r.path""";

    static final String QUERY_TOP_PATHS = """
            MATCH (r:PathRollup) WHERE r.date >= $start AND r.date <= $end \
            RETURN r.path AS path, sum(r.pageviews) AS pageviews, sum(r.visitors) AS visitors \
            ORDER BY pageviews DESC, path \
            LIMIT $limit""";

    static final String QUERY_TOP_SOURCES = """
            MATCH (r:SourceRollup) WHERE r.date >= $start AND r.date <= $end \
            RETURN r.source AS source, sum(r.visitors) AS visitors \
            ORDER BY visitors DESC, source \
            LIMIT $limit""";

    static final String QUERY_DEVICE_BREAKDOWN = """
            MATCH (r:DeviceRollup) WHERE r.date >= $start AND r.date <= $end \
            RETURN r.browser AS browser, r.os AS os, sum(r.visitors) AS visitors \
            ORDER BY visitors DESC, browser, os""";

    static final String QUERY_SKETCHES = """
            MATCH (r:PathRollup) WHERE r.date >= $start AND r.date <= $end AND r.sketch IS NOT NULL \
            RETURN r.sketch AS sketch \
            ORDER BY r.date, r.path""";

    // ==================== Retention ====================

    static String deleteBefore(String label) {
        return "MATCH (r:%s) WHERE r.date < $cutoff DETACH DELETE r RETURN count(r) AS deleted"
                .formatted(label);
    }
}
