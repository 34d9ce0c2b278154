package com.rollup.service.persistence;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

import static org.neo4j.driver.Values.parameters;

/**
 * Neo4j implementation of RollupRepository.
 *
 * Source and device upserts are single additive MERGE statements. Path upserts lock the
 * row, read it and write the merged one inside one write transaction, since sketch union
 * happens client-side. A new id starts as an empty row.
 */
@Slf4j
public class Neo4jRollupRepository implements RollupRepository {

    private final Driver driver;
    private final SketchMerger sketchMerger;
    private volatile boolean connected = false;

    public Neo4jRollupRepository(Driver driver, SketchMerger sketchMerger) {
        this.driver = driver;
        this.sketchMerger = sketchMerger;
    }

    /**
     * Verifies connectivity and creates the id constraints. A failure is logged only;
     * writes keep failing with RepositoryException until the store comes back.
     */
    public void init() {
        try {
            driver.verifyConnectivity();
            try (Session session = driver.session()) {
                RollupCypher.constraints().forEach(session::run);
            }
            connected = true;
            log.info("Neo4j rollup store ready");
        } catch (Neo4jException e) {
            log.warn("Failed to initialize Neo4j rollup store: {}", e.getMessage());
            connected = false;
        }
    }

    public void close() {
        driver.close();
        log.info("Neo4j driver closed");
    }

    public boolean isConnected() {
        return connected;
    }

    // ==================== Upserts ====================

    @Override
    public void upsertPathRollup(PathRollup rollup) {
        write("path rollup " + rollup.id(), tx -> {
            PathRollup stored = toPathRollup(tx.run(RollupCypher.LOCK_PATH_ROLLUP, parameters(
                    "id", rollup.id(),
                    "date", rollup.date(),
                    "path", rollup.path())).single());
            PathRollup merged = sketchMerger.merge(stored, rollup);
            tx.run(RollupCypher.WRITE_PATH_ROLLUP, pathParameters(merged)).consume();
            return null;
        });
    }

    @Override
    public void upsertSourceRollup(SourceRollup rollup) {
        write("source rollup " + rollup.id(), tx -> tx.run(RollupCypher.UPSERT_SOURCE_ROLLUP, parameters(
                "id", rollup.id(),
                "date", rollup.date(),
                "source", rollup.source(),
                "visitors", rollup.visitors())).consume());
    }

    @Override
    public void upsertDeviceRollup(DeviceRollup rollup) {
        write("device rollup " + rollup.id(), tx -> tx.run(RollupCypher.UPSERT_DEVICE_ROLLUP, parameters(
                "id", rollup.id(),
                "date", rollup.date(),
                "browser", rollup.browser(),
                "os", rollup.os(),
                "visitors", rollup.visitors())).consume());
    }

    // ==================== Queries ====================

    @Override
    public List<PathRollup> queryPathRollups(DateRange range) {
        return query(RollupCypher.QUERY_PATH_ROLLUPS, rangeParameters(range), Neo4jRollupRepository::toPathRollup);
    }

    @Override
    public List<PathTotal> queryTopPaths(DateRange range, int limit) {
        return query(RollupCypher.QUERY_TOP_PATHS, rangeParameters(range, limit), r -> new PathTotal(
                r.get("path").asString(),
                r.get("pageviews").asLong(),
                r.get("visitors").asLong()));
    }

    @Override
    public List<SourceTotal> queryTopSources(DateRange range, int limit) {
        return query(RollupCypher.QUERY_TOP_SOURCES, rangeParameters(range, limit), r -> new SourceTotal(
                r.get("source").asString(),
                r.get("visitors").asLong()));
    }

    @Override
    public List<DeviceTotal> queryDeviceBreakdown(DateRange range) {
        return query(RollupCypher.QUERY_DEVICE_BREAKDOWN, rangeParameters(range), r -> new DeviceTotal(
                r.get("browser").asString(),
                r.get("os").asString(),
                r.get("visitors").asLong()));
    }

    @Override
    public List<byte[]> queryCardinalitySketches(DateRange range) {
        return query(RollupCypher.QUERY_SKETCHES, rangeParameters(range), r -> r.get("sketch").asByteArray());
    }

    // ==================== Retention ====================

    @Override
    public long deleteOlderThan(LocalDate cutoff) {
        long deleted = 0;
        for (String label : List.of(RollupCypher.PATH_LABEL, RollupCypher.SOURCE_LABEL, RollupCypher.DEVICE_LABEL)) {
            deleted += write("retention " + label, tx -> tx.run(
                    RollupCypher.deleteBefore(label), parameters("cutoff", cutoff.toString()))
                    .single().get("deleted").asLong());
        }
        log.info("Deleted {} rollup nodes dated before {}", deleted, cutoff);
        return deleted;
    }

    // ==================== Private Methods ====================

    private <T> T write(String description, Function<TransactionContext, T> work) {
        try (Session session = driver.session()) {
            return session.executeWrite(work::apply);
        } catch (Neo4jException e) {
            throw new RepositoryException("Failed to write " + description + ": " + e.getMessage(), e);
        }
    }

    private <T> List<T> query(String cypher, Value params, Function<Record, T> mapper) {
        try (Session session = driver.session()) {
            return session.executeRead(tx -> tx.run(cypher, params).list(mapper::apply));
        } catch (Neo4jException e) {
            throw new RepositoryException("Failed to query rollups: " + e.getMessage(), e);
        }
    }

    private static Value rangeParameters(DateRange range) {
        return parameters("start", range.startKey(), "end", range.endKey());
    }

    private static Value rangeParameters(DateRange range, int limit) {
        return parameters("start", range.startKey(), "end", range.endKey(),
                "limit", RollupRepository.effectiveLimit(limit));
    }

    private static Value pathParameters(PathRollup rollup) {
        return parameters(
                "id", rollup.id(),
                "date", rollup.date(),
                "path", rollup.path(),
                "pageviews", rollup.pageviews(),
                "visitors", rollup.visitors(),
                "durationSum", rollup.durationSum(),
                "sampleCount", rollup.sampleCount(),
                "sketch", rollup.sketch());
    }

    private static PathRollup toPathRollup(Record record) {
        Value sketch = record.get("sketch");
        return new PathRollup(
                record.get("id").asString(),
                record.get("date").asString(),
                record.get("path").asString(),
                record.get("pageviews").asLong(0),
                record.get("visitors").asLong(0),
                record.get("durationSum").asLong(0),
                record.get("sampleCount").asLong(0),
                sketch.isNull() ? null : sketch.asByteArray());
    }
}
