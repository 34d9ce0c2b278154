package com.rollup.service.persistence;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RollupRepository.
 *
 * Rows live in concurrent maps keyed by row id; each upsert is an atomic
 * {@code compute} on its key. Used when Neo4j persistence is disabled and in tests.
 */
@Slf4j
public class InMemoryRollupRepository implements RollupRepository {

    private final Map<String, PathRollup> pathRollups = new ConcurrentHashMap<>();
    private final Map<String, SourceRollup> sourceRollups = new ConcurrentHashMap<>();
    private final Map<String, DeviceRollup> deviceRollups = new ConcurrentHashMap<>();
    private final SketchMerger sketchMerger;

    public InMemoryRollupRepository() {
        this(new SketchMerger());
    }

    public InMemoryRollupRepository(SketchMerger sketchMerger) {
        this.sketchMerger = sketchMerger;
        log.info("InMemoryRollupRepository initialized");
    }

    // ==================== Upserts ====================

    @Override
    public void upsertPathRollup(PathRollup rollup) {
        pathRollups.compute(rollup.id(), (id, stored) -> sketchMerger.merge(stored, rollup));
    }

    @Override
    public void upsertSourceRollup(SourceRollup rollup) {
        sourceRollups.merge(rollup.id(), rollup, (stored, incoming) -> new SourceRollup(
                stored.id(), stored.date(), stored.source(), stored.visitors() + incoming.visitors()));
    }

    @Override
    public void upsertDeviceRollup(DeviceRollup rollup) {
        deviceRollups.merge(rollup.id(), rollup, (stored, incoming) -> new DeviceRollup(
                stored.id(), stored.date(), stored.browser(), stored.os(),
                stored.visitors() + incoming.visitors()));
    }

    // ==================== Queries ====================

    @Override
    public List<PathRollup> queryPathRollups(DateRange range) {
        return pathRollups.values().stream()
                .filter(rollup -> range.contains(rollup.date()))
                .sorted(Comparator.comparing(PathRollup::date).thenComparing(PathRollup::path))
                .collect(Collectors.toList());
    }

    @Override
    public List<PathTotal> queryTopPaths(DateRange range, int limit) {
        Map<String, long[]> totals = new LinkedHashMap<>();
        pathRollups.values().stream()
                .filter(rollup -> range.contains(rollup.date()))
                .forEach(rollup -> {
                    long[] sums = totals.computeIfAbsent(rollup.path(), p -> new long[2]);
                    sums[0] += rollup.pageviews();
                    sums[1] += rollup.visitors();
                });

        return totals.entrySet().stream()
                .map(e -> new PathTotal(e.getKey(), e.getValue()[0], e.getValue()[1]))
                .sorted(Comparator.comparingLong(PathTotal::pageviews).reversed()
                        .thenComparing(PathTotal::path))
                .limit(RollupRepository.effectiveLimit(limit))
                .collect(Collectors.toList());
    }

    @Override
    public List<SourceTotal> queryTopSources(DateRange range, int limit) {
        return sumBy(sourceRollups, range, SourceRollup::date, SourceRollup::source, SourceRollup::visitors)
                .entrySet().stream()
                .map(e -> new SourceTotal(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(SourceTotal::visitors).reversed()
                        .thenComparing(SourceTotal::source))
                .limit(RollupRepository.effectiveLimit(limit))
                .collect(Collectors.toList());
    }

    @Override
    public List<DeviceTotal> queryDeviceBreakdown(DateRange range) {
        Map<List<String>, Long> totals = sumBy(deviceRollups, range, DeviceRollup::date,
                rollup -> List.of(rollup.browser(), rollup.os()), DeviceRollup::visitors);

        return totals.entrySet().stream()
                .map(e -> new DeviceTotal(e.getKey().get(0), e.getKey().get(1), e.getValue()))
                .sorted(Comparator.comparingLong(DeviceTotal::visitors).reversed()
                        .thenComparing(DeviceTotal::browser)
                        .thenComparing(DeviceTotal::os))
                .collect(Collectors.toList());
    }

    @Override
    public List<byte[]> queryCardinalitySketches(DateRange range) {
        return queryPathRollups(range).stream()
                .filter(PathRollup::hasSketch)
                .map(PathRollup::sketch)
                .collect(Collectors.toList());
    }

    // ==================== Retention ====================

    @Override
    public long deleteOlderThan(LocalDate cutoff) {
        String cutoffKey = cutoff.toString();
        long removed = removeBefore(pathRollups, cutoffKey, PathRollup::date)
                + removeBefore(sourceRollups, cutoffKey, SourceRollup::date)
                + removeBefore(deviceRollups, cutoffKey, DeviceRollup::date);
        log.debug("Deleted {} rollup rows dated before {}", removed, cutoff);
        return removed;
    }

    // ==================== Private Helpers ====================

    private static <R, K> Map<K, Long> sumBy(Map<String, R> rows, DateRange range,
                                             Function<R, String> date,
                                             Function<R, K> dimension,
                                             ToLongFunction<R> visitors) {
        return rows.values().stream()
                .filter(row -> range.contains(date.apply(row)))
                .collect(Collectors.groupingBy(dimension, LinkedHashMap::new,
                        Collectors.summingLong(visitors)));
    }

    private static <R> long removeBefore(Map<String, R> rows, String cutoffKey, Function<R, String> date) {
        List<String> expired = new ArrayList<>();
        rows.forEach((id, row) -> {
            if (date.apply(row).compareTo(cutoffKey) < 0) {
                expired.add(id);
            }
        });
        expired.forEach(rows::remove);
        return expired.size();
    }

    public int pathRowCount() {
        return pathRollups.size();
    }
}
