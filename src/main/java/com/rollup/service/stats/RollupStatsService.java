package com.rollup.service.stats;

import com.rollup.service.api.dto.DeviceBreakdownResponse;
import com.rollup.service.api.dto.DeviceBreakdownResponse.NamedCount;
import com.rollup.service.api.dto.StatsResponse;
import com.rollup.service.api.dto.StatsResponse.DailyStat;
import com.rollup.service.api.dto.TopPagesResponse;
import com.rollup.service.api.dto.TopPagesResponse.PageEntry;
import com.rollup.service.api.dto.TopSourcesResponse;
import com.rollup.service.api.dto.TopSourcesResponse.SourceEntry;
import com.rollup.service.persistence.DateRange;
import com.rollup.service.persistence.DeviceTotal;
import com.rollup.service.persistence.PathRollup;
import com.rollup.service.persistence.RollupRepository;
import com.rollup.service.sketch.CardinalitySketch;
import com.rollup.service.sketch.SketchFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read side of the rollups: summaries and rankings over committed data.
 */
@Slf4j
@RequiredArgsConstructor
public class RollupStatsService {

    public static final int MAX_LIMIT = 100;

    private final RollupRepository repository;

    // ==================== Summary ====================

    public StatsResponse stats(DateRange range) {
        var rollups = repository.queryPathRollups(range);

        Map<String, long[]> perDay = new TreeMap<>();
        long totalPv = 0;
        long durationSum = 0;
        long sampleCount = 0;
        for (PathRollup rollup : rollups) {
            long[] day = perDay.computeIfAbsent(rollup.date(), d -> new long[2]);
            day[0] += rollup.pageviews();
            day[1] += rollup.visitors();
            totalPv += rollup.pageviews();
            durationSum += rollup.durationSum();
            sampleCount += rollup.sampleCount();
        }

        var daily = perDay.entrySet().stream()
                .map(e -> DailyStat.builder().date(e.getKey()).pv(e.getValue()[0]).uv(e.getValue()[1]).build())
                .collect(Collectors.toList());

        long totalUv = mergedVisitors(range)
                .orElseGet(() -> perDay.values().stream().mapToLong(day -> day[1]).sum());

        return StatsResponse.builder()
                .summary(StatsResponse.Summary.builder()
                        .totalPv(totalPv)
                        .totalUv(totalUv)
                        .avgDurationMs(sampleCount == 0 ? 0 : durationSum / sampleCount)
                        .build())
                .daily(daily)
                .startDate(range.startKey())
                .endDate(range.endKey())
                .build();
    }

    /**
     * Unique visitors over the whole range from the union of every stored sketch. Empty when
     * there are no sketches or one of them cannot be merged.
     */
    OptionalLong mergedVisitors(DateRange range) {
        List<byte[]> sketches = repository.queryCardinalitySketches(range);
        if (sketches.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            CardinalitySketch union = CardinalitySketch.deserialize(sketches.get(0));
            sketches.subList(1, sketches.size()).forEach(union::merge);
            return OptionalLong.of(union.estimate());
        } catch (SketchFormatException e) {
            log.warn("Could not merge {} sketches for {}..{}, summing daily visitors: {}",
                    sketches.size(), range.startKey(), range.endKey(), e.getMessage());
            return OptionalLong.empty();
        }
    }

    // ==================== Rankings ====================

    public TopPagesResponse topPages(DateRange range, int limit) {
        var pages = repository.queryTopPaths(range, clampLimit(limit)).stream()
                .map(total -> PageEntry.builder()
                        .path(total.path())
                        .pv(total.pageviews())
                        .visitors(total.visitors())
                        .build())
                .collect(Collectors.toList());

        return TopPagesResponse.builder()
                .pages(pages)
                .startDate(range.startKey())
                .endDate(range.endKey())
                .build();
    }

    public TopSourcesResponse topSources(DateRange range, int limit) {
        var sources = repository.queryTopSources(range, clampLimit(limit)).stream()
                .map(total -> SourceEntry.builder()
                        .source(total.source())
                        .visitors(total.visitors())
                        .build())
                .collect(Collectors.toList());

        return TopSourcesResponse.builder()
                .sources(sources)
                .startDate(range.startKey())
                .endDate(range.endKey())
                .build();
    }

    public DeviceBreakdownResponse devices(DateRange range) {
        var breakdown = repository.queryDeviceBreakdown(range);

        return DeviceBreakdownResponse.builder()
                .browsers(groupBy(breakdown, DeviceTotal::browser))
                .os(groupBy(breakdown, DeviceTotal::os))
                .startDate(range.startKey())
                .endDate(range.endKey())
                .build();
    }

    // ==================== Helpers ====================

    /**
     * Non-positive limits fall back to the default; anything above {@value #MAX_LIMIT} is capped.
     */
    public static int clampLimit(int limit) {
        return Math.min(RollupRepository.effectiveLimit(limit), MAX_LIMIT);
    }

    private static List<NamedCount> groupBy(List<DeviceTotal> breakdown, Function<DeviceTotal, String> dimension) {
        Map<String, Long> totals = breakdown.stream()
                .collect(Collectors.groupingBy(dimension, LinkedHashMap::new,
                        Collectors.summingLong(DeviceTotal::visitors)));

        return totals.entrySet().stream()
                .map(e -> NamedCount.builder().name(e.getKey()).visitors(e.getValue()).build())
                .sorted(Comparator.comparingLong(NamedCount::getVisitors).reversed()
                        .thenComparing(NamedCount::getName))
                .collect(Collectors.toList());
    }
}
