package com.rollup.service.stats;

import com.rollup.service.api.dto.DeviceBreakdownResponse.NamedCount;
import com.rollup.service.persistence.DateRange;
import com.rollup.service.persistence.DeviceRollup;
import com.rollup.service.persistence.InMemoryRollupRepository;
import com.rollup.service.persistence.PathRollup;
import com.rollup.service.persistence.SourceRollup;
import com.rollup.service.sketch.CardinalitySketch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RollupStatsServiceTest {

    private static final DateRange RANGE =
            new DateRange(LocalDate.parse("2024-05-01"), LocalDate.parse("2024-05-07"));

    private InMemoryRollupRepository repository;
    private RollupStatsService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRollupRepository();
        service = new RollupStatsService(repository);
    }

    @Test
    @DisplayName("Summary unions sketches so a visitor seen on two days counts once")
    void statsMergesVisitorsAcrossDays() {
        repository.upsertPathRollup(path("2024-05-01", "/home", 4, 3000, 3, "a", "b", "c"));
        repository.upsertPathRollup(path("2024-05-02", "/home", 2, 1000, 1, "a", "d"));

        var stats = service.stats(RANGE);

        assertThat(stats.getSummary().getTotalPv()).isEqualTo(6);
        assertThat(stats.getSummary().getTotalUv()).isEqualTo(4);
        assertThat(stats.getSummary().getAvgDurationMs()).isEqualTo(1000);
        assertThat(stats.getDaily())
                .extracting("date", "pv", "uv")
                .containsExactly(tuple("2024-05-01", 4L, 3L), tuple("2024-05-02", 2L, 2L));
        assertThat(stats.getStartDate()).isEqualTo("2024-05-01");
        assertThat(stats.getEndDate()).isEqualTo("2024-05-07");
    }

    @Test
    void statsWithoutSketchesSumsDailyVisitors() {
        repository.upsertPathRollup(new PathRollup("2024-05-01|/a", "2024-05-01", "/a", 3, 2, 0, 0, null));
        repository.upsertPathRollup(new PathRollup("2024-05-03|/a", "2024-05-03", "/a", 1, 1, 0, 0, null));

        var summary = service.stats(RANGE).getSummary();

        assertThat(summary.getTotalUv()).isEqualTo(3);
        assertThat(summary.getAvgDurationMs()).isZero();
    }

    @Test
    void statsOfEmptyRange() {
        var stats = service.stats(RANGE);

        assertThat(stats.getDaily()).isEmpty();
        assertThat(stats.getSummary().getTotalPv()).isZero();
        assertThat(stats.getSummary().getTotalUv()).isZero();
    }

    @Test
    void topPagesHonoursLimit() {
        for (int i = 1; i <= 5; i++) {
            repository.upsertPathRollup(path("2024-05-01", "/p" + i, i, 0, 0, "v"));
        }

        assertThat(service.topPages(RANGE, 2).getPages())
                .extracting("path", "pv")
                .containsExactly(tuple("/p5", 5L), tuple("/p4", 4L));
    }

    @Test
    void topSources() {
        repository.upsertSourceRollup(new SourceRollup("2024-05-01|direct", "2024-05-01", "direct", 1));
        repository.upsertSourceRollup(new SourceRollup("2024-05-01|google.com", "2024-05-01", "google.com", 2));
        repository.upsertSourceRollup(new SourceRollup("2024-05-02|google.com", "2024-05-02", "google.com", 1));

        assertThat(service.topSources(RANGE, 10).getSources())
                .extracting("source", "visitors")
                .containsExactly(tuple("google.com", 3L), tuple("direct", 1L));
    }

    @Test
    @DisplayName("Device breakdown groups by browser and by operating system")
    void devices() {
        repository.upsertDeviceRollup(new DeviceRollup("2024-05-01|Chrome|Windows", "2024-05-01", "Chrome", "Windows", 3));
        repository.upsertDeviceRollup(new DeviceRollup("2024-05-01|Chrome|macOS", "2024-05-01", "Chrome", "macOS", 2));
        repository.upsertDeviceRollup(new DeviceRollup("2024-05-01|Safari|macOS", "2024-05-01", "Safari", "macOS", 2));

        var devices = service.devices(RANGE);

        assertThat(devices.getBrowsers()).containsExactly(new NamedCount("Chrome", 5), new NamedCount("Safari", 2));
        assertThat(devices.getOs()).containsExactly(new NamedCount("macOS", 4), new NamedCount("Windows", 3));
    }

    @Test
    void clampLimit() {
        assertThat(RollupStatsService.clampLimit(0)).isEqualTo(10);
        assertThat(RollupStatsService.clampLimit(-5)).isEqualTo(10);
        assertThat(RollupStatsService.clampLimit(25)).isEqualTo(25);
        assertThat(RollupStatsService.clampLimit(1000)).isEqualTo(100);
    }

    private static PathRollup path(String date, String path, long pageviews, long durationSum,
                                   long samples, String... visitors) {
        var sketch = new CardinalitySketch();
        for (String visitor : visitors) {
            sketch.add(visitor);
        }
        return new PathRollup(date + "|" + path, date, path, pageviews, sketch.estimate(),
                durationSum, samples, sketch.serialize());
    }
}
