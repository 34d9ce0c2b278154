package com.rollup.service.buffer;

import com.rollup.service.model.AnalyticsEvent;
import com.rollup.service.model.PathAggregation;
import com.rollup.service.model.RollupKeys;
import com.rollup.service.sketch.CardinalitySketch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRollupBufferTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
    private static final String TODAY = "2024-05-01";

    private InMemoryRollupBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new InMemoryRollupBuffer(InMemoryRollupBuffer.DEFAULT_MAX_RAW_BYTES, 14);
    }

    // ==================== Push ====================

    @Test
    @DisplayName("Pageviews are counted per date and path")
    void countsPerPath() {
        buffer.push(pageview("/home", "s1"));
        buffer.push(pageview("/home", "s2"));
        buffer.push(pageview("/home", "s1"));
        buffer.push(pageview("/pricing", "s3"));

        Map<String, PathAggregation> drained = buffer.drainAggregations();

        assertThat(drained).hasSize(2);
        assertThat(drained.get(TODAY + "|/home").getPageviews()).isEqualTo(3);
        assertThat(drained.get(TODAY + "|/pricing").getPageviews()).isEqualTo(1);
        assertThat(drained.get(TODAY + "|/home").visitors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Pushing the same event N times counts N pageviews")
    void idempotentCounting() {
        var event = pageview("/docs", "s1");
        for (int i = 0; i < 25; i++) {
            buffer.push(event);
        }

        assertThat(buffer.drainAggregations().get(TODAY + "|/docs").getPageviews()).isEqualTo(25);
        assertThat(buffer.size()).isEqualTo(25);
    }

    @Test
    @DisplayName("Null events are ignored")
    void nullEventIgnored() {
        buffer.push(null);

        assertThat(buffer.size()).isZero();
        assertThat(buffer.aggregationCount()).isZero();
        assertThat(buffer.rawSize()).isZero();
    }

    @Test
    @DisplayName("Referrer domains are rolled up as sources")
    void sourceFromReferrer() {
        buffer.push(event("/home", "s1").referrer("https://google.com/search?q=x").build());
        buffer.push(event("/home", "s2").referrer("https://google.com/search?q=x").build());

        var sources = buffer.drainSourceAggregations();

        assertThat(sources).containsOnlyKeys(TODAY + "|google.com");
        assertThat(sources.get(TODAY + "|google.com").getVisitors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Missing referrer is not direct traffic, an empty domain is")
    void directOnlyForResolvedEmptyDomain() {
        buffer.push(pageview("/home", "s1"));
        buffer.push(event("/home", "s2").referrer("").build());
        assertThat(buffer.sourceAggregationCount()).isZero();

        buffer.push(event("/home", "s3").referrer("https:///landing").build());

        assertThat(buffer.drainSourceAggregations()).containsOnlyKeys(TODAY + "|" + RollupKeys.DIRECT);
    }

    @Test
    @DisplayName("Browser and OS default to Unknown")
    void deviceDefaults() {
        buffer.push(pageview("/home", "s1"));
        buffer.push(event("/home", "s2").browser("Firefox").os("Linux").build());

        var devices = buffer.drainDeviceAggregations();

        assertThat(devices).containsOnlyKeys(TODAY + "|Unknown|Unknown", TODAY + "|Firefox|Linux");
    }

    @Test
    @DisplayName("Events are keyed by the UTC date of their timestamp")
    void utcDateKeys() {
        buffer.push(event("/home", "s1").timestamp(Instant.parse("2024-05-01T23:59:59Z")).build());
        buffer.push(event("/home", "s2").timestamp(Instant.parse("2024-05-02T00:00:00Z")).build());

        assertThat(buffer.drainAggregations()).containsOnlyKeys("2024-05-01|/home", "2024-05-02|/home");
    }

    @Test
    @DisplayName("Dwell time is summed over positive samples")
    void durationSamples() {
        buffer.push(event("/home", "s1").durationMs(1200L).build());
        buffer.push(event("/home", "s2").durationMs(0L).build());
        buffer.push(event("/home", "s3").durationMs(800L).build());

        var aggregation = buffer.drainAggregations().get(TODAY + "|/home");

        assertThat(aggregation.getDurationSum()).isEqualTo(2000);
        assertThat(aggregation.getSampleCount()).isEqualTo(2);
    }

    // ==================== Raw Size ====================

    @Test
    @DisplayName("Raw size is a fixed overhead plus string lengths")
    void rawSizeEstimate() {
        var event = AnalyticsEvent.builder()
                .path("/abc")
                .sessionId("s1")
                .timestamp(NOW)
                .build();
        buffer.push(event);

        assertThat(buffer.rawSize()).isEqualTo(200 + 4 + 2);

        buffer.push(event("/x", "s").properties(Map.of("plan", "pro")).build());
        assertThat(buffer.rawSize()).isEqualTo(206 + 200 + 4 + 8 + 1 + 2 + 100);
    }

    @Test
    @DisplayName("Raw flush is due once the threshold is reached, and draining resets it")
    void shouldFlushRaw() {
        var small = new InMemoryRollupBuffer(1000, 14);
        for (int i = 0; i < 4; i++) {
            small.push(pageview("/p", "s"));
        }
        assertThat(small.shouldFlushRaw()).isFalse();

        small.push(pageview("/p", "s"));
        assertThat(small.shouldFlushRaw()).isTrue();

        assertThat(small.drainRaw()).hasSize(5);
        assertThat(small.shouldFlushRaw()).isFalse();
        assertThat(small.rawSize()).isZero();
    }

    // ==================== Drain ====================

    @Test
    @DisplayName("Drained maps are detached from the buffer")
    void drainHandsOverOwnership() {
        buffer.push(pageview("/home", "s1"));
        var drained = buffer.drainAggregations();

        buffer.push(pageview("/home", "s2"));

        assertThat(drained.get(TODAY + "|/home").getPageviews()).isEqualTo(1);
        assertThat(buffer.aggregationCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Draining one kind leaves the others untouched")
    void drainsAreIndependent() {
        buffer.push(event("/home", "s1").referrer("https://t.co/x").build());

        buffer.drainAggregations();

        assertThat(buffer.aggregationCount()).isZero();
        assertThat(buffer.sourceAggregationCount()).isEqualTo(1);
        assertThat(buffer.deviceAggregationCount()).isEqualTo(1);
        assertThat(buffer.size()).isEqualTo(1);
    }

    // ==================== Restore ====================

    @Test
    @DisplayName("Drain then restore gives back the original counters")
    void drainRestoreRoundTrip() {
        buffer.push(event("/home", "s1").durationMs(500L).build());
        buffer.push(pageview("/home", "s2"));
        buffer.push(pageview("/about", "s1"));

        buffer.restoreAggregations(buffer.drainAggregations());
        var restored = buffer.drainAggregations();

        assertThat(restored).hasSize(2);
        var home = restored.get(TODAY + "|/home");
        assertThat(home.getPageviews()).isEqualTo(2);
        assertThat(home.getDurationSum()).isEqualTo(500);
        assertThat(home.visitors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Restore adds to newer data instead of overwriting it")
    void restoreIsAdditive() {
        buffer.push(event("/home", "s1").referrer("https://google.com").build());
        var oldPaths = buffer.drainAggregations();
        var oldSources = buffer.drainSourceAggregations();
        var oldDevices = buffer.drainDeviceAggregations();

        buffer.push(event("/home", "s2").referrer("https://google.com").build());
        buffer.restoreAggregations(oldPaths);
        buffer.restoreSourceAggregations(oldSources);
        buffer.restoreDeviceAggregations(oldDevices);

        var home = buffer.drainAggregations().get(TODAY + "|/home");
        assertThat(home.getPageviews()).isEqualTo(2);
        assertThat(home.visitors()).isEqualTo(2);
        assertThat(buffer.drainSourceAggregations().get(TODAY + "|google.com").getVisitors()).isEqualTo(2);
        assertThat(buffer.drainDeviceAggregations().get(TODAY + "|Unknown|Unknown").getVisitors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Restoring null or empty maps is a no-op")
    void restoreNothing() {
        buffer.restoreAggregations(null);
        buffer.restoreAggregations(new HashMap<>());
        buffer.restoreSourceAggregations(null);
        buffer.restoreDeviceAggregations(Map.of());

        assertThat(buffer.aggregationCount()).isZero();
    }

    @Test
    @DisplayName("An incompatible restored sketch keeps the live sketch but still adds counters")
    void incompatibleSketchKeepsLive() {
        buffer.push(pageview("/home", "s1"));
        var liveBefore = buffer.drainAggregations().get(TODAY + "|/home").getSketch().copy();
        buffer.restoreAggregations(Map.of(TODAY + "|/home",
                new PathAggregation(TODAY, "/home", 1, 1, 0, 0, liveBefore)));

        var foreign = new CardinalitySketch(10);
        foreign.add("other");
        buffer.restoreAggregations(Map.of(TODAY + "|/home",
                new PathAggregation(TODAY, "/home", 3, 3, 0, 0, foreign)));

        var home = buffer.drainAggregations().get(TODAY + "|/home");
        assertThat(home.getPageviews()).isEqualTo(4);
        assertThat(home.getSketch()).isEqualTo(liveBefore);
    }

    @Test
    @DisplayName("An empty live sketch adopts the restored one")
    void emptyLiveSketchAdoptsRestored() {
        buffer.push(AnalyticsEvent.builder().path("/home").timestamp(NOW).build());
        var restoredSketch = new CardinalitySketch(14);
        restoredSketch.add("s1");
        restoredSketch.add("s2");

        buffer.restoreAggregations(Map.of(TODAY + "|/home",
                new PathAggregation(TODAY, "/home", 2, 2, 0, 0, restoredSketch)));

        assertThat(buffer.drainAggregations().get(TODAY + "|/home").visitors()).isEqualTo(2);
    }

    // ==================== Concurrency ====================

    @Test
    @DisplayName("Concurrent pushes and drains never lose or duplicate a pageview")
    void concurrentPushAndDrain() throws Exception {
        int threads = 8;
        int perThread = 5000;
        ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch start = new CountDownLatch(1);
        AtomicLong drainedPageviews = new AtomicLong();

        for (int t = 0; t < threads; t++) {
            int id = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    buffer.push(pageview("/p" + (i % 10), "s" + id));
                }
                return null;
            });
        }
        var drainer = pool.submit(() -> {
            start.await();
            for (int i = 0; i < 200; i++) {
                buffer.drainAggregations().values()
                        .forEach(a -> drainedPageviews.addAndGet(a.getPageviews()));
                Thread.yield();
            }
            return null;
        });

        start.countDown();
        drainer.get(30, TimeUnit.SECONDS);
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        buffer.drainAggregations().values().forEach(a -> drainedPageviews.addAndGet(a.getPageviews()));
        assertThat(drainedPageviews.get()).isEqualTo((long) threads * perThread);
        assertThat(buffer.size()).isEqualTo(threads * perThread);
    }

    // ==================== Helpers ====================

    private static AnalyticsEvent pageview(String path, String sessionId) {
        return event(path, sessionId).build();
    }

    private static AnalyticsEvent.AnalyticsEventBuilder event(String path, String sessionId) {
        return AnalyticsEvent.builder()
                .id(path + "-" + sessionId)
                .name("pageview")
                .timestamp(NOW)
                .sessionId(sessionId)
                .path(path);
    }
}
