package com.rollup.service.buffer;

import com.rollup.service.model.AnalyticsEvent;
import com.rollup.service.model.DeviceAggregation;
import com.rollup.service.model.PathAggregation;
import com.rollup.service.model.RollupKeys;
import com.rollup.service.model.SourceAggregation;
import com.rollup.service.sketch.CardinalitySketch;
import com.rollup.service.sketch.SketchFormatException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of RollupBuffer.
 *
 * All state sits behind a single read/write lock: push, drain and restore take the
 * write lock, size accessors the read lock. A drain swaps in fresh collections, so an
 * event pushed after the swap always lands in the next snapshot.
 */
@Slf4j
public class InMemoryRollupBuffer implements RollupBuffer {

    public static final int DEFAULT_MAX_RAW_BYTES = 16 * 1024 * 1024;

    private static final int EVENT_OVERHEAD_BYTES = 200;
    private static final int PROPERTIES_ESTIMATE_BYTES = 100;
    private static final int INITIAL_RAW_CAPACITY = 1024;

    private final long maxRawBytes;
    private final int sketchPrecision;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private List<AnalyticsEvent> rawEvents = new ArrayList<>(INITIAL_RAW_CAPACITY);
    private long rawSize;
    private Map<String, PathAggregation> aggregations = new HashMap<>();
    private Map<String, SourceAggregation> sourceAggregations = new HashMap<>();
    private Map<String, DeviceAggregation> deviceAggregations = new HashMap<>();

    public InMemoryRollupBuffer() {
        this(DEFAULT_MAX_RAW_BYTES, CardinalitySketch.DEFAULT_PRECISION);
    }

    public InMemoryRollupBuffer(long maxRawBytes, int sketchPrecision) {
        this.maxRawBytes = maxRawBytes > 0 ? maxRawBytes : DEFAULT_MAX_RAW_BYTES;
        this.sketchPrecision = sketchPrecision;
        log.info("InMemoryRollupBuffer initialized, max raw bytes: {}, sketch precision: {}",
                this.maxRawBytes, sketchPrecision);
    }

    // ==================== Push ====================

    @Override
    public void push(AnalyticsEvent event) {
        if (event == null) {
            return;
        }
        String date = RollupKeys.dateOf(event.getTimestamp() != null ? event.getTimestamp() : Instant.now());

        lock.writeLock().lock();
        try {
            rawEvents.add(event);
            rawSize += estimateEventSize(event);

            updatePathAggregation(date, event);
            updateSourceAggregation(date, event);
            updateDeviceAggregation(date, event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void updatePathAggregation(String date, AnalyticsEvent event) {
        aggregations
                .computeIfAbsent(RollupKeys.pathKey(date, event.getPath()),
                        k -> new PathAggregation(date, event.getPath(), sketchPrecision))
                .record(event);
    }

    private void updateSourceAggregation(String date, AnalyticsEvent event) {
        String referrer = event.getReferrer();
        if (referrer == null || referrer.isEmpty()) {
            return;
        }
        String domain = ReferrerDomains.extractDomain(referrer);
        String source = domain.isEmpty() ? RollupKeys.DIRECT : domain;

        sourceAggregations
                .computeIfAbsent(RollupKeys.sourceKey(date, source), k -> new SourceAggregation(date, source))
                .increment();
    }

    private void updateDeviceAggregation(String date, AnalyticsEvent event) {
        String browser = RollupKeys.orUnknown(event.getBrowser());
        String os = RollupKeys.orUnknown(event.getOs());

        deviceAggregations
                .computeIfAbsent(RollupKeys.deviceKey(date, browser, os), k -> new DeviceAggregation(date, browser, os))
                .increment();
    }

    // ==================== Drain ====================

    @Override
    public List<AnalyticsEvent> drainRaw() {
        lock.writeLock().lock();
        try {
            List<AnalyticsEvent> drained = rawEvents;
            rawEvents = new ArrayList<>(INITIAL_RAW_CAPACITY);
            rawSize = 0;
            return drained;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, PathAggregation> drainAggregations() {
        lock.writeLock().lock();
        try {
            Map<String, PathAggregation> drained = aggregations;
            aggregations = new HashMap<>();
            return drained;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, SourceAggregation> drainSourceAggregations() {
        lock.writeLock().lock();
        try {
            Map<String, SourceAggregation> drained = sourceAggregations;
            sourceAggregations = new HashMap<>();
            return drained;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, DeviceAggregation> drainDeviceAggregations() {
        lock.writeLock().lock();
        try {
            Map<String, DeviceAggregation> drained = deviceAggregations;
            deviceAggregations = new HashMap<>();
            return drained;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ==================== Restore ====================

    @Override
    public void restoreAggregations(Map<String, PathAggregation> restored) {
        if (restored == null || restored.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            restored.forEach((key, older) -> {
                PathAggregation live = aggregations.get(key);
                if (live == null) {
                    aggregations.put(key, older);
                    return;
                }
                live.addCounters(older);
                reconcileSketch(key, live, older.getSketch());
            });
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Restored {} path aggregations", restored.size());
    }

    /**
     * Unions a restored sketch into the live one. An empty live sketch is replaced
     * outright; an incompatible one is kept unchanged.
     */
    private void reconcileSketch(String key, PathAggregation live, CardinalitySketch older) {
        if (older == null || older.isEmpty()) {
            return;
        }
        CardinalitySketch current = live.getSketch();
        if (current == null || current.isEmpty()) {
            live.replaceSketch(older);
            return;
        }
        try {
            current.merge(older);
        } catch (SketchFormatException e) {
            log.warn("Keeping live sketch for {}, restored sketch could not be merged: {}", key, e.getMessage());
        }
    }

    @Override
    public void restoreSourceAggregations(Map<String, SourceAggregation> restored) {
        if (restored == null || restored.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            restored.forEach((key, older) -> {
                SourceAggregation live = sourceAggregations.putIfAbsent(key, older);
                if (live != null) {
                    live.addCounters(older);
                }
            });
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Restored {} source aggregations", restored.size());
    }

    @Override
    public void restoreDeviceAggregations(Map<String, DeviceAggregation> restored) {
        if (restored == null || restored.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            restored.forEach((key, older) -> {
                DeviceAggregation live = deviceAggregations.putIfAbsent(key, older);
                if (live != null) {
                    live.addCounters(older);
                }
            });
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Restored {} device aggregations", restored.size());
    }

    // ==================== Size Accessors ====================

    @Override
    public boolean shouldFlushRaw() {
        lock.readLock().lock();
        try {
            return rawSize >= maxRawBytes;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return rawEvents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long rawSize() {
        lock.readLock().lock();
        try {
            return rawSize;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int aggregationCount() {
        lock.readLock().lock();
        try {
            return aggregations.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int sourceAggregationCount() {
        lock.readLock().lock();
        try {
            return sourceAggregations.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int deviceAggregationCount() {
        lock.readLock().lock();
        try {
            return deviceAggregations.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getMaxRawBytes() {
        return maxRawBytes;
    }

    // ==================== Private Helpers ====================

    /**
     * Rough per-event footprint: fixed overhead plus string lengths.
     */
    static long estimateEventSize(AnalyticsEvent event) {
        long size = EVENT_OVERHEAD_BYTES;
        size += length(event.getId());
        size += length(event.getName());
        size += length(event.getUserId());
        size += length(event.getSessionId());
        size += length(event.getPath());
        size += length(event.getQuery());
        size += length(event.getReferrer());
        size += length(event.getTitle());
        size += length(event.getUserAgent());
        size += length(event.getBrowser());
        size += length(event.getOs());
        size += length(event.getDevice());
        size += length(event.getLanguage());
        if (event.getProperties() != null && !event.getProperties().isEmpty()) {
            size += PROPERTIES_ESTIMATE_BYTES;
        }
        return size;
    }

    private static int length(String value) {
        return value == null ? 0 : value.length();
    }
}
