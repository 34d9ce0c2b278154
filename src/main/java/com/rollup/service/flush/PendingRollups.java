package com.rollup.service.flush;

import com.rollup.service.buffer.RollupBuffer;
import com.rollup.service.model.DeviceAggregation;
import com.rollup.service.model.PathAggregation;
import com.rollup.service.model.SourceAggregation;
import com.rollup.service.persistence.DeviceRollup;
import com.rollup.service.persistence.PathRollup;
import com.rollup.service.persistence.RollupRepository;
import com.rollup.service.persistence.SourceRollup;

import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A drained snapshot owned by the flusher until it is committed or handed back.
 *
 * Entries are removed as soon as their upsert succeeds, so whatever remains after a
 * failure is exactly the uncommitted part and can be restored without double counting.
 */
final class PendingRollups {

    private final Map<String, PathAggregation> paths;
    private final Map<String, SourceAggregation> sources;
    private final Map<String, DeviceAggregation> devices;

    private PendingRollups(Map<String, PathAggregation> paths,
                           Map<String, SourceAggregation> sources,
                           Map<String, DeviceAggregation> devices) {
        this.paths = paths;
        this.sources = sources;
        this.devices = devices;
    }

    static PendingRollups drain(RollupBuffer buffer) {
        return new PendingRollups(
                buffer.drainAggregations(),
                buffer.drainSourceAggregations(),
                buffer.drainDeviceAggregations());
    }

    /**
     * Upserts every remaining entry, stopping at the first failure.
     */
    void commitTo(RollupRepository repository) {
        commitEach(paths, aggregation -> repository.upsertPathRollup(PathRollup.from(aggregation)));
        commitEach(sources, aggregation -> repository.upsertSourceRollup(SourceRollup.from(aggregation)));
        commitEach(devices, aggregation -> repository.upsertDeviceRollup(DeviceRollup.from(aggregation)));
    }

    void restoreInto(RollupBuffer buffer) {
        buffer.restoreAggregations(paths);
        buffer.restoreSourceAggregations(sources);
        buffer.restoreDeviceAggregations(devices);
    }

    boolean isEmpty() {
        return paths.isEmpty() && sources.isEmpty() && devices.isEmpty();
    }

    int size() {
        return paths.size() + sources.size() + devices.size();
    }

    private static <A> void commitEach(Map<String, A> pending, Consumer<A> upsert) {
        Iterator<A> iterator = pending.values().iterator();
        while (iterator.hasNext()) {
            upsert.accept(iterator.next());
            iterator.remove();
        }
    }
}
