package com.rollup.service.flush;

import com.rollup.service.model.AnalyticsEvent;

import java.io.IOException;
import java.util.List;

/**
 * Raw sink of the event fork. Receives drained raw batches, independently of rollup commits.
 */
public interface RawEventExporter {

    /**
     * Writes a drained batch of raw events.
     *
     * @param events the batch, never null
     * @throws IOException if the batch could not be written
     */
    void export(List<AnalyticsEvent> events) throws IOException;

    /**
     * Exporter that discards batches, used when raw export is disabled.
     */
    static RawEventExporter discarding() {
        return DiscardingRawEventExporter.INSTANCE;
    }
}
