package com.rollup.service.flush;

import com.rollup.service.model.AnalyticsEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
final class DiscardingRawEventExporter implements RawEventExporter {

    static final DiscardingRawEventExporter INSTANCE = new DiscardingRawEventExporter();

    private DiscardingRawEventExporter() {
    }

    @Override
    public void export(List<AnalyticsEvent> events) {
        log.debug("Raw export disabled, discarding {} events", events.size());
    }
}
