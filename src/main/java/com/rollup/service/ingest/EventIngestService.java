package com.rollup.service.ingest;

import com.rollup.service.api.dto.EventIngestRequest;
import com.rollup.service.buffer.RollupBuffer;
import com.rollup.service.config.MetricsConfig;
import com.rollup.service.model.AnalyticsEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Turns validated ingest requests into events and pushes them into the rollup buffer.
 */
@Slf4j
@RequiredArgsConstructor
public class EventIngestService {

    private final RollupBuffer buffer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * @return number of events pushed
     */
    public int ingest(EventIngestRequest request) {
        var receivedAt = clock.instant();
        int pushed = 0;
        for (EventIngestRequest.EventDto dto : request.getEvents()) {
            buffer.push(toEvent(dto, receivedAt));
            pushed++;
        }
        metricsConfig.getEventsPushed().increment(pushed);
        log.debug("Pushed {} events, buffer now holds {} raw events", pushed, buffer.size());
        return pushed;
    }

    private static AnalyticsEvent toEvent(EventIngestRequest.EventDto dto, Instant receivedAt) {
        return AnalyticsEvent.builder()
                .id(dto.getEventId() != null ? dto.getEventId() : UUID.randomUUID().toString())
                .name(dto.getName() != null ? dto.getName() : "pageview")
                .timestamp(dto.getTimestamp() != null ? dto.getTimestamp() : receivedAt)
                .sessionId(dto.getSessionId())
                .userId(dto.getUserId())
                .path(dto.getPath())
                .query(dto.getQuery())
                .referrer(dto.getReferrer())
                .title(dto.getTitle())
                .userAgent(dto.getUserAgent())
                .browser(dto.getBrowser())
                .os(dto.getOs())
                .device(dto.getDevice())
                .language(dto.getLanguage())
                .durationMs(dto.getDurationMs())
                .properties(dto.getProperties())
                .build();
    }
}
