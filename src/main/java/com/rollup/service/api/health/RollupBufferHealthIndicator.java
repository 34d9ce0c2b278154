package com.rollup.service.api.health;

import com.rollup.service.buffer.RollupBuffer;
import com.rollup.service.config.BufferConfig;
import com.rollup.service.flush.RollupFlusher;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the rollup buffer.
 *
 * DOWN when the raw list is over its threshold while flushes keep failing, i.e. data is
 * piling up in memory.
 */
@Component
@RequiredArgsConstructor
public class RollupBufferHealthIndicator implements HealthIndicator {

    private final RollupBuffer buffer;
    private final RollupFlusher flusher;
    private final BufferConfig config;

    @Override
    public Health health() {
        long rawBytes = buffer.rawSize();
        int failures = flusher.getConsecutiveFailures();

        Health.Builder builder = rawBytes >= config.getMaxRawBytes() && failures > 0
                ? Health.down()
                : Health.up();

        builder.withDetail("rawEvents", buffer.size())
                .withDetail("rawBytes", rawBytes)
                .withDetail("maxRawBytes", config.getMaxRawBytes())
                .withDetail("pathRollups", buffer.aggregationCount())
                .withDetail("sourceRollups", buffer.sourceAggregationCount())
                .withDetail("deviceRollups", buffer.deviceAggregationCount())
                .withDetail("flusherRunning", flusher.isRunning())
                .withDetail("consecutiveFlushFailures", failures);
        if (flusher.getLastSuccessfulFlush() != null) {
            builder.withDetail("lastSuccessfulFlush", flusher.getLastSuccessfulFlush().toString());
        }
        return builder.build();
    }
}
