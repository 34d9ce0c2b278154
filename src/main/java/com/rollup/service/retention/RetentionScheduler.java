package com.rollup.service.retention;

import com.rollup.service.config.RetentionConfig;
import com.rollup.service.persistence.RepositoryException;
import com.rollup.service.persistence.RollupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Prunes committed rollups older than the retention window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionScheduler {

    private final RollupRepository repository;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${rollup.retention.interval-ms:3600000}",
            initialDelayString = "${rollup.retention.interval-ms:3600000}")
    public void pruneExpiredRollups() {
        int days = retentionConfig.getDays();
        if (days <= 0) {
            return;
        }
        LocalDate cutoff = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(days);
        try {
            long deleted = repository.deleteOlderThan(cutoff);
            if (deleted > 0) {
                log.info("Retention removed {} rollup rows dated before {}", deleted, cutoff);
            }
        } catch (RepositoryException e) {
            log.error("Retention pruning before {} failed: {}", cutoff, e.getMessage());
        }
    }
}
