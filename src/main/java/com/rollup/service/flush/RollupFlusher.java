package com.rollup.service.flush;

import com.rollup.service.buffer.RollupBuffer;
import com.rollup.service.config.MetricsConfig;
import com.rollup.service.model.AnalyticsEvent;
import com.rollup.service.persistence.RollupRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically commits the rollup buffer to the repository.
 *
 * A single scheduler thread is the run loop. Each tick drains the three rollup maps and
 * upserts them; whatever could not be committed is restored into the buffer, so counters
 * survive any number of consecutive repository failures. The raw list is exported
 * independently once it crosses its size threshold.
 */
@Slf4j
public class RollupFlusher {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final RollupBuffer buffer;
    private final RollupRepository repository;
    private final RawEventExporter rawExporter;
    private final MetricsConfig metricsConfig;
    private final Duration interval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private ScheduledExecutorService scheduler;
    private volatile Instant lastSuccessfulFlush;

    public RollupFlusher(RollupBuffer buffer,
                         RollupRepository repository,
                         RawEventExporter rawExporter,
                         MetricsConfig metricsConfig,
                         Duration interval) {
        this.buffer = buffer;
        this.repository = repository;
        this.rawExporter = rawExporter != null ? rawExporter : RawEventExporter.discarding();
        this.metricsConfig = metricsConfig;
        this.interval = interval == null || interval.isZero() || interval.isNegative()
                ? DEFAULT_INTERVAL
                : interval;
    }

    // ==================== Lifecycle ====================

    /**
     * Starts the periodic flush. Calling it while running is a no-op.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(this::createFlushThread);
        scheduler.scheduleWithFixedDelay(this::tick, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("RollupFlusher started, flush interval: {}ms", interval.toMillis());
    }

    /**
     * Stops the periodic flush, waits for an in-flight tick to finish, then flushes once more.
     * Calling it while stopped is a no-op.
     *
     * @throws RollupFlushException if the final flush fails; the data stays in the buffer
     */
    public void stop() {
        synchronized (this) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            shutdownScheduler();
        }
        log.info("RollupFlusher stopped, running final flush");
        flush();
    }

    public boolean isRunning() {
        return running.get();
    }

    private Thread createFlushThread(Runnable runnable) {
        var thread = new Thread(runnable, "rollup-flusher");
        thread.setDaemon(true);
        return thread;
    }

    private void shutdownScheduler() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of rollup flusher");
                scheduler.shutdownNow();
                scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }

    // ==================== Run Loop ====================

    private void tick() {
        if (!running.get()) {
            return;
        }
        try {
            flush();
        } catch (RollupFlushException e) {
            log.error("Periodic rollup flush failed: {} [{}]", e.getMessage(), e.getErrorCode());
        } catch (RuntimeException e) {
            log.error("Unexpected error in rollup flush loop", e);
        }
    }

    // ==================== Flush ====================

    /**
     * Commits all drained rollups in a single attempt, then exports the raw list if it is
     * over its threshold. Uncommitted rollups are restored before the exception propagates.
     *
     * @throws RollupFlushException if an upsert failed
     */
    public void flush() {
        if (repository != null) {
            var pending = PendingRollups.drain(buffer);
            if (!pending.isEmpty()) {
                try {
                    commit(pending);
                    recordSuccess();
                } catch (RuntimeException e) {
                    restore(pending);
                    recordFailure();
                    throw new RollupFlushException("Rollup flush failed: " + e.getMessage(),
                            RollupFlushException.REPOSITORY_WRITE_FAILED, 1, e);
                }
            }
        }
        exportRawIfNeeded();
    }

    /**
     * Drains once, then commits with up to {@code maxRetries} retries and exponential
     * backoff. Events pushed meanwhile go to the live buffer. Interrupting the calling
     * thread cancels the flush.
     *
     * @param maxRetries retries after the first attempt
     * @param retryDelay base backoff delay
     * @throws IllegalArgumentException if {@code retryDelay} is null or negative; the buffer is
     *                                  left untouched
     * @throws RollupFlushException on exhaustion or cancellation; the uncommitted data has
     *                              been restored into the buffer
     */
    public void flushWithRetry(int maxRetries, Duration retryDelay) {
        if (repository == null) {
            return;
        }
        var backoff = new BackoffPolicy(retryDelay);
        int attempts = attemptsFor(maxRetries);

        var pending = PendingRollups.drain(buffer);
        if (pending.isEmpty()) {
            return;
        }
        RuntimeException lastError = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw cancelled(pending, attempt);
            }
            try {
                commit(pending);
                recordSuccess();
                exportRawIfNeeded();
                return;
            } catch (RuntimeException e) {
                lastError = e;
                recordFailure();
            }

            if (attempt < attempts - 1) {
                Duration delay = backoff.delayFor(attempt);
                log.warn("Rollup flush failed, retrying (attempt {}/{}, {} pending, delay {}ms): {}",
                        attempt + 1, attempts, pending.size(), delay.toMillis(), lastError.getMessage());
                try {
                    TimeUnit.MILLISECONDS.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw cancelled(pending, attempt + 1);
                }
            }
        }

        restore(pending);
        log.error("Rollup flush failed after {} attempts, {} rollups kept in buffer",
                attempts, pending.size(), lastError);
        throw new RollupFlushException("Rollup flush failed after " + attempts + " attempts: "
                + lastError.getMessage(), RollupFlushException.REPOSITORY_WRITE_FAILED, attempts, lastError);
    }

    // ==================== Private Methods ====================

    /**
     * First attempt plus retries, saturating at {@link Integer#MAX_VALUE}.
     */
    static int attemptsFor(int maxRetries) {
        if (maxRetries <= 0) {
            return 1;
        }
        return maxRetries == Integer.MAX_VALUE ? Integer.MAX_VALUE : maxRetries + 1;
    }

    private void commit(PendingRollups pending) {
        metricsConfig.getFlushTimer().record(() -> pending.commitTo(repository));
    }

    private void restore(PendingRollups pending) {
        if (pending.isEmpty()) {
            return;
        }
        log.debug("Restoring {} uncommitted rollups into buffer", pending.size());
        pending.restoreInto(buffer);
        metricsConfig.getFlushRestores().increment();
    }

    private RollupFlushException cancelled(PendingRollups pending, int attempts) {
        restore(pending);
        log.warn("Rollup flush cancelled after {} attempts, {} rollups kept in buffer", attempts, pending.size());
        return new RollupFlushException("Rollup flush cancelled", RollupFlushException.FLUSH_CANCELLED, attempts);
    }

    private void recordSuccess() {
        consecutiveFailures.set(0);
        lastSuccessfulFlush = Instant.now();
        metricsConfig.getFlushesCompleted().increment();
    }

    private void recordFailure() {
        consecutiveFailures.incrementAndGet();
        metricsConfig.getFlushFailures().increment();
    }

    /**
     * Raw export never fails the flush: errors are logged and counted only.
     */
    private void exportRawIfNeeded() {
        if (!buffer.shouldFlushRaw()) {
            return;
        }
        List<AnalyticsEvent> events = buffer.drainRaw();
        if (events.isEmpty()) {
            return;
        }
        try {
            rawExporter.export(events);
            metricsConfig.getRawExportsCompleted().increment();
        } catch (Exception e) {
            metricsConfig.getRawExportFailures().increment();
            log.error("Failed to export {} raw events", events.size(), e);
        }
    }

    // ==================== Monitoring ====================

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public Instant getLastSuccessfulFlush() {
        return lastSuccessfulFlush;
    }

    public Duration getInterval() {
        return interval;
    }
}
