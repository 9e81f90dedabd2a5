package br.acquasys.infrastructure.storage;

import br.acquasys.application.port.output.TelemetrySink;
import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.infrastructure.metrics.HubMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Telemetry sink backed by a durable store with an in-memory ring buffer fallback.
 *
 * Every reading lands in the ring buffer first. Store writes run on the sink's own writer thread
 * while the store is healthy; a failed write or probe marks the sink degraded and queries are
 * then answered from the buffer until the periodic health check succeeds again.
 */
public final class TimeSeriesSink implements TelemetrySink {
    private static final Logger log = LoggerFactory.getLogger(TimeSeriesSink.class);

    private static final long HEALTH_INITIAL_DELAY_SECONDS = 3;
    private static final long HEALTH_INTERVAL_SECONDS = 30;

    private final TimeSeriesStore store;
    private final ReadingRingBuffer buffer;
    private final HubMetrics metrics;
    private final Clock clock;
    private final ExecutorService writer;
    private final ScheduledExecutorService healthScheduler;

    private volatile boolean degraded = false;

    public TimeSeriesSink(TimeSeriesStore store, ReadingRingBuffer buffer, HubMetrics metrics, Clock clock) {
        this(store, buffer, metrics, clock,
            Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "sink-writer");
                t.setDaemon(true);
                return t;
            }),
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "sink-health");
                t.setDaemon(true);
                return t;
            }));
    }

    TimeSeriesSink(TimeSeriesStore store, ReadingRingBuffer buffer, HubMetrics metrics, Clock clock,
                   ExecutorService writer, ScheduledExecutorService healthScheduler) {
        this.store = store;
        this.buffer = buffer;
        this.metrics = metrics;
        this.clock = clock;
        this.writer = writer;
        this.healthScheduler = healthScheduler;
    }

    public void start() {
        healthScheduler.scheduleAtFixedRate(this::checkHealth,
            HEALTH_INITIAL_DELAY_SECONDS, HEALTH_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("[SINK] Started (buffer capacity {}, health check every {}s)",
            ReadingRingBuffer.DEFAULT_CAPACITY, HEALTH_INTERVAL_SECONDS);
    }

    public void stop() {
        healthScheduler.shutdownNow();
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SINK] Stopped");
    }

    @Override
    public void write(SensorReading reading) {
        buffer.add(reading);
        if (degraded) {
            return;
        }
        try {
            writer.execute(() -> persist(reading));
        } catch (RejectedExecutionException e) {
            log.warn("[SINK] Writer stopped, reading from {} kept in memory only", reading.device());
        }
    }

    private void persist(SensorReading reading) {
        try {
            store.insert(reading);
        } catch (TimeSeriesStoreException e) {
            log.error("[SINK] {}: {}", e.getMessage(),
                e.getCause() != null ? e.getCause().getMessage() : "unknown cause");
            metrics.recordStepFailure("store_write");
            markDegraded(true);
        }
    }

    @Override
    public List<SensorReading> recent(Duration window, int limit) {
        Instant since = clock.instant().minus(window);
        if (!degraded) {
            try {
                return store.findSince(since, limit);
            } catch (TimeSeriesStoreException e) {
                log.warn("[SINK] History query failed, serving buffer: {}", e.getMessage());
                markDegraded(true);
            }
        }
        return buffer.since(since, limit);
    }

    @Override
    public Optional<SensorReading> latest() {
        return buffer.latest();
    }

    @Override
    public boolean isDegraded() {
        return degraded;
    }

    void checkHealth() {
        try {
            markDegraded(!store.ping());
        } catch (RuntimeException e) {
            log.error("[SINK] Health check failed: {}", e.getMessage(), e);
            markDegraded(true);
        }
    }

    private void markDegraded(boolean value) {
        boolean previous = degraded;
        degraded = value;
        metrics.updateStoreAvailable(!value);
        if (previous != value) {
            if (value) {
                log.warn("[SINK] ⚠️ Store unavailable, falling back to in-memory history");
            } else {
                log.info("[SINK] ✓ Store available again");
            }
        }
    }
}
