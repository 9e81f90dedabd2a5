package br.acquasys.infrastructure.storage;

import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.infrastructure.metrics.HubMetrics;
import br.acquasys.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static br.acquasys.support.TestReadings.T0;
import static br.acquasys.support.TestReadings.reading;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeSeriesSinkTest {

    @Mock
    private TimeSeriesStore store;
    @Mock
    private HubMetrics metrics;
    @Mock
    private ScheduledExecutorService healthScheduler;

    private ReadingRingBuffer buffer;
    private TimeSeriesSink sink;

    @BeforeEach
    void setUp() {
        buffer = new ReadingRingBuffer();
        sink = new TimeSeriesSink(store, buffer, metrics, new MutableClock(T0),
            Executors.newSingleThreadExecutor(), healthScheduler);
    }

    private static TimeSeriesStoreException storeDown() {
        return new TimeSeriesStoreException("Insert failed", new SQLException("connection refused"));
    }

    @Test
    void startSchedulesPeriodicHealthCheck() {
        sink.start();

        verify(healthScheduler).scheduleAtFixedRate(any(Runnable.class), eq(3L), eq(30L), eq(TimeUnit.SECONDS));
    }

    @Test
    void healthyWriteGoesToBufferAndStore() {
        SensorReading r = reading(50.0, false);

        sink.write(r);
        sink.stop();

        verify(store).insert(r);
        assertEquals(r, sink.latest().orElseThrow());
        assertFalse(sink.isDegraded());
    }

    @Test
    void failedInsertDegradesSinkAndStopsStoreWrites() {
        doThrow(storeDown()).when(store).insert(any());

        sink.write(reading(50.0, false));
        sink.stop();
        sink.write(reading(49.0, false));

        assertTrue(sink.isDegraded());
        verify(store, times(1)).insert(any());
        verify(metrics).recordStepFailure("store_write");
        verify(metrics).updateStoreAvailable(false);
        assertEquals(2, buffer.size(), "every reading is kept in memory");
    }

    @Test
    void recentQueriesStoreWhileHealthy() {
        List<SensorReading> stored = List.of(reading(60.0, true));
        when(store.findSince(T0.minus(Duration.ofHours(24)), 100)).thenReturn(stored);

        assertEquals(stored, sink.recent(Duration.ofHours(24), 100));
    }

    @Test
    void recentFallsBackToBufferWhenQueryFails() {
        SensorReading r = reading(60.0, true);
        buffer.add(r);
        when(store.findSince(any(), anyInt())).thenThrow(storeDown());

        assertEquals(List.of(r), sink.recent(Duration.ofHours(1), 10));
        assertTrue(sink.isDegraded());

        // degraded: the store is not queried again
        assertEquals(List.of(r), sink.recent(Duration.ofHours(1), 10));
        verify(store, times(1)).findSince(any(), anyInt());
    }

    @Test
    void healthCheckTogglesDegradedState() {
        when(store.ping()).thenReturn(false, true);

        sink.checkHealth();
        assertTrue(sink.isDegraded());

        sink.checkHealth();
        assertFalse(sink.isDegraded());
        verify(metrics).updateStoreAvailable(true);
    }
}
