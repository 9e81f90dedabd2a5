package br.acquasys.infrastructure.storage;

import br.acquasys.domain.telemetry.SensorReading;

import java.time.Instant;
import java.util.List;

/**
 * Durable storage of readings.
 */
public interface TimeSeriesStore {

    /**
     * @throws TimeSeriesStoreException on any storage failure
     */
    void insert(SensorReading reading);

    /**
     * Readings captured at or after {@code since}, newest first.
     *
     * @throws TimeSeriesStoreException on any storage failure
     */
    List<SensorReading> findSince(Instant since, int limit);

    /**
     * Cheap reachability probe. Never throws.
     */
    boolean ping();
}
