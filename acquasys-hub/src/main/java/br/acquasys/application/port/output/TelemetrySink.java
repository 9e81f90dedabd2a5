package br.acquasys.application.port.output;

import br.acquasys.domain.telemetry.SensorReading;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable history of readings. Implementations never throw to the caller.
 */
public interface TelemetrySink {

    /**
     * Record a reading. Returns immediately; durable persistence may complete later.
     */
    void write(SensorReading reading);

    /**
     * Readings captured within {@code window} before now, newest first, at most {@code limit}.
     */
    List<SensorReading> recent(Duration window, int limit);

    Optional<SensorReading> latest();

    /**
     * True while the durable store is unreachable and only in-memory history is served.
     */
    boolean isDegraded();
}
