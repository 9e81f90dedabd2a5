package br.acquasys.infrastructure.storage;

import br.acquasys.domain.telemetry.SensorReading;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity in-memory history that keeps the newest readings. Thread-safe.
 */
public final class ReadingRingBuffer {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<SensorReading> readings;

    public ReadingRingBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public ReadingRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.readings = new ArrayDeque<>(capacity);
    }

    public synchronized void add(SensorReading reading) {
        if (readings.size() == capacity) {
            readings.removeFirst();
        }
        readings.addLast(reading);
    }

    public synchronized Optional<SensorReading> latest() {
        return Optional.ofNullable(readings.peekLast());
    }

    /**
     * Readings captured at or after {@code since}, newest first.
     */
    public synchronized List<SensorReading> since(Instant since, int limit) {
        List<SensorReading> result = new ArrayList<>();
        Iterator<SensorReading> it = readings.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            SensorReading r = it.next();
            if (!r.timestamp().isBefore(since)) {
                result.add(r);
            }
        }
        return result;
    }

    public synchronized int size() {
        return readings.size();
    }
}
