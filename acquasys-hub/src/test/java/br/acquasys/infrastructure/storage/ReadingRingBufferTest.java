package br.acquasys.infrastructure.storage;

import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.domain.telemetry.Vibration;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static br.acquasys.support.TestReadings.T0;
import static org.junit.jupiter.api.Assertions.*;

class ReadingRingBufferTest {

    private static SensorReading at(long secondsAfterT0, double level) {
        return new SensorReading("esp32-01", T0.plusSeconds(secondsAfterT0), level, 25.0, 0.0, 0.0,
            false, Vibration.NONE, 0L, 0L, 0, null);
    }

    @Test
    void emptyBufferHasNoLatest() {
        ReadingRingBuffer buffer = new ReadingRingBuffer();

        assertTrue(buffer.latest().isEmpty());
        assertEquals(0, buffer.size());
        assertTrue(buffer.since(Instant.EPOCH, 10).isEmpty());
    }

    @Test
    void evictsOldestWhenFull() {
        ReadingRingBuffer buffer = new ReadingRingBuffer(3);
        for (int i = 0; i < 5; i++) {
            buffer.add(at(i, i * 10.0));
        }

        assertEquals(3, buffer.size());
        assertEquals(40.0, buffer.latest().orElseThrow().level());
        List<SensorReading> all = buffer.since(Instant.EPOCH, 10);
        assertEquals(List.of(40.0, 30.0, 20.0), all.stream().map(SensorReading::level).toList());
    }

    @Test
    void sinceFiltersByTimeNewestFirstAndHonoursLimit() {
        ReadingRingBuffer buffer = new ReadingRingBuffer();
        for (int i = 0; i < 10; i++) {
            buffer.add(at(i * 60L, i));
        }

        List<SensorReading> lastFive = buffer.since(T0.plusSeconds(300), 100);
        assertEquals(5, lastFive.size());
        assertEquals(9.0, lastFive.get(0).level());
        assertEquals(5.0, lastFive.get(4).level(), "boundary timestamp is inclusive");

        assertEquals(2, buffer.since(T0, 2).size());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ReadingRingBuffer(0));
    }
}
