package br.acquasys.infrastructure.mqtt;

import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.domain.telemetry.Vibration;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryParserTest {

    private static final Instant RECEIVED = Instant.parse("2025-01-15T13:30:45Z");

    private final TelemetryParser parser = new TelemetryParser(Clock.fixed(RECEIVED, ZoneOffset.UTC));

    @Test
    void parsesFullPayload() {
        String payload = """
            {"device":"esp32-01","timestamp":1736947800000,"level":72.5,"temperature":26.1,
             "current":1.05,"flowRate":12.3,"pump":true,
             "vibration":{"x":0.1,"y":0.2,"z":0.3,"rms":0.42},
             "runtime":125000,"heap":204800,"rssi":-61,"efficiency":55.0}
            """;

        SensorReading reading = parser.parse(payload);

        assertEquals("esp32-01", reading.device());
        assertEquals(Instant.ofEpochMilli(1736947800000L), reading.timestamp());
        assertEquals(72.5, reading.level());
        assertEquals(26.1, reading.temperature());
        assertEquals(1.05, reading.current());
        assertEquals(12.3, reading.flowRate());
        assertTrue(reading.pumpOn());
        assertEquals(new Vibration(0.1, 0.2, 0.3, 0.42), reading.vibration());
        assertEquals(125000L, reading.runtime());
        assertEquals(204800L, reading.heap());
        assertEquals(-61, reading.rssi());
        assertNull(reading.efficiency(), "device-reported efficiency is ignored");
    }

    @Test
    void missingOptionalFieldsDefaultToZero() {
        SensorReading reading = parser.parse("{\"device\":\"esp32-01\",\"level\":40}");

        assertEquals(Vibration.NONE, reading.vibration());
        assertEquals(0.0, reading.current());
        assertFalse(reading.pumpOn());
        assertEquals(RECEIVED, reading.timestamp());
    }

    @Test
    void uptimeTimestampReplacedByReceiveTime() {
        SensorReading reading = parser.parse("{\"device\":\"esp32-01\",\"level\":40,\"timestamp\":125000}");

        assertEquals(RECEIVED, reading.timestamp());
    }

    @Test
    void rejectsPayloadWithoutDevice() {
        assertThrows(TelemetryParseException.class, () -> parser.parse("{\"level\":40}"));
        assertThrows(TelemetryParseException.class, () -> parser.parse("{\"device\":\" \",\"level\":40}"));
    }

    @Test
    void rejectsNonNumericLevel() {
        assertThrows(TelemetryParseException.class,
            () -> parser.parse("{\"device\":\"esp32-01\",\"level\":\"high\"}"));
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(TelemetryParseException.class, () -> parser.parse("{not json"));
        assertThrows(TelemetryParseException.class, () -> parser.parse("[1,2,3]"));
    }
}
