package br.acquasys.infrastructure.mqtt;

import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.domain.telemetry.Vibration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;

/**
 * Parses the controller's telemetry JSON into a {@link SensorReading}.
 *
 * Required: {@code device}, {@code level}. Missing {@code vibration} becomes zeros and other
 * missing numbers become 0. A device-reported {@code efficiency} is ignored; the hub computes its
 * own. Timestamps that are absent or not epoch milliseconds (controllers without a clock report
 * millis since boot) are replaced by the receive time.
 */
public final class TelemetryParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // 2001-09-09; smaller values are uptime counters, not wall-clock time
    private static final long MIN_EPOCH_MILLIS = 1_000_000_000_000L;

    private final Clock clock;

    public TelemetryParser(Clock clock) {
        this.clock = clock;
    }

    public SensorReading parse(String payload) {
        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new TelemetryParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TelemetryParseException("Telemetry payload must be a JSON object");
        }

        JsonNode device = root.get("device");
        if (device == null || !device.isTextual() || device.asText().isBlank()) {
            throw new TelemetryParseException("Missing 'device'");
        }
        JsonNode level = root.get("level");
        if (level == null || !level.isNumber()) {
            throw new TelemetryParseException("Missing or non-numeric 'level'");
        }

        JsonNode vib = root.path("vibration");
        Vibration vibration = vib.isObject()
            ? new Vibration(vib.path("x").asDouble(0), vib.path("y").asDouble(0),
                vib.path("z").asDouble(0), vib.path("rms").asDouble(0))
            : Vibration.NONE;

        return new SensorReading(
            device.asText(),
            timestampOf(root.path("timestamp")),
            level.asDouble(),
            root.path("temperature").asDouble(0),
            root.path("current").asDouble(0),
            root.path("flowRate").asDouble(0),
            root.path("pump").asBoolean(false),
            vibration,
            root.path("runtime").asLong(0),
            root.path("heap").asLong(0),
            root.path("rssi").asInt(0),
            null
        );
    }

    private Instant timestampOf(JsonNode node) {
        if (node.isNumber() && node.asLong() >= MIN_EPOCH_MILLIS) {
            return Instant.ofEpochMilli(node.asLong());
        }
        return clock.instant();
    }
}
