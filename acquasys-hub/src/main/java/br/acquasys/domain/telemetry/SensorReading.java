package br.acquasys.domain.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One telemetry sample reported by the pump controller.
 *
 * @param device      reporting device id
 * @param timestamp   capture time
 * @param level       water level in percent
 * @param temperature water temperature in Celsius
 * @param current     pump current draw in amperes
 * @param flowRate    flow rate reported by the device
 * @param pumpOn      pump state as reported by the device, serialized as {@code pump}
 * @param vibration   vibration sample
 * @param runtime     device uptime in milliseconds
 * @param heap        free device memory in bytes
 * @param rssi        signal strength in dBm
 * @param efficiency  averaged efficiency in percent, null until attached by the hub
 */
public record SensorReading(
    String device,
    Instant timestamp,
    double level,
    double temperature,
    double current,
    double flowRate,
    @JsonProperty("pump") boolean pumpOn,
    Vibration vibration,
    long runtime,
    long heap,
    int rssi,
    Double efficiency
) {
    public SensorReading {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(timestamp, "timestamp");
        if (vibration == null) {
            vibration = Vibration.NONE;
        }
    }

    public SensorReading withEfficiency(double value) {
        return new SensorReading(device, timestamp, level, temperature, current, flowRate,
            pumpOn, vibration, runtime, heap, rssi, value);
    }
}
