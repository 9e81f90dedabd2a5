package br.acquasys.domain.monitoring;

import br.acquasys.domain.telemetry.SensorReading;

import java.time.Instant;

/**
 * Operator notification raised by the alert rules, together with the reading snapshot that
 * triggered it.
 */
public class Alert {
    private final AlertKind kind;
    private final AlertLevel level;
    private final String message;
    private final String device;
    private final Double waterLevel;
    private final Double current;
    private final Double vibrationRms;
    private final Boolean pumpOn;
    private final Instant timestamp;

    private Alert(Builder builder) {
        this.kind = builder.kind;
        this.level = builder.level != null ? builder.level : builder.kind.defaultLevel();
        this.message = builder.message;
        this.device = builder.device;
        this.waterLevel = builder.waterLevel;
        this.current = builder.current;
        this.vibrationRms = builder.vibrationRms;
        this.pumpOn = builder.pumpOn;
        this.timestamp = builder.timestamp;
    }

    public AlertKind getKind() {
        return kind;
    }

    public AlertLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getDevice() {
        return device;
    }

    public Double getWaterLevel() {
        return waterLevel;
    }

    public Double getCurrent() {
        return current;
    }

    public Double getVibrationRms() {
        return vibrationRms;
    }

    public Boolean getPumpOn() {
        return pumpOn;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AlertKind kind;
        private AlertLevel level;
        private String message;
        private String device = "acquasys";
        private Double waterLevel;
        private Double current;
        private Double vibrationRms;
        private Boolean pumpOn;
        private Instant timestamp = Instant.now();

        public Builder kind(AlertKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder device(String device) {
            this.device = device;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /** Copies device and the measured values of the triggering reading. */
        public Builder reading(SensorReading reading) {
            this.device = reading.device();
            this.waterLevel = reading.level();
            this.current = reading.current();
            this.vibrationRms = reading.vibration().rms();
            this.pumpOn = reading.pumpOn();
            return this;
        }

        public Alert build() {
            if (kind == null || message == null || timestamp == null) {
                throw new IllegalStateException("kind, message and timestamp are required");
            }
            return new Alert(this);
        }
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s (%s)", level, kind.key(), message, timestamp);
    }
}
