package br.acquasys.infrastructure.mqtt;

/**
 * Exception thrown when a telemetry payload is not valid JSON or misses a required field.
 */
public class TelemetryParseException extends RuntimeException {

    public TelemetryParseException(String message) {
        super(message);
    }

    public TelemetryParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
