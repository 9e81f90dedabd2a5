package br.acquasys.domain.common;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fan-out event types pushed to dashboard subscribers.
 */
public enum EventType {
    SENSOR_DATA("sensorData"),
    PUMP_STATUS("pumpStatus"),
    SYSTEM_ALERT("systemAlert"),
    SYSTEM_CONFIG("systemConfig"),
    COMMAND_RESULT("commandResult"),
    PING("ping");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
