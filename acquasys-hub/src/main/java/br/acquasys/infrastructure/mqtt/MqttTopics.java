package br.acquasys.infrastructure.mqtt;

import java.util.List;

/**
 * Topic layout shared with the pump controller firmware.
 */
public record MqttTopics(
    String sensors,
    String pumpControl,
    String pumpStatus,
    String systemStatus,
    String alerts
) {
    public static MqttTopics defaults() {
        return new MqttTopics(
            "acquasys/sensors",
            "acquasys/pump/control",
            "acquasys/pump/status",
            "acquasys/system/status",
            "acquasys/alerts");
    }

    /** Topics the hub subscribes to on every (re)connect. */
    public List<String> subscriptions() {
        return List.of(sensors, pumpControl, pumpStatus, systemStatus, alerts);
    }
}
