package br.acquasys.bootstrap;

import br.acquasys.domain.config.AlertThresholds;
import br.acquasys.infrastructure.mqtt.MqttTopics;
import br.acquasys.util.Env;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Effective hub configuration, read once at startup.
 */
public record HubConfig(
    int port,
    Mqtt mqtt,
    Database database,
    String telegramBotToken,
    String telegramChatId,
    String wsToken,
    ZoneId zone,
    double lowThreshold,
    double highThreshold,
    AlertThresholds alertThresholds
) {
    public record Mqtt(String host, int port, String clientId, String username, String password, MqttTopics topics) {}

    public record Database(String url, String user, String password, int poolSize) {}

    /**
     * @throws IllegalStateException on malformed numbers, an unknown time zone, a negative alert cooldown,
     *                               a malformed MQTT host or low ≥ high threshold
     */
    public static HubConfig fromEnv() {
        MqttTopics defaults = MqttTopics.defaults();
        MqttTopics topics = new MqttTopics(
            Env.get("MQTT_TOPIC_SENSORS", defaults.sensors()),
            Env.get("MQTT_TOPIC_PUMP_CONTROL", defaults.pumpControl()),
            Env.get("MQTT_TOPIC_PUMP_STATUS", defaults.pumpStatus()),
            Env.get("MQTT_TOPIC_SYSTEM_STATUS", defaults.systemStatus()),
            Env.get("MQTT_TOPIC_ALERTS", defaults.alerts()));

        Mqtt mqtt = new Mqtt(
            Env.get("MQTT_HOST", "test.mosquitto.org"),
            Env.getInt("MQTT_PORT", 1883),
            Env.get("MQTT_CLIENT_ID", "acquasys_hub_" + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x100000, 0xFFFFFF))),
            Env.get("MQTT_USER", null),
            Env.get("MQTT_PASS", null),
            topics);

        Database database = new Database(
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/acquasys"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", "postgres"),
            Env.getInt("DB_POOL_SIZE", 5));

        ZoneId zone;
        String zoneId = Env.get("HUB_TIMEZONE", "America/Sao_Paulo");
        try {
            zone = ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new IllegalStateException("HUB_TIMEZONE is not a valid zone id: " + zoneId, e);
        }

        AlertThresholds alertDefaults = AlertThresholds.defaults();
        int cooldownMinutes = Env.getInt("ALERT_COOLDOWN_MINUTES", (int) alertDefaults.cooldown().toMinutes());
        if (cooldownMinutes < 0) {
            throw new IllegalStateException("ALERT_COOLDOWN_MINUTES must be zero or positive: " + cooldownMinutes);
        }
        AlertThresholds thresholds = new AlertThresholds(
            Env.getDouble("LEAK_DROP_THRESHOLD", alertDefaults.leakDrop()),
            Env.getDouble("CRITICAL_LEVEL_THRESHOLD", alertDefaults.criticalLevel()),
            Env.getDouble("VIBRATION_THRESHOLD", alertDefaults.vibrationRms()),
            Env.getDouble("CURRENT_THRESHOLD", alertDefaults.current()),
            Duration.ofMinutes(cooldownMinutes));

        HubConfig config = new HubConfig(
            Env.getInt("PORT", 5000),
            mqtt,
            database,
            Env.get("TELEGRAM_BOT_TOKEN", null),
            Env.get("TELEGRAM_CHAT_ID", null),
            Env.get("WS_TOKEN", null),
            zone,
            Env.getDouble("LOW_WATER_THRESHOLD", 20.0),
            Env.getDouble("HIGH_WATER_THRESHOLD", 95.0),
            thresholds);
        config.check();
        return config;
    }

    void check() {
        if (lowThreshold >= highThreshold) {
            throw new IllegalStateException(String.format(
                "LOW_WATER_THRESHOLD (%s) must be below HIGH_WATER_THRESHOLD (%s)", lowThreshold, highThreshold));
        }
        if (lowThreshold < 0 || highThreshold > 100) {
            throw new IllegalStateException("Water thresholds must lie within 0..100");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalStateException("PORT out of range: " + port);
        }
        if (database.poolSize() <= 0) {
            throw new IllegalStateException("DB_POOL_SIZE must be positive");
        }
        if (mqtt.port() <= 0 || mqtt.port() > 65535) {
            throw new IllegalStateException("MQTT_PORT out of range: " + mqtt.port());
        }
        try {
            URI broker = new URI("tcp://" + mqtt.host() + ":" + mqtt.port());
            if (broker.getHost() == null) {
                throw new IllegalStateException("MQTT_HOST is not a valid host name: " + mqtt.host());
            }
        } catch (URISyntaxException e) {
            throw new IllegalStateException("MQTT_HOST is not a valid host name: " + mqtt.host(), e);
        }
    }

    public boolean telegramConfigured() {
        return telegramBotToken != null && telegramChatId != null;
    }
}
