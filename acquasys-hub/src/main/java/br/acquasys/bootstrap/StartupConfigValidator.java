package br.acquasys.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the effective configuration at startup and warns about optional pieces that are missing.
 * Hard errors are raised by {@link HubConfig#fromEnv()} before this runs.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @return number of warnings logged
     */
    public static int validate(HubConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        int warnings = 0;

        log.info("HTTP port: {}", config.port());
        log.info("MQTT broker: {}:{} (client {})", config.mqtt().host(), config.mqtt().port(), config.mqtt().clientId());
        log.info("MQTT topics: {}", config.mqtt().topics().subscriptions());
        log.info("Database: {} (pool {})", config.database().url(), config.database().poolSize());
        log.info("Time zone: {}", config.zone());
        log.info("Auto control: low {}% / high {}%", config.lowThreshold(), config.highThreshold());
        log.info("Alerts: leak > {}pp, critical < {}%, vibration > {}G, current > {}A, cooldown {} min",
            config.alertThresholds().leakDrop(),
            config.alertThresholds().criticalLevel(),
            config.alertThresholds().vibrationRms(),
            config.alertThresholds().current(),
            config.alertThresholds().cooldown().toMinutes());

        if (config.mqtt().username() == null) {
            log.warn("⚠️ MQTT_USER not set: connecting without authentication");
            warnings++;
        }
        if (!config.telegramConfigured()) {
            log.warn("⚠️ TELEGRAM_BOT_TOKEN or TELEGRAM_CHAT_ID not set: chat notifications disabled");
            warnings++;
        }
        if (config.wsToken() == null) {
            log.warn("⚠️ WS_TOKEN not set: dashboard WebSocket accepts any client");
            warnings++;
        }

        log.info("✅ Startup config validation passed ({} warnings)", warnings);
        log.info("════════════════════════════════════════════════════════");
        return warnings;
    }

    private StartupConfigValidator() {}
}
