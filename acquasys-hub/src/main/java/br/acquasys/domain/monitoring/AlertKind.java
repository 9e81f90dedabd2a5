package br.acquasys.domain.monitoring;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Alert categories. The key doubles as the cooldown table key and the wire name.
 */
public enum AlertKind {
    LEAK_DETECTION("leak_detection", AlertLevel.CRITICAL),
    LOW_WATER_CRITICAL("low_water_critical", AlertLevel.CRITICAL),
    LOW_WATER_PUMP_FAIL("low_water_pump_fail", AlertLevel.WARNING),
    HIGH_VIBRATION("high_vibration", AlertLevel.WARNING),
    HIGH_CURRENT("high_current", AlertLevel.WARNING),
    SYSTEM_STARTED("system_started", AlertLevel.INFO),
    TEST_NOTIFICATION("test_notification", AlertLevel.INFO);

    private final String key;
    private final AlertLevel defaultLevel;

    AlertKind(String key, AlertLevel defaultLevel) {
        this.key = key;
        this.defaultLevel = defaultLevel;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public AlertLevel defaultLevel() {
        return defaultLevel;
    }
}
