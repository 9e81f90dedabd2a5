package br.acquasys.domain.config;

import java.time.Duration;

/**
 * Tunables for the alert rules.
 *
 * @param leakDrop        minimum level drop (percentage points) between readings with the pump off
 * @param criticalLevel   level below which the reservoir is considered nearly empty
 * @param vibrationRms    RMS above which vibration is reported
 * @param current         current draw above which the motor is reported
 * @param cooldown        minimum spacing between two alerts of the same kind
 */
public record AlertThresholds(
    double leakDrop,
    double criticalLevel,
    double vibrationRms,
    double current,
    Duration cooldown
) {
    public static AlertThresholds defaults() {
        return new AlertThresholds(1.0, 10.0, 2.5, 5.0, Duration.ofMinutes(10));
    }

    public AlertThresholds {
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be zero or positive");
        }
    }
}
