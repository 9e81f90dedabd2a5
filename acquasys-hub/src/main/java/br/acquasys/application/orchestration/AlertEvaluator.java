package br.acquasys.application.orchestration;

import br.acquasys.domain.config.AlertThresholds;
import br.acquasys.domain.config.SystemOperatingConfig;
import br.acquasys.domain.monitoring.AlertKind;
import br.acquasys.domain.telemetry.SensorReading;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies the alert rules to a reading. Rules are independent and evaluated in a fixed order;
 * cooldown filtering happens in the caller.
 */
public final class AlertEvaluator {

    /**
     * Rule hit before cooldown filtering.
     */
    public record Candidate(AlertKind kind, String message) {}

    private final AlertThresholds thresholds;

    public AlertEvaluator(AlertThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param reading       current reading
     * @param previousLevel level of the previous reading, or null for the first one
     * @param config        operating config (low threshold, mode)
     */
    public List<Candidate> evaluate(SensorReading reading, Double previousLevel, SystemOperatingConfig config) {
        List<Candidate> candidates = new ArrayList<>();
        double level = reading.level();

        if (previousLevel != null && !reading.pumpOn() && previousLevel > level) {
            double drop = previousLevel - level;
            if (drop > thresholds.leakDrop()) {
                candidates.add(new Candidate(AlertKind.LEAK_DETECTION,
                    format("💧 Leak detected! Level dropped %.1f%% with the pump off.", drop)));
            }
        }

        if (level < thresholds.criticalLevel()) {
            candidates.add(new Candidate(AlertKind.LOW_WATER_CRITICAL,
                format("⚠️ Critical level: water at %.1f%%, risk of running dry!", level)));
        }

        if (level < config.getLowThreshold() && !reading.pumpOn() && config.isAutoMode()) {
            candidates.add(new Candidate(AlertKind.LOW_WATER_PUMP_FAIL,
                format("📉 Low level (%.1f%%) and the pump did not start in automatic mode.", level)));
        }

        double rms = reading.vibration().rms();
        if (rms > thresholds.vibrationRms()) {
            candidates.add(new Candidate(AlertKind.HIGH_VIBRATION,
                format("📳 High vibration: %.3fG.", rms)));
        }

        if (reading.current() > thresholds.current()) {
            candidates.add(new Candidate(AlertKind.HIGH_CURRENT,
                format("⚡ High current: %.2fA.", reading.current())));
        }

        return candidates;
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
