package br.acquasys.application.orchestration;

import br.acquasys.domain.config.SystemOperatingConfig;
import br.acquasys.domain.control.PumpAction;
import br.acquasys.domain.telemetry.SensorReading;

import java.util.Optional;

/**
 * Two-threshold automatic pump control: start at or below the low threshold, stop at or above the
 * high threshold. Only decides while automatic mode is on.
 */
public final class AutoPumpPolicy {

    public Optional<PumpAction> decide(SensorReading reading, SystemOperatingConfig config) {
        if (!config.isAutoMode()) {
            return Optional.empty();
        }
        if (reading.level() <= config.getLowThreshold() && !reading.pumpOn()) {
            return Optional.of(PumpAction.ON);
        }
        if (reading.level() >= config.getHighThreshold() && reading.pumpOn()) {
            return Optional.of(PumpAction.OFF);
        }
        return Optional.empty();
    }
}
