package br.acquasys.application.orchestration;

import br.acquasys.domain.config.EfficiencyModel;
import br.acquasys.domain.telemetry.SensorReading;

/**
 * Heuristic efficiency estimate of a single reading, in percent.
 *
 * An idle pump (off, or drawing no more than the idle current) counts as fully efficient.
 * Otherwise the ratio of ideal to electrical power is penalised for vibration above the baseline
 * and for temperatures outside the operating band, then clamped to [0, 100].
 */
public final class EfficiencyEstimator {

    private final EfficiencyModel model;

    public EfficiencyEstimator(EfficiencyModel model) {
        this.model = model;
    }

    public double instantaneous(SensorReading reading) {
        if (!reading.pumpOn() || reading.current() <= model.idleCurrent()) {
            return 100.0;
        }

        double electricalPower = reading.current() * model.lineVoltage();
        double efficiency = model.idealPowerWatts() / electricalPower * 100.0;

        double rms = reading.vibration().rms();
        if (rms > model.vibrationBaseline()) {
            efficiency -= (rms - model.vibrationBaseline()) * model.vibrationPenalty();
        }

        double temperature = reading.temperature();
        if (temperature < model.minTemperature() || temperature > model.maxTemperature()) {
            efficiency -= Math.abs(temperature - model.nominalTemperature()) * model.temperaturePenalty();
        }

        return Math.max(0.0, Math.min(100.0, efficiency));
    }
}
