package br.acquasys.domain.config;

/**
 * Parameters of the heuristic pump efficiency estimate.
 */
public record EfficiencyModel(
    double idealPowerWatts,
    double lineVoltage,
    double idleCurrent,
    double vibrationBaseline,
    double vibrationPenalty,
    double minTemperature,
    double maxTemperature,
    double nominalTemperature,
    double temperaturePenalty
) {
    public static EfficiencyModel defaults() {
        return new EfficiencyModel(180.0, 220.0, 0.1, 1.0, 10.0, 15.0, 40.0, 27.5, 0.5);
    }
}
