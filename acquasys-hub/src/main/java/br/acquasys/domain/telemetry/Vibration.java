package br.acquasys.domain.telemetry;

/**
 * Accelerometer sample in G: per-axis values plus the root mean square.
 */
public record Vibration(double x, double y, double z, double rms) {

    public static final Vibration NONE = new Vibration(0, 0, 0, 0);
}
