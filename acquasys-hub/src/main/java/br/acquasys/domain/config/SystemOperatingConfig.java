package br.acquasys.domain.config;

import br.acquasys.domain.control.CommandSource;

/**
 * Process-wide operating state. Written only from the orchestration loop; fields are volatile so
 * HTTP and status readers on other threads see the latest values.
 */
public final class SystemOperatingConfig {

    private volatile boolean autoMode = true;
    private final double lowThreshold;
    private final double highThreshold;
    private volatile CommandSource lastCommandSource = CommandSource.AUTO;

    public SystemOperatingConfig(double lowThreshold, double highThreshold) {
        if (lowThreshold >= highThreshold) {
            throw new IllegalArgumentException(
                "low threshold (" + lowThreshold + ") must be below high threshold (" + highThreshold + ")");
        }
        this.lowThreshold = lowThreshold;
        this.highThreshold = highThreshold;
    }

    public static SystemOperatingConfig defaults() {
        return new SystemOperatingConfig(20.0, 95.0);
    }

    public boolean isAutoMode() {
        return autoMode;
    }

    public void setAutoMode(boolean autoMode) {
        this.autoMode = autoMode;
    }

    public double getLowThreshold() {
        return lowThreshold;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public CommandSource getLastCommandSource() {
        return lastCommandSource;
    }

    public void setLastCommandSource(CommandSource lastCommandSource) {
        this.lastCommandSource = lastCommandSource;
    }

    public ConfigSnapshot snapshot() {
        return new ConfigSnapshot(autoMode, lowThreshold, highThreshold, lastCommandSource.label());
    }
}
