package br.acquasys.domain.config;

/**
 * Read-only view of the operating configuration handed to the dashboard, HTTP and status output.
 */
public record ConfigSnapshot(
    boolean autoMode,
    double lowThreshold,
    double highThreshold,
    String lastCommandSource
) {
}
