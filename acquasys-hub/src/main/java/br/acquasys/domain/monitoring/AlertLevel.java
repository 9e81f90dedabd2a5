package br.acquasys.domain.monitoring;

/**
 * Alert severity levels.
 */
public enum AlertLevel {
    /**
     * Immediate action required.
     * Examples: leak while the pump is off, reservoir near empty
     */
    CRITICAL,

    /**
     * Review soon.
     * Examples: pump did not start at low level, high vibration, high current
     */
    WARNING,

    /**
     * General information (start-up notice, test messages)
     */
    INFO
}
