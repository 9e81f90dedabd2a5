package br.acquasys.domain.control;

/**
 * Who caused a pump command to be issued.
 */
public enum CommandSource {
    /** Automatic threshold policy. */
    AUTO,
    /** Dashboard or HTTP operator. */
    MANUAL,
    /** Chat operator. */
    REMOTE;

    public String label() {
        return name().toLowerCase();
    }
}
