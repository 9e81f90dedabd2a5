package br.acquasys.domain.control;

/**
 * Command tokens understood by the pump controller firmware.
 * The wire token is the constant name.
 */
public enum PumpAction {
    ON,
    OFF,
    AUTO,
    MANUAL;

    public String wireToken() {
        return name();
    }
}
