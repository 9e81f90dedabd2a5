package br.acquasys.domain.control;

import java.util.Objects;

/**
 * Outbound instruction for the pump controller.
 */
public record PumpCommand(PumpAction action, CommandSource source, String device) {

    public PumpCommand {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(source, "source");
    }
}
