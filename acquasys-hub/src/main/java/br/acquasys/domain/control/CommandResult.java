package br.acquasys.domain.control;

/**
 * Outcome of a remote command. Control boundaries report failures through this, never by throwing.
 */
public record CommandResult(boolean success, String message) {

    public static CommandResult ok(String message) {
        return new CommandResult(true, message);
    }

    public static CommandResult rejected(String message) {
        return new CommandResult(false, message);
    }
}
