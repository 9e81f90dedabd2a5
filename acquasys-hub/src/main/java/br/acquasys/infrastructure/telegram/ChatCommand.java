package br.acquasys.infrastructure.telegram;

import br.acquasys.domain.control.RemoteCommand;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Chat vocabulary. Portuguese aliases are what operators already use on the device.
 */
public final class ChatCommand {

    private static final Map<String, RemoteCommand.Kind> COMMANDS = Map.ofEntries(
        Map.entry("/status", RemoteCommand.Kind.STATUS),
        Map.entry("/help", RemoteCommand.Kind.HELP),
        Map.entry("/ajuda", RemoteCommand.Kind.HELP),
        Map.entry("/start", RemoteCommand.Kind.HELP),
        Map.entry("/auto", RemoteCommand.Kind.SET_AUTO),
        Map.entry("/automatico", RemoteCommand.Kind.SET_AUTO),
        Map.entry("/manual", RemoteCommand.Kind.SET_MANUAL),
        Map.entry("/ligar", RemoteCommand.Kind.PUMP_ON),
        Map.entry("/on", RemoteCommand.Kind.PUMP_ON),
        Map.entry("/desligar", RemoteCommand.Kind.PUMP_OFF),
        Map.entry("/off", RemoteCommand.Kind.PUMP_OFF)
    );

    /**
     * Resolve a command token. Case-insensitive; a trailing {@code @botname} and any arguments
     * are ignored.
     */
    public static Optional<RemoteCommand.Kind> resolve(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String token = text.trim().toLowerCase(Locale.ROOT);
        int space = token.indexOf(' ');
        if (space >= 0) {
            token = token.substring(0, space);
        }
        int at = token.indexOf('@');
        if (at >= 0) {
            token = token.substring(0, at);
        }
        return Optional.ofNullable(COMMANDS.get(token));
    }

    public static boolean isCommand(String text) {
        return text != null && text.trim().startsWith("/");
    }

    private ChatCommand() {}
}
