package br.acquasys.domain.control;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Inbound control request from an operator surface.
 *
 * @param kind      requested operation
 * @param origin    surface the request came from
 * @param requester display label of the operator, used in replies
 */
public record RemoteCommand(Kind kind, Origin origin, String requester) {

    public enum Kind {
        STATUS,
        HELP,
        SET_AUTO,
        SET_MANUAL,
        PUMP_ON,
        PUMP_OFF;

        /**
         * Map a dashboard/HTTP control action ({@code on}, {@code off}, {@code auto},
         * {@code manual}, case-insensitive) to a command kind.
         */
        public static Optional<Kind> forControlAction(String action) {
            if (action == null) {
                return Optional.empty();
            }
            return switch (action.trim().toLowerCase(Locale.ROOT)) {
                case "on" -> Optional.of(PUMP_ON);
                case "off" -> Optional.of(PUMP_OFF);
                case "auto" -> Optional.of(SET_AUTO);
                case "manual" -> Optional.of(SET_MANUAL);
                default -> Optional.empty();
            };
        }
    }

    public enum Origin {
        CHAT,
        DASHBOARD,
        HTTP;

        /** Chat operators are attributed as remote, everything else as manual. */
        public CommandSource commandSource() {
            return this == CHAT ? CommandSource.REMOTE : CommandSource.MANUAL;
        }
    }

    public RemoteCommand {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(origin, "origin");
        if (requester == null || requester.isBlank()) {
            requester = origin.name().toLowerCase();
        }
    }

    public static RemoteCommand of(Kind kind, Origin origin) {
        return new RemoteCommand(kind, origin, null);
    }
}
