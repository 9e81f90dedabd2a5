package br.acquasys.domain.common;

import java.time.Instant;
import java.util.Objects;

/**
 * Fan-out envelope: {@code {type, data, timestamp}}.
 */
public record HubEvent(EventType type, Object data, Instant timestamp) {

    public HubEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static HubEvent of(EventType type, Object data, Instant timestamp) {
        return new HubEvent(type, data, timestamp);
    }
}
