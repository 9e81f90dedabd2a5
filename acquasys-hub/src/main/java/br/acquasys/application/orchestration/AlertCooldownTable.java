package br.acquasys.application.orchestration;

import br.acquasys.domain.monitoring.AlertKind;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Last-fired time per alert kind. Entries are created on first fire and never removed.
 * Owned by the orchestration loop.
 */
public final class AlertCooldownTable {

    private final Duration cooldown;
    private final Map<AlertKind, Instant> lastFired = new EnumMap<>(AlertKind.class);

    public AlertCooldownTable(Duration cooldown) {
        this.cooldown = cooldown;
    }

    /**
     * Claims the right to fire {@code kind} at {@code now}. Returns false while the previous fire
     * is within the cooldown; otherwise records {@code now} and returns true.
     */
    public boolean tryFire(AlertKind kind, Instant now) {
        Instant last = lastFired.get(kind);
        if (last != null && Duration.between(last, now).compareTo(cooldown) <= 0) {
            return false;
        }
        lastFired.put(kind, now);
        return true;
    }

    public Optional<Instant> lastFired(AlertKind kind) {
        return Optional.ofNullable(lastFired.get(kind));
    }
}
