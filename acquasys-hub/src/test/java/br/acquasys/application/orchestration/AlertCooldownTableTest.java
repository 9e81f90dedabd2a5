package br.acquasys.application.orchestration;

import br.acquasys.domain.monitoring.AlertKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AlertCooldownTableTest {

    private static final Instant T0 = Instant.parse("2025-01-15T12:00:00Z");

    private final AlertCooldownTable table = new AlertCooldownTable(Duration.ofMinutes(10));

    @Test
    void firstFireIsAllowedAndRecorded() {
        assertTrue(table.tryFire(AlertKind.HIGH_CURRENT, T0));
        assertEquals(T0, table.lastFired(AlertKind.HIGH_CURRENT).orElseThrow());
    }

    @Test
    void refireWithinCooldownIsRejected() {
        table.tryFire(AlertKind.HIGH_CURRENT, T0);

        assertFalse(table.tryFire(AlertKind.HIGH_CURRENT, T0.plusSeconds(60)));
        // exactly at the boundary is still suppressed
        assertFalse(table.tryFire(AlertKind.HIGH_CURRENT, T0.plus(Duration.ofMinutes(10))));
        assertEquals(T0, table.lastFired(AlertKind.HIGH_CURRENT).orElseThrow());
    }

    @Test
    void refireAfterCooldownIsAllowed() {
        table.tryFire(AlertKind.HIGH_CURRENT, T0);
        Instant later = T0.plus(Duration.ofMinutes(10)).plusMillis(1);

        assertTrue(table.tryFire(AlertKind.HIGH_CURRENT, later));
        assertEquals(later, table.lastFired(AlertKind.HIGH_CURRENT).orElseThrow());
    }

    @Test
    void kindsAreIndependent() {
        table.tryFire(AlertKind.HIGH_CURRENT, T0);

        assertTrue(table.tryFire(AlertKind.HIGH_VIBRATION, T0));
        assertTrue(table.lastFired(AlertKind.LEAK_DETECTION).isEmpty());
    }
}
