package br.acquasys.application.orchestration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EfficiencyHistoryTest {

    @Test
    void averageOfEmptyHistoryIsFullEfficiency() {
        assertEquals(100.0, new EfficiencyHistory().average());
    }

    @Test
    void averageOfRetainedValues() {
        EfficiencyHistory history = new EfficiencyHistory();
        history.push(80);
        history.push(90);
        history.push(100);

        assertEquals(3, history.size());
        assertEquals(90.0, history.average(), 1e-9);
    }

    @Test
    void oldestValueEvictedWhenFull() {
        EfficiencyHistory history = new EfficiencyHistory(EfficiencyHistory.DEFAULT_CAPACITY);
        history.push(0);
        for (int i = 0; i < EfficiencyHistory.DEFAULT_CAPACITY; i++) {
            history.push(50);
        }

        assertEquals(20, history.size());
        assertEquals(50.0, history.average(), 1e-9);
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new EfficiencyHistory(0));
    }
}
