package br.acquasys.application.orchestration;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of recent efficiency values. Not thread-safe: owned by the orchestration loop.
 */
public final class EfficiencyHistory {

    public static final int DEFAULT_CAPACITY = 20;

    private final int capacity;
    private final Deque<Double> values;

    public EfficiencyHistory() {
        this(DEFAULT_CAPACITY);
    }

    public EfficiencyHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    public void push(double value) {
        if (values.size() == capacity) {
            values.removeFirst();
        }
        values.addLast(value);
    }

    /**
     * Arithmetic mean of the retained values; 100 when nothing has been recorded yet.
     */
    public double average() {
        if (values.isEmpty()) {
            return 100.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public int size() {
        return values.size();
    }
}
