package br.acquasys.infrastructure.common;

import java.time.Duration;

/**
 * Exponential backoff with a cap and a circuit breaker, shared by the device transport and the
 * chat poll loop.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.forDeviceTransport();
 *
 * try {
 *     connect();
 *     policy.recordSuccess();
 * } catch (TransportConnectionException e) {
 *     Duration wait = policy.recordFailure();
 *     if (!policy.shouldRetry()) { ... cool down, then policy.reset() ... }
 *     scheduler.schedule(this::connect, wait.toMillis(), TimeUnit.MILLISECONDS);
 * }
 * </pre>
 */
public final class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failures = 0;
    private Duration currentDelay;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Builder builder) {
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.multiplier = builder.multiplier;
        this.maxAttempts = builder.maxAttempts;
        this.currentDelay = builder.initialDelay;
    }

    /**
     * Device transport: 1 s doubling up to 5 min, circuit opens after 10 consecutive failures.
     */
    public static ReconnectionPolicy forDeviceTransport() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(5))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();
    }

    /**
     * Chat long-poll loop: 3 s pause between polls, growing by 1.5 up to 15 s on errors. Never opens.
     */
    public static ReconnectionPolicy forChatPolling() {
        return builder()
            .initialDelay(Duration.ofSeconds(3))
            .maxDelay(Duration.ofSeconds(15))
            .multiplier(1.5)
            .maxAttempts(Integer.MAX_VALUE)
            .build();
    }

    /**
     * False once the circuit has opened; the caller should cool down and {@link #reset()}.
     */
    public synchronized boolean shouldRetry() {
        return !circuitOpen;
    }

    /**
     * Delay to wait before the next attempt under the current failure streak.
     */
    public synchronized Duration currentDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and grow the delay.
     *
     * @return delay to wait before the next attempt
     */
    public synchronized Duration recordFailure() {
        if (failures < Integer.MAX_VALUE) {
            failures++;
        }
        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
        if (failures >= maxAttempts) {
            circuitOpen = true;
        }
        return currentDelay;
    }

    /**
     * Successful attempt: clear the streak and close the circuit.
     */
    public synchronized void recordSuccess() {
        failures = 0;
        currentDelay = initialDelay;
        circuitOpen = false;
    }

    /**
     * Manual circuit reset after a cool-down.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    public synchronized int getFailureCount() {
        return failures;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double multiplier = 2.0;
        private int maxAttempts = 10;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(this);
        }
    }
}
