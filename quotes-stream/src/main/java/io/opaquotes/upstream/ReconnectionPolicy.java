package io.opaquotes.upstream;

import java.time.Duration;

/**
 * Capped exponential backoff for upstream channel subscriptions.
 *
 * The delay starts at {@code initialDelay}, is multiplied after every failure and
 * never exceeds {@code maxDelay}. A success resets it. There is no attempt limit:
 * an upstream channel is retried for as long as its adapter runs.
 *
 * <pre>
 * while (running) {
 *     try {
 *         subscribe();
 *         policy.recordSuccess();
 *     } catch (UpstreamConnectionException e) {
 *         Duration wait = policy.getNextDelay();
 *         policy.recordFailure();
 *         sleeper.sleep(wait);
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private int attemptCount = 0;
    private long totalFailures = 0;
    private Duration currentDelay;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.currentDelay = initialDelay;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and grow the delay for the next one.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        totalFailures++;

        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
    }

    /**
     * Record a successful subscribe. Delay goes back to the initial value.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
    }

    /**
     * @return failed attempts since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    /**
     * @return failed attempts over the policy's lifetime, not reset by success
     */
    public synchronized long getTotalFailures() {
        return totalFailures;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Backoff for a pub/sub channel: starts at {@code initial}, doubles, capped at
     * {@code max}.
     */
    public static ReconnectionPolicy forUpstreamChannel(Duration initial, Duration max) {
        return builder()
            .initialDelay(initial)
            .maxDelay(max)
            .multiplier(2.0)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;

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

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier);
        }
    }
}
