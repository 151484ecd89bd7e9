package in.zonecast.infrastructure.broker;

import java.time.Duration;

/**
 * Exponential backoff for broker requests.
 *
 * Immutable and shareable: the delay depends only on the attempt number.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.forBroker();
 * for (int attempt = 1; ; attempt++) {
 *     if (send()) break;
 *     if (!policy.shouldRetry(attempt)) throw ...;
 *     sleeper.sleep(policy.delayAfter(attempt));
 * }
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * True when another attempt may follow the failed attempt number {@code attempt} (1-based).
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay to wait after the failed attempt number {@code attempt}: initial, then multiplied
     * per attempt, capped at the max delay.
     */
    public Duration delayAfter(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("Attempt must be positive: " + attempt);
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Broker default: 1s, 2s, 4s, 8s, 16s over at most 5 attempts.
     */
    public static RetryPolicy forBroker() {
        return builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(16))
            .multiplier(2.0)
            .maxAttempts(5)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(16);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

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
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier cannot be below 1.0");
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

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
