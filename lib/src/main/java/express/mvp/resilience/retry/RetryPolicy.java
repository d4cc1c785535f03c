package express.mvp.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how often and how patiently a protected operation is retried.
 *
 * <p>A policy holds the attempt ceiling and the inputs of the exponential backoff computed by
 * {@link BackoffCalculator}. Policies are immutable; use {@link #toBuilder()} to derive a policy
 * that overrides only some settings of another one.
 *
 * <h2>Defaults</h2>
 *
 * <ul>
 *   <li>{@code maxAttempts} = 3
 *   <li>{@code initialDelay} = 1000 ms
 *   <li>{@code maxDelay} = 10000 ms
 *   <li>{@code backoffFactor} = 2.0
 *   <li>{@code jitter} = true (±25%)
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicy quick = RetryPolicy.defaults().toBuilder()
 *     .initialDelay(Duration.ofMillis(10))
 *     .jitter(false)
 *     .build();
 * }</pre>
 *
 * @see BackoffCalculator
 * @see RetryExecutor
 */
public final class RetryPolicy {

    private static final RetryPolicy DEFAULTS = new Builder().build();

    /** Maximum number of attempts, including the first. */
    private final int maxAttempts;

    /** Delay before the first retry. */
    private final long initialDelayMillis;

    /** Cap applied before jitter. */
    private final long maxDelayMillis;

    /** Backoff multiplier, always greater than 1. */
    private final double backoffFactor;

    /** Whether ±25% jitter is applied. */
    private final boolean jitter;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelayMillis = builder.initialDelayMillis;
        this.maxDelayMillis = builder.maxDelayMillis;
        this.backoffFactor = builder.backoffFactor;
        this.jitter = builder.jitter;
    }

    /**
     * Returns the default policy.
     *
     * @return the shared default policy
     */
    public static RetryPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a policy that makes a single attempt.
     *
     * @return no-retry policy
     */
    public static RetryPolicy noRetry() {
        return new Builder().maxAttempts(1).build();
    }

    /**
     * Returns a builder seeded with the defaults.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder seeded with this policy's settings.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.maxAttempts = maxAttempts;
        builder.initialDelayMillis = initialDelayMillis;
        builder.maxDelayMillis = maxDelayMillis;
        builder.backoffFactor = backoffFactor;
        builder.jitter = jitter;
        return builder;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return Duration.ofMillis(initialDelayMillis);
    }

    public long getInitialDelayMillis() {
        return initialDelayMillis;
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMillis);
    }

    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public boolean isJitter() {
        return jitter;
    }

    /**
     * Returns a copy of this policy with a different attempt ceiling.
     *
     * @param maxAttempts the new ceiling
     * @return this policy if unchanged, else a new policy
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return maxAttempts == this.maxAttempts ? this : toBuilder().maxAttempts(maxAttempts).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RetryPolicy)) {
            return false;
        }
        RetryPolicy that = (RetryPolicy) o;
        return maxAttempts == that.maxAttempts
                && initialDelayMillis == that.initialDelayMillis
                && maxDelayMillis == that.maxDelayMillis
                && Double.compare(backoffFactor, that.backoffFactor) == 0
                && jitter == that.jitter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, initialDelayMillis, maxDelayMillis, backoffFactor, jitter);
    }

    @Override
    public String toString() {
        return String.format(
                "RetryPolicy[maxAttempts=%d, initialDelay=%dms, maxDelay=%dms, factor=%s, jitter=%s]",
                maxAttempts, initialDelayMillis, maxDelayMillis, backoffFactor, jitter);
    }

    /** Builder for {@link RetryPolicy}. */
    public static final class Builder {
        private int maxAttempts = 3;
        private long initialDelayMillis = 1000;
        private long maxDelayMillis = 10_000;
        private double backoffFactor = 2.0;
        private boolean jitter = true;

        private Builder() {}

        /**
         * Sets the maximum number of attempts.
         *
         * @param maxAttempts max attempts (must be >= 1)
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the delay before the first retry.
         *
         * @param delay initial delay (must not be negative)
         * @return this builder
         */
        public Builder initialDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must not be negative");
            }
            this.initialDelayMillis = delay.toMillis();
            return this;
        }

        /**
         * Sets the cap applied to the exponential delay before jitter.
         *
         * @param maxDelay maximum delay (must not be negative)
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelayMillis = maxDelay.toMillis();
            return this;
        }

        /**
         * Sets the backoff multiplier.
         *
         * @param factor multiplier (must be > 1.0)
         * @return this builder
         */
        public Builder backoffFactor(double factor) {
            if (!(factor > 1.0) || Double.isInfinite(factor)) {
                throw new IllegalArgumentException("backoffFactor must be > 1.0");
            }
            this.backoffFactor = factor;
            return this;
        }

        /**
         * Enables or disables ±25% jitter.
         *
         * @param jitter true to randomize delays
         * @return this builder
         */
        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * Builds the retry policy.
         *
         * @return new policy
         */
        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
