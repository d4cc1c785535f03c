package express.mvp.resilience.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Registry-wide circuit breaker settings.
 *
 * <p>The same settings apply to every key; there is no per-key configuration.
 *
 * <h2>Defaults</h2>
 *
 * <ul>
 *   <li>{@code failureThreshold} = 5 consecutive failures to open
 *   <li>{@code recoveryTimeout} = 30 s between opening and the first probe
 *   <li>{@code monitoringPeriod} = 60 s between reconciliation sweeps
 *   <li>{@code successThreshold} = 2 half-open successes to close
 * </ul>
 */
public final class CircuitBreakerConfig {

    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Duration monitoringPeriod;
    private final int successThreshold;

    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.recoveryTimeout = builder.recoveryTimeout;
        this.monitoringPeriod = builder.monitoringPeriod;
        this.successThreshold = builder.successThreshold;
    }

    /**
     * Returns the default settings.
     *
     * @return default config
     */
    public static CircuitBreakerConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a builder seeded with the defaults.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public int failureThreshold() {
        return failureThreshold;
    }

    public Duration recoveryTimeout() {
        return recoveryTimeout;
    }

    /**
     * Returns the interval of the background sweep that promotes expired open breakers.
     *
     * @return the monitoring period
     */
    public Duration monitoringPeriod() {
        return monitoringPeriod;
    }

    public int successThreshold() {
        return successThreshold;
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig[failureThreshold="
                + failureThreshold
                + ", recoveryTimeout="
                + recoveryTimeout
                + ", monitoringPeriod="
                + monitoringPeriod
                + ", successThreshold="
                + successThreshold
                + "]";
    }

    /** Builder for {@link CircuitBreakerConfig}. */
    public static final class Builder {
        private int failureThreshold = 5;
        private Duration recoveryTimeout = Duration.ofSeconds(30);
        private Duration monitoringPeriod = Duration.ofSeconds(60);
        private int successThreshold = 2;

        private Builder() {}

        /**
         * Sets the consecutive failures that open a breaker.
         *
         * @param threshold failure threshold (must be >= 1)
         * @return this builder
         */
        public Builder failureThreshold(int threshold) {
            if (threshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1");
            }
            this.failureThreshold = threshold;
            return this;
        }

        /**
         * Sets how long a breaker stays open before a probe is admitted.
         *
         * @param timeout recovery timeout (must not be negative)
         * @return this builder
         */
        public Builder recoveryTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("recoveryTimeout must not be negative");
            }
            this.recoveryTimeout = timeout;
            return this;
        }

        /**
         * Sets the interval of the reconciliation sweep.
         *
         * @param period monitoring period (must be positive)
         * @return this builder
         */
        public Builder monitoringPeriod(Duration period) {
            Objects.requireNonNull(period, "period");
            if (period.isNegative() || period.isZero()) {
                throw new IllegalArgumentException("monitoringPeriod must be positive");
            }
            this.monitoringPeriod = period;
            return this;
        }

        /**
         * Sets the half-open successes that close a breaker.
         *
         * @param threshold success threshold (must be >= 1)
         * @return this builder
         */
        public Builder successThreshold(int threshold) {
            if (threshold < 1) {
                throw new IllegalArgumentException("successThreshold must be >= 1");
            }
            this.successThreshold = threshold;
            return this;
        }

        /**
         * Builds the config.
         *
         * @return new config
         */
        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(this);
        }
    }
}
