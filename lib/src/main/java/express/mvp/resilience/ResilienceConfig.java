package express.mvp.resilience;

import express.mvp.resilience.breaker.CircuitBreakerConfig;
import express.mvp.resilience.history.ErrorHistoryStore;
import express.mvp.resilience.lifecycle.MaintenanceScheduler;
import express.mvp.resilience.retry.BackoffCalculator;
import express.mvp.resilience.retry.RetryPolicy;
import express.mvp.resilience.retry.Sleeper;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Configuration of a {@link ResilienceService}.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * ResilienceConfig config = ResilienceConfig.builder()
 *     .defaultPolicy(RetryPolicy.builder().maxAttempts(5).build())
 *     .circuitBreaker(CircuitBreakerConfig.builder().failureThreshold(3).build())
 *     .historyCapacity(500)
 *     .build();
 * }</pre>
 *
 * <h2>Deterministic Mode</h2>
 *
 * <p>Tests usually pin the clock, replace the sleeper, fix the jitter source and disable the
 * background sweeps:
 *
 * <pre>{@code
 * ResilienceConfig config = ResilienceConfig.builder()
 *     .clock(testClock)
 *     .sleeper(delays::add)
 *     .backoff(new BackoffCalculator(() -> 0.5))
 *     .deferredEventExecutor(Runnable::run)
 *     .maintenanceEnabled(false)
 *     .build();
 * }</pre>
 */
public final class ResilienceConfig {

    /** Default number of errors kept in the history. */
    public static final int DEFAULT_HISTORY_CAPACITY = ErrorHistoryStore.DEFAULT_CAPACITY;

    private final RetryPolicy defaultPolicy;
    private final CircuitBreakerConfig circuitBreaker;
    private final int historyCapacity;
    private final Duration historyRetention;
    private final Duration pruneInterval;
    private final boolean maintenanceEnabled;
    private final Clock clock;
    private final Sleeper sleeper;
    private final BackoffCalculator backoff;
    private final Executor deferredEventExecutor;

    private ResilienceConfig(Builder builder) {
        this.defaultPolicy = builder.defaultPolicy;
        this.circuitBreaker = builder.circuitBreaker;
        this.historyCapacity = builder.historyCapacity;
        this.historyRetention = builder.historyRetention;
        this.pruneInterval = builder.pruneInterval;
        this.maintenanceEnabled = builder.maintenanceEnabled;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
        this.backoff = builder.backoff;
        this.deferredEventExecutor = builder.deferredEventExecutor;
    }

    /**
     * Returns the default configuration.
     *
     * @return default configuration
     */
    public static ResilienceConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public CircuitBreakerConfig getCircuitBreaker() {
        return circuitBreaker;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public Duration getHistoryRetention() {
        return historyRetention;
    }

    public Duration getPruneInterval() {
        return pruneInterval;
    }

    /**
     * Returns the interval of the breaker reconciliation sweep, which is the breaker monitoring
     * period.
     *
     * @return the reconciliation interval
     */
    public Duration getReconcileInterval() {
        return circuitBreaker.monitoringPeriod();
    }

    public boolean isMaintenanceEnabled() {
        return maintenanceEnabled;
    }

    public Clock getClock() {
        return clock;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public BackoffCalculator getBackoff() {
        return backoff;
    }

    /**
     * Returns the executor used for deferred event delivery.
     *
     * @return the executor, or null if the service creates its own
     */
    public Executor getDeferredEventExecutor() {
        return deferredEventExecutor;
    }

    @Override
    public String toString() {
        return "ResilienceConfig{"
                + "defaultPolicy=" + defaultPolicy
                + ", circuitBreaker=" + circuitBreaker
                + ", historyCapacity=" + historyCapacity
                + ", historyRetention=" + historyRetention
                + ", pruneInterval=" + pruneInterval
                + ", maintenanceEnabled=" + maintenanceEnabled
                + '}';
    }

    /** Builder for {@link ResilienceConfig}. */
    public static final class Builder {
        private RetryPolicy defaultPolicy = RetryPolicy.defaults();
        private CircuitBreakerConfig circuitBreaker = CircuitBreakerConfig.defaults();
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private Duration historyRetention = ErrorHistoryStore.DEFAULT_RETENTION;
        private Duration pruneInterval = MaintenanceScheduler.DEFAULT_PRUNE_INTERVAL;
        private boolean maintenanceEnabled = true;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD;
        private BackoffCalculator backoff = BackoffCalculator.standard();
        private Executor deferredEventExecutor;

        private Builder() {}

        public Builder defaultPolicy(RetryPolicy policy) {
            this.defaultPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerConfig config) {
            this.circuitBreaker = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Sets the maximum number of errors kept in the history.
         *
         * @param capacity the capacity (must be positive)
         * @return this builder
         */
        public Builder historyCapacity(int capacity) {
            if (capacity < 1) {
                throw new IllegalArgumentException("historyCapacity must be positive");
            }
            this.historyCapacity = capacity;
            return this;
        }

        /**
         * Sets how long errors are kept before the pruning sweep removes them.
         *
         * @param retention the retention period (must be positive)
         * @return this builder
         */
        public Builder historyRetention(Duration retention) {
            this.historyRetention = requirePositive(retention, "historyRetention");
            return this;
        }

        public Builder pruneInterval(Duration interval) {
            this.pruneInterval = requirePositive(interval, "pruneInterval");
            return this;
        }

        /**
         * Enables or disables the background sweeps. When disabled, maintenance runs only through
         * {@link ResilienceService#runMaintenance()}.
         *
         * @param enabled whether to start the sweeps
         * @return this builder
         */
        public Builder maintenanceEnabled(boolean enabled) {
            this.maintenanceEnabled = enabled;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder backoff(BackoffCalculator backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        /**
         * Sets the executor for deferred breaker-transition events. It must run tasks one at a
         * time in submission order. The service does not shut it down.
         *
         * @param executor the executor, or null to let the service create one
         * @return this builder
         */
        public Builder deferredEventExecutor(Executor executor) {
            this.deferredEventExecutor = executor;
            return this;
        }

        public ResilienceConfig build() {
            return new ResilienceConfig(this);
        }

        private static Duration requirePositive(Duration duration, String name) {
            Objects.requireNonNull(duration, name);
            if (duration.isNegative() || duration.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return duration;
        }
    }
}
