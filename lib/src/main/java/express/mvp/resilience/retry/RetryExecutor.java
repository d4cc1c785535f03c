package express.mvp.resilience.retry;

import express.mvp.resilience.Operation;
import express.mvp.resilience.OperationContext;
import express.mvp.resilience.breaker.CircuitBreakerOpenException;
import express.mvp.resilience.breaker.CircuitBreakerRegistry;
import express.mvp.resilience.error.AttemptContext;
import express.mvp.resilience.error.ClassifiedError;
import express.mvp.resilience.error.ErrorClassifier;
import express.mvp.resilience.event.EventNotifier;
import express.mvp.resilience.event.EventType;
import express.mvp.resilience.event.ResilienceEvent;
import express.mvp.resilience.history.ErrorHistoryStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Runs operations with retries, backoff and circuit breaking.
 *
 * <h2>Execution Flow</h2>
 *
 * <pre>
 * 1. canAttempt(serviceKey)?
 *    └─▶ no: emit circuit-breaker-opened, throw CircuitBreakerOpenException
 *
 * 2. for attempt = 1..maxAttempts
 *    ├─▶ attempt &gt; 1: wait delay(attempt - 1)
 *    ├─▶ success: recordSuccess, emit recovery if attempt &gt; 1, return result
 *    └─▶ failure: classify, record in history, emit error
 *        ├─▶ attempts left and retryable: emit retry, continue
 *        └─▶ otherwise: recordFailure, rethrow the original exception
 * </pre>
 *
 * <p>The breaker is consulted once per call, before the first attempt, and charged at most one
 * failure per call. Per-attempt events are published synchronously, so they have been delivered
 * by the time {@code execute} returns or throws.
 *
 * <p>The caller always sees the original failure. Classified errors exist only for events,
 * history and statistics.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * String body = executor.execute(
 *     () -> httpClient.get("/status"),
 *     OperationContext.of("task-api", "status"),
 *     RetryPolicy.builder().maxAttempts(5).build());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Concurrent calls share only the registry and the history, both of
 * which serialize access internally.
 *
 * @see RetryPolicy
 * @see CircuitBreakerRegistry
 */
public final class RetryExecutor {

    private static final Logger LOGGER = Logger.getLogger(RetryExecutor.class.getName());

    private final RetryPolicy defaultPolicy;
    private final CircuitBreakerRegistry registry;
    private final ErrorHistoryStore history;
    private final EventNotifier notifier;
    private final ErrorClassifier classifier;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;
    private final Clock clock;

    private RetryExecutor(Builder builder) {
        this.defaultPolicy = builder.defaultPolicy;
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.history = Objects.requireNonNull(builder.history, "history");
        this.notifier = Objects.requireNonNull(builder.notifier, "notifier");
        this.clock = builder.clock;
        this.classifier =
                builder.classifier != null ? builder.classifier : new ErrorClassifier(builder.clock);
        this.backoff = builder.backoff;
        this.sleeper = builder.sleeper;
    }

    /**
     * Returns a builder for an executor.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Executes an operation with the default policy.
     *
     * @param operation the operation
     * @param context the call site
     * @param <T> the result type
     * @return the operation's result
     * @throws CircuitBreakerOpenException if the call site's breaker rejected the call
     * @throws InterruptedException if interrupted while waiting between attempts
     * @throws Exception the operation's last failure, unchanged
     */
    public <T> T execute(Operation<T> operation, OperationContext context) throws Exception {
        return execute(operation, context, defaultPolicy);
    }

    /**
     * Executes an operation with the default policy adjusted by the given overrides.
     *
     * @param operation the operation
     * @param context the call site
     * @param overrides changes applied to a copy of the default policy
     * @param <T> the result type
     * @return the operation's result
     * @throws Exception see {@link #execute(Operation, OperationContext, RetryPolicy)}
     */
    public <T> T execute(
            Operation<T> operation,
            OperationContext context,
            Consumer<RetryPolicy.Builder> overrides)
            throws Exception {
        Objects.requireNonNull(overrides, "overrides");
        RetryPolicy.Builder builder = defaultPolicy.toBuilder();
        overrides.accept(builder);
        return execute(operation, context, builder.build());
    }

    /**
     * Executes an operation with an explicit policy.
     *
     * <p>A {@linkplain OperationContext#maxAttempts() context attempt override} takes precedence
     * over the policy's ceiling.
     *
     * @param operation the operation
     * @param context the call site
     * @param policy the retry policy
     * @param <T> the result type
     * @return the operation's result
     * @throws CircuitBreakerOpenException if the call site's breaker rejected the call
     * @throws InterruptedException if interrupted while waiting between attempts
     * @throws Exception the operation's last failure, unchanged
     */
    public <T> T execute(Operation<T> operation, OperationContext context, RetryPolicy policy)
            throws Exception {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(policy, "policy");

        RetryPolicy effective =
                policy.withMaxAttempts(context.maxAttempts().orElse(policy.getMaxAttempts()));
        RetryContext retry = new RetryContext(context, effective.getMaxAttempts(), clock);
        String serviceKey = retry.getServiceKey();

        if (!registry.canAttempt(serviceKey)) {
            ClassifiedError blocked = classifier.circuitOpen(retry.blockedAttempt());
            notifier.publish(ResilienceEvent.of(EventType.CIRCUIT_BREAKER_OPENED, blocked));
            LOGGER.fine(() -> "Rejected call to " + serviceKey + ", circuit breaker is open");
            throw new CircuitBreakerOpenException(serviceKey);
        }

        while (retry.hasAttemptsRemaining()) {
            if (retry.getAttemptCount() > 0) {
                waitBeforeRetry(retry, effective);
            }
            AttemptContext attempt = retry.startAttempt();

            T result;
            try {
                result = operation.call();
            } catch (Exception e) {
                ClassifiedError classified = classifier.classify(e, attempt);
                retry.recordFailure(classified);
                history.record(classified);
                notifier.publish(ResilienceEvent.of(EventType.ERROR, classified));

                if (!retry.isLastAttempt() && classified.isRetryable()) {
                    notifier.publish(ResilienceEvent.of(EventType.RETRY, classified));
                    continue;
                }

                registry.recordFailure(serviceKey);
                LOGGER.fine(() -> describeGiveUp(retry, classified));
                throw e;
            }

            registry.recordSuccess(serviceKey);
            if (attempt.attempt() > 1) {
                notifier.publish(
                        ResilienceEvent.of(
                                EventType.RECOVERY,
                                classifier.recovery(attempt, attempt.attempt())));
            }
            return result;
        }

        throw new IllegalStateException("Retry loop ended without a result: " + retry);
    }

    static String describeGiveUp(RetryContext retry, ClassifiedError classified) {
        return "Giving up on " + retry + " after " + retry.getElapsedTime().toMillis() + "ms ("
                + retry.getTotalDelayMillis() + "ms waiting): " + classified.message();
    }

    private void waitBeforeRetry(RetryContext retry, RetryPolicy policy)
            throws InterruptedException {
        Duration delay = backoff.delay(retry.getAttemptCount(), policy);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
        retry.recordDelay(delay.toMillis());
    }

    @Override
    public String toString() {
        return "RetryExecutor[defaultPolicy=" + defaultPolicy + "]";
    }

    /** Builder for {@link RetryExecutor}. */
    public static final class Builder {
        private RetryPolicy defaultPolicy = RetryPolicy.defaults();
        private CircuitBreakerRegistry registry;
        private ErrorHistoryStore history;
        private EventNotifier notifier;
        private ErrorClassifier classifier;
        private BackoffCalculator backoff = BackoffCalculator.standard();
        private Sleeper sleeper = Sleeper.THREAD;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the policy used when a call names none.
         *
         * @param policy the default policy
         * @return this builder
         */
        public Builder defaultPolicy(RetryPolicy policy) {
            this.defaultPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder registry(CircuitBreakerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder history(ErrorHistoryStore history) {
            this.history = history;
            return this;
        }

        public Builder notifier(EventNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        /**
         * Sets the classifier. Defaults to one using the builder's clock.
         *
         * @param classifier the classifier
         * @return this builder
         */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder backoff(BackoffCalculator backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff");
            return this;
        }

        /**
         * Sets how backoff delays are waited out.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Builds the executor.
         *
         * @return new executor
         * @throws NullPointerException if registry, history or notifier is missing
         */
        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
