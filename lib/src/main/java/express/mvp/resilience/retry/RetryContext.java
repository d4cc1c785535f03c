package express.mvp.resilience.retry;

import express.mvp.resilience.OperationContext;
import express.mvp.resilience.error.AttemptContext;
import express.mvp.resilience.error.ClassifiedError;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Tracks the attempts of one {@link RetryExecutor#execute execute} call.
 *
 * <p>The context counts attempts, stamps a fresh {@link AttemptContext} for each of them, and
 * keeps the classification of the last failure along with the time spent waiting between
 * attempts.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is not thread-safe. Each call uses its own context instance.
 *
 * @see RetryExecutor
 */
final class RetryContext {

    /** The call site being retried. */
    private final OperationContext operation;

    /** Maximum number of attempts (including initial). */
    private final int maxAttempts;

    private final Clock clock;

    /** Current attempt number (1-based). */
    private int attemptCount;

    /** Time of first attempt. */
    private final Instant startTime;

    /** Classification of last error. */
    private ClassifiedError lastClassified;

    /** Total time spent in delays. */
    private long totalDelayMillis;

    RetryContext(OperationContext operation, int maxAttempts, Clock clock) {
        this.operation = operation;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    String getServiceKey() {
        return operation.serviceKey();
    }

    int getAttemptCount() {
        return attemptCount;
    }

    boolean hasAttemptsRemaining() {
        return attemptCount < maxAttempts;
    }

    /**
     * Records that an attempt is starting and stamps it.
     *
     * @return the stamp of the new attempt
     */
    AttemptContext startAttempt() {
        attemptCount++;
        return new AttemptContext(operation, attemptCount, maxAttempts, clock.instant());
    }

    /**
     * Returns a stamp for a call rejected before its first attempt.
     *
     * @return attempt {@code 0} stamp
     */
    AttemptContext blockedAttempt() {
        return new AttemptContext(operation, 0, maxAttempts, clock.instant());
    }

    void recordFailure(ClassifiedError classified) {
        this.lastClassified = classified;
    }

    void recordDelay(long delayMillis) {
        this.totalDelayMillis += delayMillis;
    }

    long getTotalDelayMillis() {
        return totalDelayMillis;
    }

    /**
     * Returns the time since the context was created, waits included.
     *
     * @return elapsed time
     */
    Duration getElapsedTime() {
        return Duration.between(startTime, clock.instant());
    }

    boolean isLastAttempt() {
        return attemptCount >= maxAttempts;
    }

    @Override
    public String toString() {
        return String.format(
                "RetryContext[op=%s, attempt=%d/%d, delayed=%dms, lastError=%s]",
                operation.serviceKey(),
                attemptCount,
                maxAttempts,
                totalDelayMillis,
                lastClassified == null ? null : lastClassified.kind());
    }
}
