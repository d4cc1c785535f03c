package express.mvp.resilience.error;

import express.mvp.resilience.OperationContext;
import java.time.Instant;
import java.util.Objects;

/**
 * An {@link OperationContext} stamped with the attempt that produced a classified error.
 *
 * <p>Attempt numbers are 1-based. Attempt {@code 0} marks a call that was rejected by an open
 * circuit breaker before the operation was invoked.
 */
public final class AttemptContext {

    private final OperationContext operation;
    private final int attempt;
    private final int maxAttempts;
    private final Instant timestamp;

    /**
     * Creates an attempt context.
     *
     * @param operation the call site
     * @param attempt the attempt number (0 for a blocked call)
     * @param maxAttempts the attempt ceiling in effect
     * @param timestamp when the attempt was made
     */
    public AttemptContext(
            OperationContext operation, int attempt, int maxAttempts, Instant timestamp) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
    }

    public OperationContext operation() {
        return operation;
    }

    public String serviceKey() {
        return operation.serviceKey();
    }

    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Checks if this is the last attempt the ceiling allows.
     *
     * @return true if no further attempt may follow
     */
    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttemptContext)) {
            return false;
        }
        AttemptContext that = (AttemptContext) o;
        return attempt == that.attempt
                && maxAttempts == that.maxAttempts
                && operation.equals(that.operation)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, attempt, maxAttempts, timestamp);
    }

    @Override
    public String toString() {
        return String.format(
                "AttemptContext[%s, attempt=%d/%d, at=%s]",
                operation.serviceKey(), attempt, maxAttempts, timestamp);
    }
}
