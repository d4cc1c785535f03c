package express.mvp.resilience.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Taxonomy-tagged description of one failed attempt.
 *
 * <p>A classified error is created exactly once per failed attempt by {@link ErrorClassifier} and
 * never changes afterwards. It is the unit stored by the error history and carried by
 * {@code error}, {@code retry} and {@code recovery} events. Callers of the retry executor never
 * receive it directly: they see the original exception, which is kept here as the
 * {@linkplain #cause() cause} for diagnostics.
 *
 * <p>Synthetic entries (a recovery notice or a call blocked by an open breaker) carry no cause.
 *
 * @see ErrorClassifier
 */
public final class ClassifiedError {

    private final String id;
    private final ErrorKind kind;
    private final ErrorSeverity severity;
    private final String message;
    private final AttemptContext context;
    private final boolean retryable;
    private final List<String> recoveryHints;
    private final Instant occurredAt;
    private final Throwable cause;

    /**
     * Creates a classified error.
     *
     * @param id unique id of this occurrence
     * @param kind the error kind
     * @param severity the severity
     * @param message the human-readable message
     * @param context the attempt that failed
     * @param retryable whether another attempt may succeed
     * @param recoveryHints ordered advisory hints (copied)
     * @param occurredAt when the error was classified
     * @param cause the original failure, or null for synthetic entries
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Throwable is kept for diagnostics and cannot be safely copied.")
    public ClassifiedError(
            String id,
            ErrorKind kind,
            ErrorSeverity severity,
            String message,
            AttemptContext context,
            boolean retryable,
            List<String> recoveryHints,
            Instant occurredAt,
            Throwable cause) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = Objects.requireNonNull(message, "message");
        this.context = Objects.requireNonNull(context, "context");
        this.retryable = retryable;
        this.recoveryHints = List.copyOf(recoveryHints);
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt");
        this.cause = cause;
    }

    public String id() {
        return id;
    }

    public ErrorKind kind() {
        return kind;
    }

    public ErrorSeverity severity() {
        return severity;
    }

    public String message() {
        return message;
    }

    public AttemptContext context() {
        return context;
    }

    /**
     * Returns the key of the breaker the failed call belongs to.
     *
     * @return the service key
     */
    public String serviceKey() {
        return context.serviceKey();
    }

    /**
     * Checks if another attempt may succeed.
     *
     * @return true if retrying is worthwhile
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns advisory recovery suggestions, most useful first.
     *
     * @return an unmodifiable list of hints
     */
    public List<String> recoveryHints() {
        return recoveryHints;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    /**
     * Returns the original failure.
     *
     * @return the cause, or empty for synthetic entries
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClassifiedError)) {
            return false;
        }
        return id.equals(((ClassifiedError) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format(
                "ClassifiedError[%s %s/%s retryable=%s %s: %s]",
                id, kind, severity, retryable, context.serviceKey(), message);
    }
}
