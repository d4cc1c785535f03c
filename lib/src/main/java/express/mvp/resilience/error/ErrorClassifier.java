package express.mvp.resilience.error;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Classifies failures of protected operations into {@link ClassifiedError}s.
 *
 * <p>Classification looks at text only: the exception message and the exception's simple type
 * name, both lower-cased. The result is deterministic for the same text and context; the only
 * inputs from outside are the clock used to stamp {@code occurredAt} and the random suffix of
 * the id.
 *
 * <h2>Classification Strategy</h2>
 *
 * <p>The first matching rule wins:
 *
 * <ol>
 *   <li>CONNECTION - message contains "network", "connection", "econnrefused" or "enotfound"
 *   <li>TIMEOUT - message or type name contains "timeout"
 *   <li>VALIDATION - message contains "validation", "invalid", "required" or "schema"
 *   <li>API - message contains "api", "http", "status" or "response"
 *   <li>PARSING - message contains "parse", "json" or "syntax"
 *   <li>UNKNOWN otherwise
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ErrorClassifier classifier = new ErrorClassifier(Clock.systemUTC());
 * ClassifiedError error = classifier.classify(exception, attemptContext);
 * if (!error.isRetryable()) {
 *     throw exception;
 * }
 * }</pre>
 *
 * <p>This class is stateless apart from its clock and is safe for concurrent use.
 *
 * @see ErrorKind
 * @see ErrorSeverity
 */
public final class ErrorClassifier {

    /** Message used when the failure carries none. */
    static final String UNKNOWN_MESSAGE = "Unknown error occurred";

    /** Message of the synthetic error recorded for a call blocked by an open breaker. */
    public static final String CIRCUIT_OPEN_MESSAGE = "Circuit breaker is open - operation blocked";

    /** Bounds of the 9-digit base-36 id suffix. */
    private static final long MIN_SUFFIX = 2_821_109_907_456L;
    private static final long MAX_SUFFIX = 101_559_956_668_416L;

    private static final List<String> CONNECTION_HINTS =
            List.of(
                    "Check the remote service is running",
                    "Verify network connectivity",
                    "Restart the remote service if necessary");

    private static final List<String> TIMEOUT_HINTS =
            List.of(
                    "Increase timeout duration",
                    "Check server load",
                    "Verify request complexity");

    private static final List<String> VALIDATION_HINTS =
            List.of(
                    "Review request parameters",
                    "Check API documentation",
                    "Validate data format");

    private static final List<String> API_HINTS =
            List.of(
                    "Check API endpoint URL",
                    "Verify request method and headers",
                    "Review server logs");

    private static final List<String> PARSING_HINTS =
            List.of(
                    "Check response format",
                    "Verify content type",
                    "Review API documentation");

    private static final List<String> UNKNOWN_HINTS =
            List.of(
                    "Check logs for more details",
                    "Verify system configuration",
                    "Contact support if issue persists");

    private final Clock clock;

    /**
     * Creates a classifier stamping errors with the given clock.
     *
     * @param clock the clock for {@code occurredAt}
     */
    public ErrorClassifier(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Classifies a failure raised by an attempt.
     *
     * @param throwable the failure
     * @param context the attempt that raised it
     * @return a new classified error carrying the throwable as its cause
     */
    public ClassifiedError classify(Throwable throwable, AttemptContext context) {
        Objects.requireNonNull(throwable, "throwable");
        Objects.requireNonNull(context, "context");

        String rawMessage = throwable.getMessage();
        String message = rawMessage == null ? "" : rawMessage.toLowerCase(Locale.ROOT);
        String typeName = throwable.getClass().getSimpleName().toLowerCase(Locale.ROOT);

        ErrorKind kind = categorize(message, typeName);
        return new ClassifiedError(
                newId(),
                kind,
                severityOf(kind, message),
                rawMessage == null || rawMessage.isBlank() ? UNKNOWN_MESSAGE : rawMessage,
                context,
                isRetryable(kind, message),
                recoveryHints(kind),
                clock.instant(),
                throwable);
    }

    /**
     * Creates the synthetic error describing a call rejected by an open breaker.
     *
     * <p>The error is CONNECTION/HIGH and never retryable.
     *
     * @param context the blocked call, normally with attempt {@code 0}
     * @return the synthetic error
     */
    public ClassifiedError circuitOpen(AttemptContext context) {
        return new ClassifiedError(
                newId(),
                ErrorKind.CONNECTION,
                ErrorSeverity.HIGH,
                CIRCUIT_OPEN_MESSAGE,
                context,
                false,
                CONNECTION_HINTS,
                clock.instant(),
                null);
    }

    /**
     * Creates the synthetic low-severity notice for a call that succeeded after retries.
     *
     * @param context the successful attempt
     * @param attempts the number of attempts it took
     * @return the synthetic notice
     */
    public ClassifiedError recovery(AttemptContext context, int attempts) {
        return new ClassifiedError(
                newId(),
                ErrorKind.CONNECTION,
                ErrorSeverity.LOW,
                "Operation succeeded after " + attempts + " attempts",
                context,
                false,
                List.of(),
                clock.instant(),
                null);
    }

    /**
     * Maps lower-cased failure text to a kind.
     *
     * @param message the lower-cased message
     * @param typeName the lower-cased simple type name
     * @return the first matching kind
     */
    static ErrorKind categorize(String message, String typeName) {
        if (containsAny(message, "network", "connection", "econnrefused", "enotfound")) {
            return ErrorKind.CONNECTION;
        }
        if (message.contains("timeout") || typeName.contains("timeout")) {
            return ErrorKind.TIMEOUT;
        }
        if (containsAny(message, "validation", "invalid", "required", "schema")) {
            return ErrorKind.VALIDATION;
        }
        if (containsAny(message, "api", "http", "status", "response")) {
            return ErrorKind.API;
        }
        if (containsAny(message, "parse", "json", "syntax")) {
            return ErrorKind.PARSING;
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * Determines severity from the kind and the lower-cased message.
     *
     * <p>A connection failure mentioning a server is HIGH whatever the case of the mention.
     *
     * @param kind the kind
     * @param message the lower-cased message
     * @return the severity, never CRITICAL
     */
    static ErrorSeverity severityOf(ErrorKind kind, String message) {
        return switch (kind) {
            case CONNECTION -> message.contains("server") ? ErrorSeverity.HIGH : ErrorSeverity.MEDIUM;
            case TIMEOUT, UNKNOWN -> ErrorSeverity.MEDIUM;
            case VALIDATION, PARSING -> ErrorSeverity.LOW;
            // any '5' is taken as a 5xx status
            case API -> message.contains("5") ? ErrorSeverity.HIGH : ErrorSeverity.MEDIUM;
        };
    }

    /**
     * Determines whether another attempt is worthwhile.
     *
     * @param kind the kind
     * @param message the lower-cased message
     * @return true if the failure is retryable
     */
    static boolean isRetryable(ErrorKind kind, String message) {
        return switch (kind) {
            case CONNECTION, TIMEOUT, UNKNOWN -> true;
            case VALIDATION, PARSING -> false;
            case API -> containsAny(message, "5", "502", "503", "504");
        };
    }

    /**
     * Returns the fixed recovery hints of a kind.
     *
     * @param kind the kind
     * @return an unmodifiable, ordered list of hints
     */
    public static List<String> recoveryHints(ErrorKind kind) {
        return switch (kind) {
            case CONNECTION -> CONNECTION_HINTS;
            case TIMEOUT -> TIMEOUT_HINTS;
            case VALIDATION -> VALIDATION_HINTS;
            case API -> API_HINTS;
            case PARSING -> PARSING_HINTS;
            case UNKNOWN -> UNKNOWN_HINTS;
        };
    }

    /**
     * Returns a detailed, multi-line description of a classified error.
     *
     * @param error the error to describe
     * @return formatted description including kind, severity and cause
     */
    public static String describe(ClassifiedError error) {
        if (error == null) {
            return "null error";
        }

        StringBuilder sb = new StringBuilder();
        sb.append("Kind: ").append(error.kind().wireName());
        sb.append("\nSeverity: ").append(error.severity().wireName());
        sb.append("\nRetryable: ").append(error.isRetryable());
        sb.append("\nService: ").append(error.serviceKey());
        sb.append("\nAttempt: ")
                .append(error.context().attempt())
                .append('/')
                .append(error.context().maxAttempts());
        sb.append("\nMessage: ").append(error.message());

        error.cause()
                .ifPresent(
                        cause ->
                                sb.append("\nCause: ")
                                        .append(cause.getClass().getName())
                                        .append(" - ")
                                        .append(cause.getMessage()));

        if (!error.recoveryHints().isEmpty()) {
            sb.append("\nHints: ").append(String.join("; ", error.recoveryHints()));
        }
        return sb.toString();
    }

    private String newId() {
        long suffix = ThreadLocalRandom.current().nextLong(MIN_SUFFIX, MAX_SUFFIX);
        return "err_" + clock.millis() + "_" + Long.toString(suffix, 36);
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
