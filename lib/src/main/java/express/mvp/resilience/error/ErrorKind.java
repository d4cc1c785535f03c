package express.mvp.resilience.error;

/**
 * Kinds of failures raised by a protected operation.
 *
 * <p>Every failed attempt is mapped to exactly one kind by {@link ErrorClassifier}. The kind
 * drives the default severity, whether a retry is worthwhile, and the recovery hints attached to
 * the classified error:
 *
 * <ul>
 *   <li><b>CONNECTION:</b> Remote unreachable, always retried
 *   <li><b>TIMEOUT:</b> Remote too slow, always retried
 *   <li><b>VALIDATION:</b> Malformed request, never retried
 *   <li><b>API:</b> Remote answered with an error status, retried only for 5xx-style failures
 *   <li><b>PARSING:</b> Response could not be decoded, never retried
 *   <li><b>UNKNOWN:</b> Nothing matched, retried optimistically
 * </ul>
 *
 * @see ErrorClassifier
 * @see ErrorSeverity
 */
public enum ErrorKind {

    /** Network or connection failure (refused, unreachable, DNS). */
    CONNECTION("connection", "Connection error - remote unreachable"),

    /** The remote did not answer in time. */
    TIMEOUT("timeout", "Timeout - remote too slow"),

    /** The request was rejected as malformed. Retrying will not change the outcome. */
    VALIDATION("validation", "Validation error - malformed request"),

    /**
     * The remote answered with an error status.
     *
     * <p>Server-side (5xx) failures are retryable, client-side (4xx) failures are not.
     */
    API("api", "API error - remote returned an error status"),

    /** The response could not be decoded. */
    PARSING("parsing", "Parsing error - response could not be decoded"),

    /** Unclassified failure, handled optimistically. */
    UNKNOWN("unknown", "Unknown error - optimistic retry");

    private final String wireName;
    private final String description;

    ErrorKind(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    /**
     * Returns the lower-case name used by event consumers and diagnostics.
     *
     * @return the wire name, e.g. {@code "connection"}
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Returns a human-readable description of this kind.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
