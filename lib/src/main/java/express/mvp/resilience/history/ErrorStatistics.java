package express.mvp.resilience.history;

import express.mvp.resilience.error.ClassifiedError;
import express.mvp.resilience.error.ErrorKind;
import express.mvp.resilience.error.ErrorSeverity;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated view of the error history, optionally limited to a time window.
 *
 * <p>{@link #byKind()} and {@link #bySeverity()} always hold an entry for every enum constant,
 * zero when absent, and each sums to {@link #total()}. {@link #recent()} holds at most
 * {@value #RECENT_LIMIT} errors, newest first.
 *
 * @see ErrorHistoryStore#statistics()
 */
public final class ErrorStatistics {

    /** Maximum number of errors in {@link #recent()}. */
    public static final int RECENT_LIMIT = 10;

    private final int total;
    private final Map<ErrorKind, Integer> byKind;
    private final Map<ErrorSeverity, Integer> bySeverity;
    private final List<ClassifiedError> recent;

    private ErrorStatistics(
            int total,
            Map<ErrorKind, Integer> byKind,
            Map<ErrorSeverity, Integer> bySeverity,
            List<ClassifiedError> recent) {
        this.total = total;
        this.byKind = Collections.unmodifiableMap(byKind);
        this.bySeverity = Collections.unmodifiableMap(bySeverity);
        this.recent = List.copyOf(recent);
    }

    /**
     * Aggregates errors ordered newest first.
     *
     * @param errors the errors to count, newest first
     * @return the statistics
     */
    static ErrorStatistics of(List<ClassifiedError> errors) {
        Map<ErrorKind, Integer> byKind = new EnumMap<>(ErrorKind.class);
        for (ErrorKind kind : ErrorKind.values()) {
            byKind.put(kind, 0);
        }
        Map<ErrorSeverity, Integer> bySeverity = new EnumMap<>(ErrorSeverity.class);
        for (ErrorSeverity severity : ErrorSeverity.values()) {
            bySeverity.put(severity, 0);
        }

        for (ClassifiedError error : errors) {
            byKind.merge(error.kind(), 1, Integer::sum);
            bySeverity.merge(error.severity(), 1, Integer::sum);
        }

        return new ErrorStatistics(
                errors.size(),
                byKind,
                bySeverity,
                errors.subList(0, Math.min(RECENT_LIMIT, errors.size())));
    }

    public int total() {
        return total;
    }

    public Map<ErrorKind, Integer> byKind() {
        return byKind;
    }

    public Map<ErrorSeverity, Integer> bySeverity() {
        return bySeverity;
    }

    /**
     * Returns the count for one kind.
     *
     * @param kind the kind
     * @return the count, zero if none
     */
    public int count(ErrorKind kind) {
        return byKind.get(kind);
    }

    /**
     * Returns the count for one severity.
     *
     * @param severity the severity
     * @return the count, zero if none
     */
    public int count(ErrorSeverity severity) {
        return bySeverity.get(severity);
    }

    /**
     * Returns the newest errors.
     *
     * @return up to {@value #RECENT_LIMIT} errors, newest first
     */
    public List<ClassifiedError> recent() {
        return recent;
    }

    @Override
    public String toString() {
        return "ErrorStatistics[total=" + total + ", byKind=" + byKind + ", bySeverity=" + bySeverity + "]";
    }
}
