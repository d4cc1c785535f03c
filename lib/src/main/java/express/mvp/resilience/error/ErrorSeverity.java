package express.mvp.resilience.error;

/**
 * Severity ranking of a classified error, lowest first.
 *
 * <p>The classifier only ever produces {@link #LOW}, {@link #MEDIUM} and {@link #HIGH}.
 * {@link #CRITICAL} is reserved for host applications that build their own entries.
 */
public enum ErrorSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    ErrorSeverity(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the lower-case name used by event consumers and diagnostics.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Checks if this severity is at least as severe as another.
     *
     * @param other the severity to compare against
     * @return true if {@code this >= other}
     */
    public boolean isAtLeast(ErrorSeverity other) {
        return compareTo(other) >= 0;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
