package express.mvp.resilience.breaker;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of one circuit breaker.
 *
 * <p>Snapshots are handed out by {@link CircuitBreakerRegistry#status()} and
 * {@link CircuitBreakerRegistry#state(String)}; they never change when the breaker moves on.
 */
public final class CircuitBreakerState {

    /** State of a breaker that has never failed. */
    public static final CircuitBreakerState INITIAL =
            new CircuitBreakerState(CircuitPhase.CLOSED, 0, null, null, 0);

    private final CircuitPhase phase;
    private final int consecutiveFailures;
    private final Instant lastFailureAt;
    private final Instant nextProbeAt;
    private final int halfOpenSuccesses;

    /**
     * Creates a snapshot.
     *
     * @param phase the phase
     * @param consecutiveFailures failure counter
     * @param lastFailureAt time of the last recorded failure, or null
     * @param nextProbeAt earliest probe time while open, or null
     * @param halfOpenSuccesses successes counted while half-open
     */
    public CircuitBreakerState(
            CircuitPhase phase,
            int consecutiveFailures,
            Instant lastFailureAt,
            Instant nextProbeAt,
            int halfOpenSuccesses) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.consecutiveFailures = consecutiveFailures;
        this.lastFailureAt = lastFailureAt;
        this.nextProbeAt = nextProbeAt;
        this.halfOpenSuccesses = halfOpenSuccesses;
    }

    public CircuitPhase phase() {
        return phase;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    public Optional<Instant> lastFailureAt() {
        return Optional.ofNullable(lastFailureAt);
    }

    /**
     * Returns the earliest time a probe is admitted. Meaningful only while open.
     *
     * @return the probe time
     */
    public Optional<Instant> nextProbeAt() {
        return Optional.ofNullable(nextProbeAt);
    }

    /**
     * Returns the successes counted since the breaker became half-open.
     *
     * @return half-open success count
     */
    public int halfOpenSuccesses() {
        return halfOpenSuccesses;
    }

    public boolean isOpen() {
        return phase == CircuitPhase.OPEN;
    }

    public boolean isClosed() {
        return phase == CircuitPhase.CLOSED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CircuitBreakerState)) {
            return false;
        }
        CircuitBreakerState that = (CircuitBreakerState) o;
        return phase == that.phase
                && consecutiveFailures == that.consecutiveFailures
                && halfOpenSuccesses == that.halfOpenSuccesses
                && Objects.equals(lastFailureAt, that.lastFailureAt)
                && Objects.equals(nextProbeAt, that.nextProbeAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                phase, consecutiveFailures, lastFailureAt, nextProbeAt, halfOpenSuccesses);
    }

    @Override
    public String toString() {
        return "CircuitBreakerState[phase="
                + phase
                + ", failures="
                + consecutiveFailures
                + ", lastFailureAt="
                + lastFailureAt
                + ", nextProbeAt="
                + nextProbeAt
                + ", halfOpenSuccesses="
                + halfOpenSuccesses
                + "]";
    }
}
