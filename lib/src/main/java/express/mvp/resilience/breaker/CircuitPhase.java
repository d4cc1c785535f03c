package express.mvp.resilience.breaker;

/**
 * Phases of a circuit breaker.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 *            failures &gt;= threshold
 * ┌────────┐ ─────────────────────▶ ┌────────┐
 * │ CLOSED │                        │  OPEN  │◀──────┐
 * └────────┘ ◀──────┐               └────────┘       │
 *     ▲             │ reset()           │            │ failure
 *     │             └───────────────────┤            │
 *     │ 2 successes                     │ probe time │
 *     │                                 ▼ elapsed    │
 *     │                           ┌───────────┐      │
 *     └───────────────────────────│ HALF_OPEN │──────┘
 *                                 └───────────┘
 * </pre>
 *
 * <ul>
 *   <li>{@link #CLOSED}: Calls flow, failures are counted
 *   <li>{@link #OPEN}: Calls are rejected until the probe time
 *   <li>{@link #HALF_OPEN}: Probe calls flow, successes are counted
 * </ul>
 *
 * @see CircuitBreakerRegistry
 */
public enum CircuitPhase {

    /** Normal operation. Every call is allowed. */
    CLOSED("closed", true),

    /** Tripped. Calls are rejected until {@code nextProbeAt}. */
    OPEN("open", false),

    /** Probing. Calls are allowed; enough successes close the breaker again. */
    HALF_OPEN("half-open", true);

    private final String wireName;
    private final boolean admitting;

    CircuitPhase(String wireName, boolean admitting) {
        this.wireName = wireName;
        this.admitting = admitting;
    }

    /**
     * Returns the lower-case name used by diagnostics, e.g. {@code "half-open"}.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Checks if calls are admitted without waiting for a probe time.
     *
     * @return true for CLOSED and HALF_OPEN
     */
    public boolean isAdmitting() {
        return admitting;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
