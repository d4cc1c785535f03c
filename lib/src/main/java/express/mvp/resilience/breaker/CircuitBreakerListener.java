package express.mvp.resilience.breaker;

/**
 * Callback interface for circuit breaker phase changes.
 *
 * <p>The registry invokes listeners after releasing the breaker's lock, on the thread that caused
 * the change. A breaker that trips again while already open reports {@code OPEN -> OPEN} because
 * its probe time was pushed back. Explicit resets are not reported.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * registry.addListener((key, previous, current) -> {
 *     if (current == CircuitPhase.OPEN) {
 *         alerting.raise("breaker open: " + key);
 *     }
 * });
 * }</pre>
 *
 * @see CircuitBreakerRegistry
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    /**
     * Called when a breaker changes phase, outside the breaker's lock.
     *
     * @param serviceKey the breaker's key
     * @param previous the phase before the change
     * @param current the phase after the change
     */
    void onTransition(String serviceKey, CircuitPhase previous, CircuitPhase current);
}
