/**
 * Per call site circuit breakers.
 *
 * @see express.mvp.resilience.breaker.CircuitBreakerRegistry
 */
package express.mvp.resilience.breaker;
