/**
 * Retry, circuit breaking and error tracking for calls to remote services.
 *
 * <p>{@link express.mvp.resilience.ResilienceService} is the entry point. It wraps an {@link
 * express.mvp.resilience.Operation} with bounded retries and exponential backoff, guards each call
 * site with a circuit breaker, classifies and records every failure, and publishes events that
 * describe what happened.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.resilience.ResilienceService} - Facade wiring every component together
 *   <li>{@link express.mvp.resilience.ResilienceConfig} - Immutable service configuration
 *   <li>{@link express.mvp.resilience.OperationContext} - Identifies a call site
 * </ul>
 *
 * @see express.mvp.resilience.retry.RetryExecutor
 * @see express.mvp.resilience.breaker.CircuitBreakerRegistry
 */
package express.mvp.resilience;
