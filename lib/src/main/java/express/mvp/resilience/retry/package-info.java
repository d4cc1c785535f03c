/**
 * Retry policies, backoff and the retry executor.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.resilience.retry.RetryPolicy} - Attempt ceiling and backoff settings
 *   <li>{@link express.mvp.resilience.retry.BackoffCalculator} - Exponential delay with jitter
 *   <li>{@link express.mvp.resilience.retry.RetryExecutor} - Runs an operation under a policy
 * </ul>
 */
package express.mvp.resilience.retry;
