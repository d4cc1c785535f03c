package express.mvp.resilience;

/**
 * Unchecked exception raised by the resilience core itself.
 *
 * <p>Failures of protected operations are never wrapped in this type: the retry executor rethrows
 * them unchanged. This exception only signals decisions the core makes on its own, such as
 * rejecting a call because its circuit breaker is open.
 *
 * @see express.mvp.resilience.breaker.CircuitBreakerOpenException
 */
public class ResilienceException extends RuntimeException {

    /**
     * Constructs a new resilience exception with the specified message.
     *
     * @param message the detail message
     */
    public ResilienceException(String message) {
        super(message);
    }

    /**
     * Constructs a new resilience exception with the specified message and cause.
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
