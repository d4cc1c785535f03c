package express.mvp.resilience.breaker;

import express.mvp.resilience.ResilienceException;

/**
 * Thrown when a call is rejected because its circuit breaker is open.
 *
 * <p>The protected operation was not invoked.
 */
public class CircuitBreakerOpenException extends ResilienceException {

    /** Message carried by every instance. */
    public static final String MESSAGE = "Circuit breaker is open";

    private final String serviceKey;

    /**
     * Creates an exception for the given breaker.
     *
     * @param serviceKey the key of the open breaker
     */
    public CircuitBreakerOpenException(String serviceKey) {
        super(MESSAGE);
        this.serviceKey = serviceKey;
    }

    /**
     * Returns the key of the breaker that rejected the call.
     *
     * @return the service key
     */
    public String getServiceKey() {
        return serviceKey;
    }
}
