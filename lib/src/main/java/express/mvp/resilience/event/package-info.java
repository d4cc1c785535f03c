/**
 * Event publication for retries, recoveries and circuit breaker transitions.
 *
 * <p>Listeners subscribe per {@link express.mvp.resilience.event.EventType}. See {@link
 * express.mvp.resilience.event.EventNotifier} for delivery and ordering guarantees.
 */
package express.mvp.resilience.event;
