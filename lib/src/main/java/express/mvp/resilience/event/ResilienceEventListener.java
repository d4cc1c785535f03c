package express.mvp.resilience.event;

/**
 * Receives events from an {@link EventNotifier}.
 *
 * <p>Synchronous events run on the thread executing the protected call, so implementations should
 * be quick and non-blocking. Exceptions thrown by a listener are logged and do not reach the
 * caller or other listeners.
 */
@FunctionalInterface
public interface ResilienceEventListener {

    /**
     * Called for each event the listener is subscribed to.
     *
     * @param event the event
     */
    void onEvent(ResilienceEvent event);
}
