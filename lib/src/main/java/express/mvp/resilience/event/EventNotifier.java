package express.mvp.resilience.event;

import express.mvp.resilience.ResilienceThreadFactory;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans events out to subscribers.
 *
 * <p>Events are published either synchronously, on the caller's thread before
 * {@link #publish(ResilienceEvent)} returns, or deferred through a single-threaded executor so
 * that the publisher does not wait for subscribers. Deferred events are delivered in the order
 * they were published, so every subscriber sees events in the order they were raised.
 *
 * <p>Subscribers may attach and detach at any time, including from inside a listener. A listener
 * that throws is logged and skipped; the remaining listeners still receive the event.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventNotifier notifier = new EventNotifier();
 * notifier.subscribe(EventType.RETRY, event ->
 *     log.info("retrying " + event.serviceKey()));
 *
 * notifier.publish(ResilienceEvent.of(EventType.RETRY, classifiedError));
 * }</pre>
 */
public final class EventNotifier implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(EventNotifier.class.getName());

    /** Listeners per event type. Every type has a list from construction on. */
    private final Map<EventType, List<ResilienceEventListener>> listeners =
            new EnumMap<>(EventType.class);

    /** Executor for deferred delivery. */
    private final Executor deferredExecutor;

    /** Executor owned by this notifier, shut down on close; null when supplied by the caller. */
    private final ExecutorService ownedExecutor;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    /** Creates a notifier with its own daemon thread for deferred delivery. */
    public EventNotifier() {
        this(null);
    }

    /**
     * Creates a notifier delivering deferred events through the given executor.
     *
     * <p>The executor must run tasks one at a time in submission order to preserve event order.
     * It is not shut down by {@link #close()}.
     *
     * @param deferredExecutor executor for deferred delivery, or null to create one
     */
    public EventNotifier(Executor deferredExecutor) {
        for (EventType type : EventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
        if (deferredExecutor == null) {
            this.ownedExecutor =
                    Executors.newSingleThreadExecutor(new ResilienceThreadFactory("resilience-events"));
            this.deferredExecutor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.deferredExecutor = deferredExecutor;
        }
    }

    /**
     * Subscribes a listener to one event type.
     *
     * @param type the event type
     * @param listener the listener
     */
    public void subscribe(EventType type, ResilienceEventListener listener) {
        Objects.requireNonNull(type, "type");
        listeners.get(type).add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes a listener from one event type.
     *
     * @param type the event type
     * @param listener the listener
     * @return true if the listener was subscribed
     */
    public boolean unsubscribe(EventType type, ResilienceEventListener listener) {
        Objects.requireNonNull(type, "type");
        return listeners.get(type).remove(listener);
    }

    /** Removes every listener from every event type. */
    public void unsubscribeAll() {
        listeners.values().forEach(List::clear);
    }

    /**
     * Returns the number of listeners subscribed to an event type.
     *
     * @param type the event type
     * @return the listener count
     */
    public int listenerCount(EventType type) {
        return listeners.get(type).size();
    }

    /**
     * Delivers an event to its subscribers on the calling thread.
     *
     * @param event the event
     */
    public void publish(ResilienceEvent event) {
        Objects.requireNonNull(event, "event");
        deliver(event);
    }

    /**
     * Hands an event to the deferred executor and returns immediately.
     *
     * <p>Events published after {@link #close()} are dropped.
     *
     * @param event the event
     */
    public void publishDeferred(ResilienceEvent event) {
        Objects.requireNonNull(event, "event");
        if (closed.get()) {
            LOGGER.fine(() -> "Notifier closed, dropping " + event);
            return;
        }
        try {
            deferredExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Deferred event rejected: " + event, e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Detaches every listener and stops deferred delivery.
     *
     * <p>Invocation has no additional effect if already closed.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        unsubscribeAll();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private void deliver(ResilienceEvent event) {
        for (ResilienceEventListener listener : listeners.get(event.type())) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Listener for " + event.type() + " failed", e);
            }
        }
    }

    @Override
    public String toString() {
        int total = listeners.values().stream().mapToInt(List::size).sum();
        return "EventNotifier[listeners=" + total + ", closed=" + closed.get() + "]";
    }
}
