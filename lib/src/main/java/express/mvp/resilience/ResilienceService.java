package express.mvp.resilience;

import express.mvp.resilience.breaker.CircuitBreakerListener;
import express.mvp.resilience.breaker.CircuitBreakerOpenException;
import express.mvp.resilience.breaker.CircuitBreakerRegistry;
import express.mvp.resilience.breaker.CircuitBreakerState;
import express.mvp.resilience.breaker.CircuitPhase;
import express.mvp.resilience.error.ErrorClassifier;
import express.mvp.resilience.event.EventNotifier;
import express.mvp.resilience.event.EventType;
import express.mvp.resilience.event.ResilienceEvent;
import express.mvp.resilience.event.ResilienceEventListener;
import express.mvp.resilience.history.ErrorHistoryStore;
import express.mvp.resilience.history.ErrorStatistics;
import express.mvp.resilience.lifecycle.MaintenanceScheduler;
import express.mvp.resilience.retry.RetryExecutor;
import express.mvp.resilience.retry.RetryPolicy;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Entry point of the resilience core.
 *
 * <p>A service owns one circuit breaker registry, one error history, one event notifier and the
 * background maintenance that keeps them current. Every protected call goes through
 * {@code execute}; diagnostics read {@link #statistics()} and {@link #status()}.
 *
 * <h2>Events</h2>
 *
 * <ul>
 *   <li>{@code error}, {@code retry} and {@code recovery} are delivered synchronously during the
 *       call that raised them
 *   <li>{@code circuit-breaker-opened} is delivered synchronously when a call is rejected by an
 *       open breaker, and deferred when the registry trips a breaker
 *   <li>{@code circuit-breaker-closed} is deferred, raised when a half-open breaker closes
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (ResilienceService resilience = ResilienceService.create()) {
 *     resilience.subscribe(EventType.CIRCUIT_BREAKER_OPENED, event ->
 *         alerts.raise(event.serviceKey()));
 *
 *     Task task = resilience.execute(
 *         () -> api.createTask(request),
 *         OperationContext.builder("task-api", "create").correlationId(requestId).build());
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Any number of threads may call {@code execute} concurrently.
 */
public final class ResilienceService implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(ResilienceService.class.getName());

    private final ResilienceConfig config;
    private final CircuitBreakerRegistry registry;
    private final ErrorHistoryStore history;
    private final EventNotifier notifier;
    private final RetryExecutor executor;
    private final MaintenanceScheduler maintenance;
    private final CircuitBreakerListener transitionForwarder = this::forwardTransition;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ResilienceService(ResilienceConfig config) {
        this.config = config;
        this.registry = new CircuitBreakerRegistry(config.getCircuitBreaker(), config.getClock());
        this.history =
                new ErrorHistoryStore(
                        config.getHistoryCapacity(), config.getHistoryRetention(), config.getClock());
        this.notifier = new EventNotifier(config.getDeferredEventExecutor());
        this.executor =
                RetryExecutor.builder()
                        .defaultPolicy(config.getDefaultPolicy())
                        .registry(registry)
                        .history(history)
                        .notifier(notifier)
                        .classifier(new ErrorClassifier(config.getClock()))
                        .backoff(config.getBackoff())
                        .sleeper(config.getSleeper())
                        .clock(config.getClock())
                        .build();
        this.maintenance =
                new MaintenanceScheduler(
                        history, registry, config.getPruneInterval(), config.getReconcileInterval());
        registry.addListener(transitionForwarder);
    }

    /**
     * Creates a service with the default configuration and starts its maintenance.
     *
     * @return a running service
     */
    public static ResilienceService create() {
        return create(ResilienceConfig.defaults());
    }

    /**
     * Creates a service and, unless disabled in the configuration, starts its maintenance.
     *
     * @param config the configuration
     * @return a running service
     */
    public static ResilienceService create(ResilienceConfig config) {
        ResilienceService service = new ResilienceService(Objects.requireNonNull(config, "config"));
        if (config.isMaintenanceEnabled()) {
            service.maintenance.start();
        }
        LOGGER.fine(() -> "Resilience service created: " + config);
        return service;
    }

    public ResilienceConfig getConfig() {
        return config;
    }

    /**
     * Executes an operation with the default retry policy.
     *
     * @param operation the operation
     * @param context the call site
     * @param <T> the result type
     * @return the operation's result
     * @throws CircuitBreakerOpenException if the call site's breaker rejected the call
     * @throws IllegalStateException if the service has been cleaned up
     * @throws Exception the operation's last failure, unchanged
     */
    public <T> T execute(Operation<T> operation, OperationContext context) throws Exception {
        ensureOpen();
        return executor.execute(operation, context);
    }

    /**
     * Executes an operation with an explicit retry policy.
     *
     * @param operation the operation
     * @param context the call site
     * @param policy the retry policy
     * @param <T> the result type
     * @return the operation's result
     * @throws Exception see {@link #execute(Operation, OperationContext)}
     */
    public <T> T execute(Operation<T> operation, OperationContext context, RetryPolicy policy)
            throws Exception {
        ensureOpen();
        return executor.execute(operation, context, policy);
    }

    /**
     * Executes an operation with the default retry policy adjusted by the given overrides.
     *
     * <pre>{@code
     * resilience.execute(op, context, policy -> policy.maxAttempts(5).jitter(false));
     * }</pre>
     *
     * @param operation the operation
     * @param context the call site
     * @param overrides changes applied to a copy of the default policy
     * @param <T> the result type
     * @return the operation's result
     * @throws Exception see {@link #execute(Operation, OperationContext)}
     */
    public <T> T execute(
            Operation<T> operation,
            OperationContext context,
            Consumer<RetryPolicy.Builder> overrides)
            throws Exception {
        ensureOpen();
        return executor.execute(operation, context, overrides);
    }

    /**
     * Subscribes a listener to one event type.
     *
     * @param type the event type
     * @param listener the listener
     */
    public void subscribe(EventType type, ResilienceEventListener listener) {
        ensureOpen();
        notifier.subscribe(type, listener);
    }

    /**
     * Removes a listener from one event type.
     *
     * @param type the event type
     * @param listener the listener
     * @return true if the listener was subscribed
     */
    public boolean unsubscribe(EventType type, ResilienceEventListener listener) {
        return notifier.unsubscribe(type, listener);
    }

    /**
     * Aggregates the whole error history.
     *
     * @return error statistics
     */
    public ErrorStatistics statistics() {
        return history.statistics();
    }

    /**
     * Aggregates the errors that occurred within the given window.
     *
     * @param window how far back to look
     * @return error statistics
     */
    public ErrorStatistics statistics(Duration window) {
        return history.statistics(window);
    }

    /**
     * Returns a snapshot of every known circuit breaker.
     *
     * @return an unmodifiable map from service key to state, sorted by key
     */
    public Map<String, CircuitBreakerState> status() {
        return registry.status();
    }

    /**
     * Forces a circuit breaker back to closed.
     *
     * @param serviceKey the breaker's key, {@code service:operation}
     * @return false if the key is unknown
     */
    public boolean reset(String serviceKey) {
        return registry.reset(serviceKey);
    }

    /**
     * Runs the history pruning and breaker reconciliation sweeps once on the calling thread.
     *
     * @return the number of history entries pruned plus breakers promoted
     */
    public int runMaintenance() {
        ensureOpen();
        return maintenance.runOnce();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Detaches every subscriber, forgets all breakers and errors, and stops background work.
     *
     * <p>Invocation has no additional effect if already cleaned up.
     */
    public void cleanup() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        maintenance.stop();
        registry.removeListener(transitionForwarder);
        notifier.close();
        registry.clear();
        history.clear();
        LOGGER.fine("Resilience service cleaned up");
    }

    @Override
    public void close() {
        cleanup();
    }

    private void forwardTransition(String serviceKey, CircuitPhase previous, CircuitPhase current) {
        if (current == CircuitPhase.OPEN) {
            notifier.publishDeferred(
                    ResilienceEvent.ofServiceKey(EventType.CIRCUIT_BREAKER_OPENED, serviceKey));
        } else if (current == CircuitPhase.CLOSED && previous == CircuitPhase.HALF_OPEN) {
            notifier.publishDeferred(
                    ResilienceEvent.ofServiceKey(EventType.CIRCUIT_BREAKER_CLOSED, serviceKey));
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Resilience service has been cleaned up");
        }
    }

    @Override
    public String toString() {
        return "ResilienceService[breakers=" + registry.size() + ", errors=" + history.size()
                + ", closed=" + closed.get() + "]";
    }
}
