package express.mvp.resilience.lifecycle;

import express.mvp.resilience.ResilienceThreadFactory;
import express.mvp.resilience.breaker.CircuitBreakerRegistry;
import express.mvp.resilience.history.ErrorHistoryStore;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the two background sweeps of the resilience core.
 *
 * <ul>
 *   <li><b>History pruning:</b> removes errors older than the retention period, every
 *       {@code pruneInterval} (10 minutes by default)
 *   <li><b>Breaker reconciliation:</b> moves open breakers whose probe time has passed to
 *       half-open, every {@code reconcileInterval} (the breaker monitoring period, 60 seconds by
 *       default)
 * </ul>
 *
 * <p>Both sweeps run on one daemon thread. A failing sweep is logged and runs again at its next
 * interval. {@link #runOnce()} runs both sweeps on the calling thread, which is how deterministic
 * setups drive maintenance without starting the scheduler.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * NEW ──start()──▶ RUNNING ──stop()──▶ STOPPED
 *  └──────────────stop()──────────────────▲
 * </pre>
 *
 * <p>A stopped scheduler cannot be restarted.
 */
public final class MaintenanceScheduler implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(MaintenanceScheduler.class.getName());

    /** Default interval of the history pruning sweep. */
    public static final Duration DEFAULT_PRUNE_INTERVAL = Duration.ofMinutes(10);

    /** Scheduler lifecycle states. */
    public enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    private final ErrorHistoryStore history;
    private final CircuitBreakerRegistry registry;
    private final Duration pruneInterval;
    private final Duration reconcileInterval;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private volatile ScheduledExecutorService scheduler;

    /**
     * Creates a scheduler; nothing runs until {@link #start()}.
     *
     * @param history the history to prune
     * @param registry the registry to reconcile
     * @param pruneInterval interval of the pruning sweep
     * @param reconcileInterval interval of the reconciliation sweep
     */
    public MaintenanceScheduler(
            ErrorHistoryStore history,
            CircuitBreakerRegistry registry,
            Duration pruneInterval,
            Duration reconcileInterval) {
        this.history = Objects.requireNonNull(history, "history");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pruneInterval = requirePositive(pruneInterval, "pruneInterval");
        this.reconcileInterval = requirePositive(reconcileInterval, "reconcileInterval");
    }

    public State getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    public Duration getPruneInterval() {
        return pruneInterval;
    }

    public Duration getReconcileInterval() {
        return reconcileInterval;
    }

    /**
     * Starts both sweeps. The first run of each happens one interval from now.
     *
     * @return true if this call started the scheduler
     */
    public boolean start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            return false;
        }
        ScheduledExecutorService executor =
                Executors.newSingleThreadScheduledExecutor(
                        new ResilienceThreadFactory("resilience-maintenance"));
        long pruneMillis = pruneInterval.toMillis();
        long reconcileMillis = reconcileInterval.toMillis();
        executor.scheduleAtFixedRate(
                () -> guarded("history pruning", this::pruneHistory),
                pruneMillis,
                pruneMillis,
                TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(
                () -> guarded("breaker reconciliation", this::reconcileBreakers),
                reconcileMillis,
                reconcileMillis,
                TimeUnit.MILLISECONDS);
        scheduler = executor;
        LOGGER.fine(
                () -> "Maintenance started: prune every " + pruneInterval
                        + ", reconcile every " + reconcileInterval);
        return true;
    }

    /**
     * Runs both sweeps once on the calling thread.
     *
     * @return the number of history entries pruned plus breakers promoted
     */
    public int runOnce() {
        return pruneHistory() + reconcileBreakers();
    }

    /**
     * Stops both sweeps. A sweep already in progress is allowed to finish.
     *
     * <p>Invocation has no additional effect if already stopped.
     */
    public void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.RUNNING) {
            ScheduledExecutorService executor = scheduler;
            if (executor != null) {
                executor.shutdownNow();
            }
            LOGGER.fine("Maintenance stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    private int pruneHistory() {
        return history.prune();
    }

    private int reconcileBreakers() {
        return registry.reconcile();
    }

    private void guarded(String name, IntSupplier sweep) {
        try {
            sweep.getAsInt();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Maintenance sweep failed: " + name, e);
        }
    }

    private static Duration requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return duration;
    }

    @Override
    public String toString() {
        return "MaintenanceScheduler[" + state.get() + ", prune=" + pruneInterval
                + ", reconcile=" + reconcileInterval + "]";
    }
}
