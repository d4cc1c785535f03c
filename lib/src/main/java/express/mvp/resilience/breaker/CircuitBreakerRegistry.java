package express.mvp.resilience.breaker;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe registry of circuit breakers keyed by {@code service:operation}.
 *
 * <p>A breaker is created lazily, {@link CircuitPhase#CLOSED} with no failures, the first time
 * its key is referenced. Every key has its own lock, so the gate check and the outcome callbacks
 * are atomic per key while different keys never contend.
 *
 * <h2>Transitions</h2>
 *
 * <pre>
 * CLOSED    → OPEN       consecutiveFailures reaches failureThreshold
 * OPEN      → HALF_OPEN  canAttempt() or reconcile() at/after nextProbeAt
 * HALF_OPEN → CLOSED     successThreshold successes
 * HALF_OPEN → OPEN       any failure (the failure count is still above the threshold)
 * any       → CLOSED     reset()
 * </pre>
 *
 * <p>The move from OPEN to HALF_OPEN happens inside {@link #canAttempt(String)}: the caller that
 * observes the elapsed probe time is the caller that probes. Splitting the check from the
 * transition would let two callers both see OPEN and neither probe.
 *
 * <p>A success while CLOSED only decrements the failure counter by one, so a flapping service
 * keeps most of its failure history.
 *
 * <h2>Listener Ordering</h2>
 *
 * <p>Listeners are called after the key's lock has been released, on the thread that caused the
 * transition. Transitions caused by one thread are reported in the order they happened. When
 * several threads race on the same key, their notifications may interleave in any order, so a
 * listener that needs the current phase should read {@link #state(String)} rather than rely on
 * the order of callbacks.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * CircuitBreakerRegistry registry =
 *     new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), Clock.systemUTC());
 *
 * if (!registry.canAttempt("task-api:create")) {
 *     throw new CircuitBreakerOpenException("task-api:create");
 * }
 * try {
 *     call();
 *     registry.recordSuccess("task-api:create");
 * } catch (IOException e) {
 *     registry.recordFailure("task-api:create");
 *     throw e;
 * }
 * }</pre>
 *
 * @see CircuitPhase
 * @see CircuitBreakerListener
 */
public final class CircuitBreakerRegistry {

    private static final Logger LOGGER = Logger.getLogger(CircuitBreakerRegistry.class.getName());

    private final CircuitBreakerConfig config;
    private final Clock clock;

    /** Breakers by service key. */
    private final Map<String, Cell> cells = new ConcurrentHashMap<>();

    /** Registered transition listeners. */
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates an empty registry.
     *
     * @param config registry-wide settings
     * @param clock clock used for failure and probe times
     */
    public CircuitBreakerRegistry(CircuitBreakerConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * Registers a listener for phase changes.
     *
     * @param listener the listener to register
     */
    public void addListener(CircuitBreakerListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(CircuitBreakerListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Checks whether a call on the key may proceed.
     *
     * <p>CLOSED and HALF_OPEN admit the call. OPEN admits it only once {@code nextProbeAt} has
     * passed, and in that case this call moves the breaker to HALF_OPEN with its success count
     * reset.
     *
     * @param serviceKey the breaker's key
     * @return true if the call may proceed
     */
    public boolean canAttempt(String serviceKey) {
        Cell cell = cell(serviceKey);
        boolean allowed;
        CircuitPhase previous = null;

        cell.lock.lock();
        try {
            switch (cell.phase) {
                case CLOSED, HALF_OPEN -> allowed = true;
                case OPEN -> {
                    allowed = cell.probeDue(clock.instant());
                    if (allowed) {
                        previous = cell.enterHalfOpen();
                    }
                }
                default -> throw new IllegalStateException("Unexpected phase: " + cell.phase);
            }
        } finally {
            cell.lock.unlock();
        }

        if (previous != null) {
            LOGGER.fine(() -> "Circuit breaker " + serviceKey + " half-open, probing");
            notifyListeners(serviceKey, previous, CircuitPhase.HALF_OPEN);
        }
        return allowed;
    }

    /**
     * Records a successful call.
     *
     * <p>HALF_OPEN counts the success and closes the breaker at the success threshold. CLOSED
     * decrements the failure counter by one, floored at zero. OPEN is left unchanged.
     *
     * @param serviceKey the breaker's key
     */
    public void recordSuccess(String serviceKey) {
        Cell cell = cell(serviceKey);
        boolean closed = false;

        cell.lock.lock();
        try {
            switch (cell.phase) {
                case HALF_OPEN -> {
                    cell.halfOpenSuccesses++;
                    if (cell.halfOpenSuccesses >= config.successThreshold()) {
                        cell.close();
                        closed = true;
                    }
                }
                case CLOSED -> cell.consecutiveFailures = Math.max(0, cell.consecutiveFailures - 1);
                case OPEN ->
                        LOGGER.fine(
                                () -> "Ignoring success for open circuit breaker " + serviceKey);
                default -> throw new IllegalStateException("Unexpected phase: " + cell.phase);
            }
        } finally {
            cell.lock.unlock();
        }

        if (closed) {
            LOGGER.fine(() -> "Circuit breaker " + serviceKey + " closed");
            notifyListeners(serviceKey, CircuitPhase.HALF_OPEN, CircuitPhase.CLOSED);
        }
    }

    /**
     * Records a failed call.
     *
     * <p>The failure counter is incremented and the failure time recorded. Once the counter
     * reaches the failure threshold the breaker opens and its probe time is set
     * {@code recoveryTimeout} from now.
     *
     * @param serviceKey the breaker's key
     */
    public void recordFailure(String serviceKey) {
        Cell cell = cell(serviceKey);
        CircuitPhase previous = null;
        int failures;

        cell.lock.lock();
        try {
            Instant now = clock.instant();
            cell.consecutiveFailures++;
            cell.lastFailureAt = now;
            failures = cell.consecutiveFailures;
            if (failures >= config.failureThreshold()) {
                previous = cell.phase;
                cell.phase = CircuitPhase.OPEN;
                cell.nextProbeAt = now.plus(config.recoveryTimeout());
            }
        } finally {
            cell.lock.unlock();
        }

        if (previous != null) {
            LOGGER.fine(
                    () -> "Circuit breaker " + serviceKey + " opened after " + failures + " failures");
            notifyListeners(serviceKey, previous, CircuitPhase.OPEN);
        }
    }

    /**
     * Forces a breaker back to CLOSED with all counters and timers cleared.
     *
     * @param serviceKey the breaker's key
     * @return false if the key has never been referenced
     */
    public boolean reset(String serviceKey) {
        Cell cell = cells.get(serviceKey);
        if (cell == null) {
            return false;
        }
        cell.lock.lock();
        try {
            cell.close();
        } finally {
            cell.lock.unlock();
        }
        LOGGER.fine(() -> "Circuit breaker " + serviceKey + " reset");
        return true;
    }

    /**
     * Promotes every OPEN breaker whose probe time has passed to HALF_OPEN.
     *
     * <p>Run periodically so that {@link #status()} follows the wall clock even for keys nobody
     * calls.
     *
     * @return the number of breakers promoted
     */
    public int reconcile() {
        int promoted = 0;
        for (Map.Entry<String, Cell> entry : cells.entrySet()) {
            Cell cell = entry.getValue();
            CircuitPhase previous = null;
            cell.lock.lock();
            try {
                if (cell.phase == CircuitPhase.OPEN && cell.probeDue(clock.instant())) {
                    previous = cell.enterHalfOpen();
                }
            } finally {
                cell.lock.unlock();
            }
            if (previous != null) {
                promoted++;
                notifyListeners(entry.getKey(), previous, CircuitPhase.HALF_OPEN);
            }
        }
        if (promoted > 0) {
            int count = promoted;
            LOGGER.fine(() -> "Reconciliation moved " + count + " circuit breakers to half-open");
        }
        return promoted;
    }

    /**
     * Returns a snapshot of one breaker without creating it.
     *
     * @param serviceKey the breaker's key
     * @return the snapshot, or empty if the key is unknown
     */
    public Optional<CircuitBreakerState> state(String serviceKey) {
        Cell cell = cells.get(serviceKey);
        return cell == null ? Optional.empty() : Optional.of(cell.snapshot());
    }

    /**
     * Returns a snapshot of every known breaker.
     *
     * @return an unmodifiable map sorted by key
     */
    public Map<String, CircuitBreakerState> status() {
        Map<String, CircuitBreakerState> snapshot = new TreeMap<>();
        cells.forEach((key, cell) -> snapshot.put(key, cell.snapshot()));
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Returns the number of known breakers.
     *
     * @return the breaker count
     */
    public int size() {
        return cells.size();
    }

    /** Forgets every breaker. */
    public void clear() {
        cells.clear();
    }

    private Cell cell(String serviceKey) {
        Objects.requireNonNull(serviceKey, "serviceKey");
        return cells.computeIfAbsent(serviceKey, key -> new Cell());
    }

    /** Notifies all listeners of a phase change. */
    private void notifyListeners(String serviceKey, CircuitPhase previous, CircuitPhase current) {
        for (CircuitBreakerListener listener : listeners) {
            try {
                listener.onTransition(serviceKey, previous, current);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Circuit breaker listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "CircuitBreakerRegistry[breakers=" + cells.size() + ", " + config + "]";
    }

    /** Mutable breaker state. Every field is guarded by {@code lock}. */
    private static final class Cell {
        private final ReentrantLock lock = new ReentrantLock();
        private CircuitPhase phase = CircuitPhase.CLOSED;
        private int consecutiveFailures;
        private Instant lastFailureAt;
        private Instant nextProbeAt;
        private int halfOpenSuccesses;

        private boolean probeDue(Instant now) {
            return nextProbeAt != null && !now.isBefore(nextProbeAt);
        }

        private CircuitPhase enterHalfOpen() {
            CircuitPhase previous = phase;
            phase = CircuitPhase.HALF_OPEN;
            halfOpenSuccesses = 0;
            return previous;
        }

        private void close() {
            phase = CircuitPhase.CLOSED;
            consecutiveFailures = 0;
            lastFailureAt = null;
            nextProbeAt = null;
            halfOpenSuccesses = 0;
        }

        private CircuitBreakerState snapshot() {
            lock.lock();
            try {
                return new CircuitBreakerState(
                        phase, consecutiveFailures, lastFailureAt, nextProbeAt, halfOpenSuccesses);
            } finally {
                lock.unlock();
            }
        }
    }
}
