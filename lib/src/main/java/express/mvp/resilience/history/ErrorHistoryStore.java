package express.mvp.resilience.history;

import express.mvp.resilience.error.ClassifiedError;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Bounded, newest-first log of classified errors.
 *
 * <p>Recording prepends the error and drops the oldest entries beyond the capacity. Entries older
 * than the retention period are removed only by {@link #prune()}, which the maintenance scheduler
 * runs periodically; between sweeps the history may hold a few stale entries.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ErrorHistoryStore history = new ErrorHistoryStore(1000, Duration.ofHours(24), clock);
 * history.record(classifiedError);
 *
 * ErrorStatistics lastHour = history.statistics(Duration.ofHours(1));
 * int timeouts = lastHour.count(ErrorKind.TIMEOUT);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Writers take an exclusive lock; statistics and snapshots share
 * a read lock.
 *
 * @see ErrorStatistics
 */
public final class ErrorHistoryStore {

    private static final Logger LOGGER = Logger.getLogger(ErrorHistoryStore.class.getName());

    /** Default maximum number of retained errors. */
    public static final int DEFAULT_CAPACITY = 1000;

    /** Default age after which errors are pruned. */
    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final int capacity;
    private final Duration retention;
    private final Clock clock;

    /** Newest first. Guarded by {@code lock}. */
    private final Deque<ClassifiedError> entries = new ArrayDeque<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Creates an empty history.
     *
     * @param capacity maximum number of errors kept (must be >= 1)
     * @param retention age after which {@link #prune()} removes an error
     * @param clock clock used for windows and pruning
     */
    public ErrorHistoryStore(int capacity, Duration retention, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        Objects.requireNonNull(retention, "retention");
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative");
        }
        this.capacity = capacity;
        this.retention = retention;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getRetention() {
        return retention;
    }

    /**
     * Records an error at the head of the history.
     *
     * @param error the error to record
     */
    public void record(ClassifiedError error) {
        Objects.requireNonNull(error, "error");
        lock.writeLock().lock();
        try {
            entries.addFirst(error);
            while (entries.size() > capacity) {
                entries.removeLast();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Aggregates the whole history.
     *
     * @return statistics over every retained error
     */
    public ErrorStatistics statistics() {
        return ErrorStatistics.of(snapshot());
    }

    /**
     * Aggregates the errors that occurred within a window ending now.
     *
     * @param window how far back to look
     * @return statistics over errors with {@code occurredAt >= now - window}
     */
    public ErrorStatistics statistics(Duration window) {
        Objects.requireNonNull(window, "window");
        Instant windowStart = clock.instant().minus(window);

        List<ClassifiedError> relevant = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (ClassifiedError error : entries) {
                if (!error.occurredAt().isBefore(windowStart)) {
                    relevant.add(error);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return ErrorStatistics.of(relevant);
    }

    /**
     * Removes errors older than the retention period.
     *
     * @return the number of errors removed
     */
    public int prune() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;

        lock.writeLock().lock();
        try {
            Iterator<ClassifiedError> it = entries.iterator();
            while (it.hasNext()) {
                if (it.next().occurredAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (removed > 0) {
            int count = removed;
            LOGGER.fine(() -> "Pruned " + count + " errors older than " + cutoff);
        }
        return removed;
    }

    /**
     * Returns a copy of the history.
     *
     * @return the retained errors, newest first
     */
    public List<ClassifiedError> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Removes every error. */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "ErrorHistoryStore[size=" + size() + ", capacity=" + capacity
                + ", retention=" + retention + "]";
    }
}
