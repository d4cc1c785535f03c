package express.mvp.resilience;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the resilience core's background threads.
 *
 * <p>Threads are named {@code "{prefix}-{counter}"} and are daemon threads by default, so that
 * the maintenance sweeps and deferred event delivery never keep the host process alive. Uncaught
 * exceptions are logged instead of printed to standard error.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
 *     new ResilienceThreadFactory("resilience-maintenance"));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Multiple threads can call {@link #newThread(Runnable)}
 * concurrently.
 */
public final class ResilienceThreadFactory implements ThreadFactory {

    private static final Logger LOGGER = Logger.getLogger(ResilienceThreadFactory.class.getName());

    /** Counter for generating unique thread names. */
    private final AtomicLong threadCount = new AtomicLong(0);

    /** Base name prefix for created threads. */
    private final String namePrefix;

    /** Whether created threads should be daemon threads. */
    private final boolean daemon;

    /**
     * Creates a factory for daemon threads with the given name prefix.
     *
     * @param namePrefix the prefix for thread names
     */
    public ResilienceThreadFactory(String namePrefix) {
        this(namePrefix, true);
    }

    /**
     * Creates a factory with configurable daemon status.
     *
     * @param namePrefix the prefix for thread names
     * @param daemon whether created threads should be daemon threads
     */
    public ResilienceThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
        this.daemon = daemon;
    }

    /**
     * Creates a new thread that will execute the given runnable.
     *
     * <p>The thread is not started by this method - the caller must start it.
     *
     * @param runnable the task to execute
     * @return a new thread (not started)
     */
    @Override
    public Thread newThread(Runnable runnable) {
        long count = threadCount.incrementAndGet();
        Thread thread = new Thread(runnable, namePrefix + "-" + count);
        thread.setDaemon(daemon);
        thread.setUncaughtExceptionHandler(
                (t, e) -> LOGGER.log(Level.SEVERE, "Uncaught exception in " + t.getName(), e));
        return thread;
    }

    /**
     * Returns the number of threads created by this factory.
     *
     * @return the total count of threads created
     */
    public long getThreadCount() {
        return threadCount.get();
    }

    public String getNamePrefix() {
        return namePrefix;
    }

    public boolean isDaemon() {
        return daemon;
    }

    @Override
    public String toString() {
        return "ResilienceThreadFactory[prefix=" + namePrefix + ", created=" + threadCount.get() + "]";
    }
}
