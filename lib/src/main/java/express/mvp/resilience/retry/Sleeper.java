package express.mvp.resilience.retry;

import java.time.Duration;

/**
 * Waits out a backoff delay.
 *
 * <p>The retry executor suspends only through this seam, which lets tests record delays instead
 * of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps on the calling thread. */
    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    /**
     * Blocks the calling thread for the given delay.
     *
     * @param delay how long to wait
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration delay) throws InterruptedException;
}
