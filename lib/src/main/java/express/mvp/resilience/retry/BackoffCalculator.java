package express.mvp.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes the wait before the next attempt.
 *
 * <p>For an attempt index {@code i} (the number of failed attempts completed so far, starting at
 * 1) the delay is:
 *
 * <pre>
 * base   = initialDelay * backoffFactor^(i - 1)
 * capped = min(base, maxDelay)
 * delay  = capped                                     (jitter off)
 * delay  = max(100, capped + U(-0.25, 0.25) * capped) (jitter on)
 * </pre>
 *
 * <p>The random source is injectable so that jittered delays can be reproduced in tests. It must
 * return values in {@code [0, 1)}.
 *
 * @see RetryPolicy
 */
public final class BackoffCalculator {

    /** Relative jitter range applied on either side of the capped delay. */
    public static final double JITTER_RATIO = 0.25;

    /** Lower bound of a jittered delay. */
    public static final long MIN_JITTERED_DELAY_MILLIS = 100;

    private static final BackoffCalculator DEFAULT =
            new BackoffCalculator(() -> ThreadLocalRandom.current().nextDouble());

    private final DoubleSupplier random;

    /**
     * Creates a calculator drawing jitter from the given source.
     *
     * @param random supplier of uniform values in {@code [0, 1)}
     */
    public BackoffCalculator(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns a calculator backed by {@link ThreadLocalRandom}.
     *
     * @return the shared calculator
     */
    public static BackoffCalculator standard() {
        return DEFAULT;
    }

    /**
     * Calculates the delay before the next attempt.
     *
     * @param attemptIndex completed failed attempts (must be >= 1)
     * @param policy the retry policy
     * @return the delay to wait
     */
    public Duration delay(int attemptIndex, RetryPolicy policy) {
        return Duration.ofMillis(delayMillis(attemptIndex, policy));
    }

    /**
     * Calculates the delay before the next attempt in milliseconds.
     *
     * @param attemptIndex completed failed attempts (must be >= 1)
     * @param policy the retry policy
     * @return the delay in milliseconds
     */
    public long delayMillis(int attemptIndex, RetryPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (attemptIndex < 1) {
            throw new IllegalArgumentException("attemptIndex must be >= 1");
        }

        double capped = cappedDelay(attemptIndex, policy);
        if (!policy.isJitter()) {
            return (long) capped;
        }

        double offset = (random.getAsDouble() * 2 - 1) * JITTER_RATIO;
        double jittered = capped + offset * capped;
        return Math.max(MIN_JITTERED_DELAY_MILLIS, (long) jittered);
    }

    /**
     * Returns the exponential delay capped at the policy maximum, before jitter.
     *
     * @param attemptIndex completed failed attempts (must be >= 1)
     * @param policy the retry policy
     * @return the capped delay in milliseconds
     */
    static double cappedDelay(int attemptIndex, RetryPolicy policy) {
        double base =
                policy.getInitialDelayMillis()
                        * Math.pow(policy.getBackoffFactor(), attemptIndex - 1);
        return Math.min(base, policy.getMaxDelayMillis());
    }
}
