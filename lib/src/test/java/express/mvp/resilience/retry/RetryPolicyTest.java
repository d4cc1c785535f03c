package express.mvp.resilience.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryPolicy}. */
@DisplayName("RetryPolicy")
class RetryPolicyTest {

    @Nested
    @DisplayName("Defaults")
    class DefaultTests {

        @Test
        @DisplayName("Default policy values")
        void defaultValues() {
            RetryPolicy policy = RetryPolicy.defaults();

            assertEquals(3, policy.getMaxAttempts());
            assertEquals(Duration.ofSeconds(1), policy.getInitialDelay());
            assertEquals(Duration.ofSeconds(10), policy.getMaxDelay());
            assertEquals(2.0, policy.getBackoffFactor(), 0.001);
            assertTrue(policy.isJitter());
        }

        @Test
        @DisplayName("No-retry policy allows a single attempt")
        void noRetry() {
            assertEquals(1, RetryPolicy.noRetry().getMaxAttempts());
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Custom values are kept")
        void customValues() {
            RetryPolicy policy =
                    RetryPolicy.builder()
                            .maxAttempts(5)
                            .initialDelay(Duration.ofMillis(200))
                            .maxDelay(Duration.ofSeconds(3))
                            .backoffFactor(1.5)
                            .jitter(false)
                            .build();

            assertEquals(5, policy.getMaxAttempts());
            assertEquals(200, policy.getInitialDelayMillis());
            assertEquals(3000, policy.getMaxDelayMillis());
            assertEquals(1.5, policy.getBackoffFactor(), 0.001);
            assertFalse(policy.isJitter());
        }

        @Test
        @DisplayName("Rejects maxAttempts below one")
        void rejectsZeroAttempts() {
            assertThrows(
                    IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0));
        }

        @Test
        @DisplayName("Rejects negative delays")
        void rejectsNegativeDelays() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> RetryPolicy.builder().initialDelay(Duration.ofMillis(-1)));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> RetryPolicy.builder().maxDelay(Duration.ofMillis(-1)));
        }

        @Test
        @DisplayName("Rejects backoff factors of one or less")
        void rejectsFlatFactor() {
            assertThrows(
                    IllegalArgumentException.class, () -> RetryPolicy.builder().backoffFactor(1.0));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> RetryPolicy.builder().backoffFactor(Double.NaN));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> RetryPolicy.builder().backoffFactor(Double.POSITIVE_INFINITY));
        }
    }

    @Nested
    @DisplayName("Derived policies")
    class DerivedTests {

        @Test
        @DisplayName("toBuilder copies every field")
        void toBuilderCopies() {
            RetryPolicy original =
                    RetryPolicy.builder().maxAttempts(4).backoffFactor(3.0).jitter(false).build();
            assertEquals(original, original.toBuilder().build());
        }

        @Test
        @DisplayName("withMaxAttempts changes only the ceiling")
        void withMaxAttempts() {
            RetryPolicy original = RetryPolicy.defaults();
            RetryPolicy changed = original.withMaxAttempts(7);

            assertEquals(7, changed.getMaxAttempts());
            assertEquals(original.getInitialDelay(), changed.getInitialDelay());
            assertEquals(3, original.getMaxAttempts());
        }
    }
}
