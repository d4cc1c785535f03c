package express.mvp.resilience.breaker;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CircuitBreakerConfig}. */
@DisplayName("CircuitBreakerConfig")
class CircuitBreakerConfigTest {

    @Test
    @DisplayName("Default values")
    void defaults() {
        CircuitBreakerConfig config = CircuitBreakerConfig.defaults();

        assertEquals(5, config.failureThreshold());
        assertEquals(Duration.ofSeconds(30), config.recoveryTimeout());
        assertEquals(Duration.ofSeconds(60), config.monitoringPeriod());
        assertEquals(2, config.successThreshold());
    }

    @Test
    @DisplayName("Rejects invalid values")
    void rejectsInvalid() {
        CircuitBreakerConfig.Builder builder = CircuitBreakerConfig.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.failureThreshold(0));
        assertThrows(IllegalArgumentException.class, () -> builder.successThreshold(0));
        assertThrows(
                IllegalArgumentException.class, () -> builder.recoveryTimeout(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> builder.monitoringPeriod(Duration.ZERO));
    }

    @Test
    @DisplayName("Custom success threshold closes after that many probes")
    void customSuccessThreshold() {
        CircuitBreakerRegistry registry =
                new CircuitBreakerRegistry(
                        CircuitBreakerConfig.builder()
                                .failureThreshold(1)
                                .recoveryTimeout(Duration.ZERO)
                                .successThreshold(3)
                                .build(),
                        Clock.systemUTC());

        registry.recordFailure("svc:op");
        assertTrue(registry.canAttempt("svc:op"));
        registry.recordSuccess("svc:op");
        registry.recordSuccess("svc:op");
        assertEquals(CircuitPhase.HALF_OPEN, registry.state("svc:op").orElseThrow().phase());

        registry.recordSuccess("svc:op");
        assertEquals(CircuitPhase.CLOSED, registry.state("svc:op").orElseThrow().phase());
    }
}
