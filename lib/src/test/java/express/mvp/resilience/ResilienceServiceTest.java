package express.mvp.resilience;

import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.resilience.breaker.CircuitBreakerConfig;
import express.mvp.resilience.breaker.CircuitBreakerOpenException;
import express.mvp.resilience.breaker.CircuitBreakerState;
import express.mvp.resilience.breaker.CircuitPhase;
import express.mvp.resilience.error.ErrorKind;
import express.mvp.resilience.event.EventType;
import express.mvp.resilience.event.ResilienceEvent;
import express.mvp.resilience.event.ResilienceEventListener;
import express.mvp.resilience.history.ErrorStatistics;
import express.mvp.resilience.retry.BackoffCalculator;
import express.mvp.resilience.retry.RetryPolicy;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ResilienceService} wired with deterministic collaborators. */
@DisplayName("ResilienceService")
@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class ResilienceServiceTest {

    private static final OperationContext CREATE = OperationContext.of("task-api", "create");
    private static final String KEY = "task-api:create";

    private MutableClock clock;
    private List<Duration> sleeps;
    private ResilienceService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        sleeps = new ArrayList<>();
        service =
                ResilienceService.create(
                        ResilienceConfig.builder()
                                .clock(clock)
                                .sleeper(sleeps::add)
                                .backoff(new BackoffCalculator(() -> 0.5))
                                .deferredEventExecutor(Runnable::run)
                                .maintenanceEnabled(false)
                                .build());
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private static Operation<String> failing(AtomicInteger invocations, String message) {
        return () -> {
            invocations.incrementAndGet();
            throw new IOException(message);
        };
    }

    private CircuitBreakerState breaker() {
        return service.status().get(KEY);
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Returns the operation's value")
        void returnsValue() throws Exception {
            assertEquals("task-7", service.execute(() -> "task-7", CREATE));
        }

        @Test
        @DisplayName("Rethrows the original failure after the default three attempts")
        void defaultAttempts() {
            AtomicInteger invocations = new AtomicInteger();

            IOException thrown =
                    assertThrows(
                            IOException.class,
                            () -> service.execute(failing(invocations, "Network timeout"), CREATE));

            assertEquals("Network timeout", thrown.getMessage());
            assertEquals(3, invocations.get());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        }

        @Test
        @DisplayName("Policy overrides apply to one call")
        void overrides() {
            AtomicInteger invocations = new AtomicInteger();

            assertThrows(
                    IOException.class,
                    () ->
                            service.execute(
                                    failing(invocations, "Connection reset"),
                                    CREATE,
                                    policy -> policy.maxAttempts(5).jitter(false)));
            assertEquals(5, invocations.get());
        }

        @Test
        @DisplayName("Explicit policy replaces the default")
        void explicitPolicy() {
            AtomicInteger invocations = new AtomicInteger();

            assertThrows(
                    IOException.class,
                    () ->
                            service.execute(
                                    failing(invocations, "Connection reset"),
                                    CREATE,
                                    RetryPolicy.noRetry()));
            assertEquals(1, invocations.get());
            assertTrue(sleeps.isEmpty());
        }
    }

    @Nested
    @DisplayName("Circuit breaker events")
    class BreakerEventTests {

        private final List<ResilienceEvent> opened = new ArrayList<>();
        private final List<ResilienceEvent> closed = new ArrayList<>();

        @BeforeEach
        void subscribe() {
            service.subscribe(EventType.CIRCUIT_BREAKER_OPENED, opened::add);
            service.subscribe(EventType.CIRCUIT_BREAKER_CLOSED, closed::add);
        }

        @Test
        @DisplayName("Six failing single-attempt calls: open after the fifth, sixth short-circuits")
        void opensAndShortCircuits() {
            AtomicInteger invocations = new AtomicInteger();
            Operation<String> operation = failing(invocations, "Connection reset");

            for (int i = 0; i < 5; i++) {
                assertThrows(
                        IOException.class,
                        () -> service.execute(operation, CREATE, RetryPolicy.noRetry()));
            }
            assertEquals(CircuitPhase.OPEN, breaker().phase());
            assertEquals(1, opened.size());
            assertTrue(opened.get(0).error().isEmpty());

            assertThrows(
                    CircuitBreakerOpenException.class,
                    () -> service.execute(operation, CREATE, RetryPolicy.noRetry()));

            assertEquals(5, invocations.get());
            assertEquals(2, opened.size());
            assertEquals(KEY, opened.get(1).serviceKey());
            assertEquals(ErrorKind.CONNECTION, opened.get(1).error().orElseThrow().kind());
        }

        @Test
        @DisplayName("Recovered breaker publishes circuit-breaker-closed")
        void closesAfterProbes() throws Exception {
            AtomicInteger invocations = new AtomicInteger();
            for (int i = 0; i < 5; i++) {
                assertThrows(
                        IOException.class,
                        () ->
                                service.execute(
                                        failing(invocations, "Connection reset"),
                                        CREATE,
                                        RetryPolicy.noRetry()));
            }
            clock.advance(Duration.ofSeconds(30));

            service.execute(() -> "probe", CREATE);
            assertTrue(closed.isEmpty());
            service.execute(() -> "probe", CREATE);

            assertEquals(1, closed.size());
            assertEquals(KEY, closed.get(0).serviceKey());
            assertEquals(CircuitPhase.CLOSED, breaker().phase());
        }

        @Test
        @DisplayName("Unsubscribed listener receives nothing")
        void unsubscribe() {
            List<ResilienceEvent> errors = new ArrayList<>();
            ResilienceEventListener listener = errors::add;
            service.subscribe(EventType.ERROR, listener);

            assertTrue(service.unsubscribe(EventType.ERROR, listener));
            assertThrows(
                    IOException.class,
                    () ->
                            service.execute(
                                    failing(new AtomicInteger(), "Invalid payload"), CREATE));
            assertTrue(errors.isEmpty());
        }
    }

    @Nested
    @DisplayName("Event delivery")
    class EventDeliveryTests {

        private final Queue<Runnable> deferred = new ArrayDeque<>();
        private final List<ResilienceEvent> delivered = new ArrayList<>();
        private ResilienceService queued;

        @BeforeEach
        void createQueuedService() {
            queued =
                    ResilienceService.create(
                            ResilienceConfig.builder()
                                    .clock(clock)
                                    .sleeper(sleeps::add)
                                    .backoff(new BackoffCalculator(() -> 0.5))
                                    .deferredEventExecutor(deferred::add)
                                    .maintenanceEnabled(false)
                                    .build());
            queued.subscribe(EventType.ERROR, delivered::add);
            queued.subscribe(EventType.CIRCUIT_BREAKER_OPENED, delivered::add);
            queued.subscribe(EventType.CIRCUIT_BREAKER_CLOSED, delivered::add);
        }

        @AfterEach
        void closeQueuedService() {
            queued.close();
        }

        private void drain() {
            Runnable task;
            while ((task = deferred.poll()) != null) {
                task.run();
            }
        }

        private List<EventType> deliveredTypes() {
            List<EventType> types = new ArrayList<>();
            delivered.forEach(event -> types.add(event.type()));
            return types;
        }

        @Test
        @DisplayName("Error events arrive during the call, breaker opening only once drained")
        void openingIsDeferred() {
            AtomicInteger invocations = new AtomicInteger();
            for (int i = 0; i < 5; i++) {
                assertThrows(
                        IOException.class,
                        () ->
                                queued.execute(
                                        failing(invocations, "Connection reset"),
                                        CREATE,
                                        RetryPolicy.noRetry()));
            }

            assertEquals(Collections.nCopies(5, EventType.ERROR), deliveredTypes());
            assertEquals(1, deferred.size());

            drain();

            assertEquals(EventType.CIRCUIT_BREAKER_OPENED, delivered.get(5).type());
            assertEquals(KEY, delivered.get(5).serviceKey());
            assertEquals(6, delivered.size());
        }

        @Test
        @DisplayName("Breaker closing arrives only once drained")
        void closingIsDeferred() throws Exception {
            AtomicInteger invocations = new AtomicInteger();
            for (int i = 0; i < 5; i++) {
                assertThrows(
                        IOException.class,
                        () ->
                                queued.execute(
                                        failing(invocations, "Connection reset"),
                                        CREATE,
                                        RetryPolicy.noRetry()));
            }
            drain();
            delivered.clear();
            clock.advance(Duration.ofSeconds(30));

            queued.execute(() -> "probe", CREATE);
            queued.execute(() -> "probe", CREATE);

            assertEquals(CircuitPhase.CLOSED, queued.status().get(KEY).phase());
            assertTrue(delivered.isEmpty());
            assertEquals(1, deferred.size());

            drain();

            assertEquals(List.of(EventType.CIRCUIT_BREAKER_CLOSED), deliveredTypes());
        }
    }

    @Nested
    @DisplayName("Diagnostics")
    class DiagnosticsTests {

        @Test
        @DisplayName("Statistics count every failed attempt")
        void statistics() {
            AtomicInteger invocations = new AtomicInteger();
            assertThrows(
                    IOException.class,
                    () -> service.execute(failing(invocations, "Connection reset"), CREATE));
            assertThrows(
                    IOException.class,
                    () -> service.execute(failing(invocations, "Invalid payload"), CREATE));

            ErrorStatistics stats = service.statistics();
            assertEquals(4, stats.total());
            assertEquals(3, stats.count(ErrorKind.CONNECTION));
            assertEquals(1, stats.count(ErrorKind.VALIDATION));
            assertEquals(ErrorKind.VALIDATION, stats.recent().get(0).kind());
        }

        @Test
        @DisplayName("Windowed statistics ignore older errors")
        void windowedStatistics() {
            AtomicInteger invocations = new AtomicInteger();
            assertThrows(
                    IOException.class,
                    () -> service.execute(failing(invocations, "Invalid payload"), CREATE));
            clock.advance(Duration.ofHours(2));

            assertEquals(0, service.statistics(Duration.ofHours(1)).total());
            assertEquals(1, service.statistics().total());
        }

        @Test
        @DisplayName("Reset of a healthy breaker returns true and changes nothing")
        void resetHealthy() throws Exception {
            service.execute(() -> "ok", CREATE);

            assertTrue(service.reset(KEY));
            assertEquals(CircuitBreakerState.INITIAL, breaker());
        }

        @Test
        @DisplayName("Reset of an unknown breaker returns false")
        void resetUnknown() {
            assertFalse(service.reset("unknown:op"));
        }

        @Test
        @DisplayName("Maintenance prunes expired errors and promotes due breakers")
        void maintenance() {
            AtomicInteger invocations = new AtomicInteger();
            for (int i = 0; i < 5; i++) {
                assertThrows(
                        IOException.class,
                        () ->
                                service.execute(
                                        failing(invocations, "Connection reset"),
                                        CREATE,
                                        RetryPolicy.noRetry()));
            }
            clock.advance(Duration.ofHours(25));

            assertEquals(6, service.runMaintenance());
            assertEquals(0, service.statistics().total());
            assertEquals(CircuitPhase.HALF_OPEN, breaker().phase());
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class CleanupTests {

        @Test
        @DisplayName("Forgets breakers and errors")
        void forgetsState() {
            AtomicInteger invocations = new AtomicInteger();
            assertThrows(
                    IOException.class,
                    () -> service.execute(failing(invocations, "Invalid payload"), CREATE));

            service.cleanup();

            assertTrue(service.isClosed());
            assertTrue(service.status().isEmpty());
            assertEquals(0, service.statistics().total());
        }

        @Test
        @DisplayName("Rejects use after cleanup")
        void rejectsUse() {
            service.cleanup();

            assertThrows(IllegalStateException.class, () -> service.execute(() -> "ok", CREATE));
            assertThrows(
                    IllegalStateException.class,
                    () -> service.subscribe(EventType.ERROR, event -> {}));
            assertThrows(IllegalStateException.class, () -> service.runMaintenance());
        }

        @Test
        @DisplayName("Cleanup is idempotent")
        void idempotent() {
            service.cleanup();
            assertDoesNotThrow(() -> service.cleanup());
            assertDoesNotThrow(() -> service.close());
        }

        @Test
        @DisplayName("Default service starts and stops its background threads")
        void defaultService() throws Exception {
            try (ResilienceService defaults = ResilienceService.create()) {
                assertEquals("ok", defaults.execute(() -> "ok", CREATE));
                assertEquals(RetryPolicy.defaults(), defaults.getConfig().getDefaultPolicy());
            }
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Default configuration values")
        void defaults() {
            ResilienceConfig config = ResilienceConfig.defaults();

            assertEquals(1000, config.getHistoryCapacity());
            assertEquals(Duration.ofHours(24), config.getHistoryRetention());
            assertEquals(Duration.ofMinutes(10), config.getPruneInterval());
            assertEquals(Duration.ofSeconds(60), config.getReconcileInterval());
            assertTrue(config.isMaintenanceEnabled());
            assertNull(config.getDeferredEventExecutor());
        }

        @Test
        @DisplayName("Reconcile interval follows the monitoring period")
        void reconcileInterval() {
            ResilienceConfig config =
                    ResilienceConfig.builder()
                            .circuitBreaker(
                                    CircuitBreakerConfig.builder()
                                            .monitoringPeriod(Duration.ofSeconds(5))
                                            .build())
                            .build();
            assertEquals(Duration.ofSeconds(5), config.getReconcileInterval());
        }

        @Test
        @DisplayName("Rejects invalid values")
        void rejectsInvalid() {
            ResilienceConfig.Builder builder = ResilienceConfig.builder();

            assertThrows(IllegalArgumentException.class, () -> builder.historyCapacity(0));
            assertThrows(
                    IllegalArgumentException.class, () -> builder.historyRetention(Duration.ZERO));
            assertThrows(
                    IllegalArgumentException.class,
                    () -> builder.pruneInterval(Duration.ofMinutes(-1)));
        }
    }
}
