package express.mvp.resilience.history;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.resilience.MutableClock;
import express.mvp.resilience.OperationContext;
import express.mvp.resilience.error.AttemptContext;
import express.mvp.resilience.error.ClassifiedError;
import express.mvp.resilience.error.ErrorKind;
import express.mvp.resilience.error.ErrorSeverity;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ErrorHistoryStore} and {@link ErrorStatistics}. */
@DisplayName("ErrorHistoryStore")
class ErrorHistoryStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private final AtomicInteger ids = new AtomicInteger();
    private MutableClock clock;
    private ErrorHistoryStore history;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        history = new ErrorHistoryStore(1000, Duration.ofHours(24), clock);
    }

    private ClassifiedError error(ErrorKind kind, ErrorSeverity severity) {
        Instant now = clock.instant();
        return new ClassifiedError(
                "err_" + ids.incrementAndGet(),
                kind,
                severity,
                kind.description(),
                new AttemptContext(OperationContext.of("task-api", "list"), 1, 3, now),
                true,
                List.of(),
                now,
                null);
    }

    private ClassifiedError record(ErrorKind kind, ErrorSeverity severity) {
        ClassifiedError error = error(kind, severity);
        history.record(error);
        return error;
    }

    @Nested
    @DisplayName("Recording")
    class RecordingTests {

        @Test
        @DisplayName("Newest error comes first")
        void newestFirst() {
            ClassifiedError first = record(ErrorKind.TIMEOUT, ErrorSeverity.MEDIUM);
            ClassifiedError second = record(ErrorKind.API, ErrorSeverity.HIGH);

            assertEquals(List.of(second, first), history.snapshot());
        }

        @Test
        @DisplayName("Oldest errors are dropped beyond capacity")
        void capacity() {
            ErrorHistoryStore small = new ErrorHistoryStore(3, Duration.ofHours(24), clock);
            for (int i = 0; i < 5; i++) {
                small.record(error(ErrorKind.UNKNOWN, ErrorSeverity.MEDIUM));
            }

            assertEquals(3, small.size());
            assertEquals(
                    List.of("err_5", "err_4", "err_3"),
                    small.snapshot().stream().map(ClassifiedError::id).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Default capacity holds 1000 errors")
        void defaultCapacity() {
            for (int i = 0; i < 1005; i++) {
                record(ErrorKind.CONNECTION, ErrorSeverity.MEDIUM);
            }
            assertEquals(ErrorHistoryStore.DEFAULT_CAPACITY, history.size());
            assertEquals(1000, history.statistics().total());
        }

        @Test
        @DisplayName("Rejects capacity below one")
        void rejectsZeroCapacity() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new ErrorHistoryStore(0, Duration.ofHours(1), clock));
        }

        @Test
        @DisplayName("Clear removes everything")
        void clear() {
            record(ErrorKind.API, ErrorSeverity.LOW);
            history.clear();
            assertEquals(0, history.size());
        }
    }

    @Nested
    @DisplayName("Statistics")
    class StatisticsTests {

        @Test
        @DisplayName("Empty history has zero-filled maps")
        void empty() {
            ErrorStatistics stats = history.statistics();

            assertEquals(0, stats.total());
            assertEquals(ErrorKind.values().length, stats.byKind().size());
            assertEquals(ErrorSeverity.values().length, stats.bySeverity().size());
            assertEquals(0, stats.count(ErrorKind.PARSING));
            assertTrue(stats.recent().isEmpty());
        }

        @Test
        @DisplayName("Counts by kind and severity sum to the total")
        void counts() {
            record(ErrorKind.TIMEOUT, ErrorSeverity.MEDIUM);
            record(ErrorKind.TIMEOUT, ErrorSeverity.MEDIUM);
            record(ErrorKind.API, ErrorSeverity.HIGH);
            record(ErrorKind.VALIDATION, ErrorSeverity.LOW);

            ErrorStatistics stats = history.statistics();
            assertEquals(4, stats.total());
            assertEquals(2, stats.count(ErrorKind.TIMEOUT));
            assertEquals(1, stats.count(ErrorSeverity.HIGH));
            assertEquals(
                    stats.total(), stats.byKind().values().stream().mapToInt(Integer::intValue).sum());
            assertEquals(
                    stats.total(),
                    stats.bySeverity().values().stream().mapToInt(Integer::intValue).sum());
        }

        @Test
        @DisplayName("Recent holds the ten newest errors")
        void recent() {
            for (int i = 0; i < 15; i++) {
                record(ErrorKind.CONNECTION, ErrorSeverity.MEDIUM);
            }

            List<ClassifiedError> recent = history.statistics().recent();
            assertEquals(ErrorStatistics.RECENT_LIMIT, recent.size());
            assertEquals("err_15", recent.get(0).id());
            assertEquals("err_6", recent.get(9).id());
        }

        @Test
        @DisplayName("Window counts only errors inside it")
        void window() {
            record(ErrorKind.TIMEOUT, ErrorSeverity.MEDIUM);
            clock.advance(Duration.ofMinutes(30));
            record(ErrorKind.API, ErrorSeverity.HIGH);
            clock.advance(Duration.ofMinutes(20));

            ErrorStatistics lastHalfHour = history.statistics(Duration.ofMinutes(30));
            assertEquals(1, lastHalfHour.total());
            assertEquals(1, lastHalfHour.count(ErrorKind.API));
            assertEquals(2, history.statistics(Duration.ofMinutes(50)).total());
        }

        @Test
        @DisplayName("Statistics maps are read-only")
        void readOnly() {
            ErrorStatistics stats = history.statistics();
            assertThrows(
                    UnsupportedOperationException.class, () -> stats.byKind().put(ErrorKind.API, 9));
        }
    }

    @Nested
    @DisplayName("Pruning")
    class PruningTests {

        @Test
        @DisplayName("Removes errors older than the retention period")
        void prunesOld() {
            record(ErrorKind.TIMEOUT, ErrorSeverity.MEDIUM);
            clock.advance(Duration.ofHours(12));
            ClassifiedError fresh = record(ErrorKind.API, ErrorSeverity.HIGH);
            clock.advance(Duration.ofHours(13));

            assertEquals(1, history.prune());
            assertEquals(List.of(fresh), history.snapshot());
        }

        @Test
        @DisplayName("Stale errors stay until pruned")
        void staleUntilPruned() {
            record(ErrorKind.TIMEOUT, ErrorSeverity.MEDIUM);
            clock.advance(Duration.ofHours(25));

            assertEquals(1, history.statistics().total());
            history.prune();
            assertEquals(0, history.statistics().total());
        }

        @Test
        @DisplayName("Nothing to prune returns zero")
        void nothingToPrune() {
            record(ErrorKind.TIMEOUT, ErrorSeverity.MEDIUM);
            assertEquals(0, history.prune());
        }
    }
}
