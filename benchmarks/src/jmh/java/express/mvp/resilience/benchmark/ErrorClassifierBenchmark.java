package express.mvp.resilience.benchmark;

import express.mvp.resilience.OperationContext;
import express.mvp.resilience.error.AttemptContext;
import express.mvp.resilience.error.ClassifiedError;
import express.mvp.resilience.error.ErrorClassifier;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Micro-benchmark of failure classification.
 *
 * <p>Classification runs once per failed attempt. The cases cover the first rule (connection),
 * a type-name match (timeout) and the fall-through to UNKNOWN, which evaluates every rule.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ErrorClassifierBenchmark {

    private ErrorClassifier classifier;
    private AttemptContext attempt;

    private IOException connectionFailure;
    private SocketTimeoutException timeoutFailure;
    private IllegalStateException unknownFailure;

    @Setup(Level.Trial)
    public void setup() {
        classifier = new ErrorClassifier(Clock.systemUTC());
        attempt =
                new AttemptContext(
                        OperationContext.of("task-api", "create"), 1, 3, Clock.systemUTC().instant());
        connectionFailure = new IOException("Connection refused: ECONNREFUSED 127.0.0.1:8080");
        timeoutFailure = new SocketTimeoutException("Read timed out");
        unknownFailure = new IllegalStateException("Something odd happened");
    }

    @Benchmark
    public ClassifiedError classifyConnection() {
        return classifier.classify(connectionFailure, attempt);
    }

    @Benchmark
    public ClassifiedError classifyTimeoutByTypeName() {
        return classifier.classify(timeoutFailure, attempt);
    }

    @Benchmark
    public ClassifiedError classifyUnknown() {
        return classifier.classify(unknownFailure, attempt);
    }
}
