package express.mvp.resilience.benchmark;

import express.mvp.resilience.breaker.CircuitBreakerConfig;
import express.mvp.resilience.breaker.CircuitBreakerRegistry;
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
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Micro-benchmark of the circuit breaker gate.
 *
 * <p>Every protected call checks its breaker and reports an outcome. The contended variants run
 * four threads against a single key to measure the per-key lock.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class CircuitBreakerRegistryBenchmark {

    private static final String KEY = "task-api:create";

    private CircuitBreakerRegistry registry;

    @Setup(Level.Trial)
    public void setup() {
        registry = new CircuitBreakerRegistry(CircuitBreakerConfig.defaults(), Clock.systemUTC());
        registry.canAttempt(KEY);
    }

    @Benchmark
    public boolean canAttempt() {
        return registry.canAttempt(KEY);
    }

    @Benchmark
    public boolean gateAndSuccess() {
        boolean allowed = registry.canAttempt(KEY);
        registry.recordSuccess(KEY);
        return allowed;
    }

    @Benchmark
    @Threads(4)
    public boolean gateAndSuccessContended() {
        boolean allowed = registry.canAttempt(KEY);
        registry.recordSuccess(KEY);
        return allowed;
    }
}
