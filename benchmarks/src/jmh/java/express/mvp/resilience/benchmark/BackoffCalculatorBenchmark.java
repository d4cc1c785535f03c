package express.mvp.resilience.benchmark;

import express.mvp.resilience.retry.BackoffCalculator;
import express.mvp.resilience.retry.RetryPolicy;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/** Micro-benchmark of backoff delay computation with and without jitter. */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class BackoffCalculatorBenchmark {

    @Param({"1", "4", "10"})
    private int attemptIndex;

    private final BackoffCalculator calculator = BackoffCalculator.standard();
    private RetryPolicy jittered;
    private RetryPolicy fixed;

    @Setup(Level.Trial)
    public void setup() {
        jittered = RetryPolicy.defaults();
        fixed = RetryPolicy.builder().jitter(false).build();
    }

    @Benchmark
    public long delayWithJitter() {
        return calculator.delayMillis(attemptIndex, jittered);
    }

    @Benchmark
    public long delayWithoutJitter() {
        return calculator.delayMillis(attemptIndex, fixed);
    }
}
