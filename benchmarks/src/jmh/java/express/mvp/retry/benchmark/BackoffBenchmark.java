package express.mvp.retry.benchmark;

import express.mvp.retry.backoff.Backoff;
import express.mvp.retry.backoff.ConstantBackoff;
import express.mvp.retry.backoff.ExponentialBackoff;
import express.mvp.retry.backoff.FibonacciBackoff;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Cost of computing one retry schedule of {@code attempts} delays, including the per-session
 * {@link Backoff#copy()} and {@link Backoff#reset()}.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class BackoffBenchmark {

    @Param({"1", "10", "50"})
    private int attempts;

    private Backoff constant;
    private Backoff fibonacci;
    private Backoff exponential;
    private Backoff jittered;

    @Setup
    public void setup() {
        constant = ConstantBackoff.builder().delayMillis(100).maxRetries(Backoff.UNLIMITED).build();
        fibonacci = FibonacciBackoff.builder().baseUnitMillis(10).maxRetries(Backoff.UNLIMITED).build();
        exponential = ExponentialBackoff.defaults();
        jittered = ExponentialBackoff.builder().jitterFactor(0.2).build();
    }

    @Benchmark
    public void constantSchedule(Blackhole bh) {
        schedule(constant, bh);
    }

    @Benchmark
    public void fibonacciSchedule(Blackhole bh) {
        schedule(fibonacci, bh);
    }

    @Benchmark
    public void exponentialSchedule(Blackhole bh) {
        schedule(exponential, bh);
    }

    @Benchmark
    public void jitteredSchedule(Blackhole bh) {
        schedule(jittered, bh);
    }

    private void schedule(Backoff prototype, Blackhole bh) {
        Backoff backoff = prototype.copy();
        backoff.reset();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            bh.consume(backoff.nextDelayMillis(attempt));
        }
    }
}
