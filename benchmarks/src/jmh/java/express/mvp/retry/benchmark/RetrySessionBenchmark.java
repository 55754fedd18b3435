package express.mvp.retry.benchmark;

import express.mvp.retry.RetryConfig;
import express.mvp.retry.backoff.ConstantBackoff;
import express.mvp.retry.error.ClassificationLists;
import express.mvp.retry.session.RetrySession;
import java.io.IOException;
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

/**
 * Engine overhead of a synchronous session: classification, state transitions and bookkeeping,
 * with zero delays so that no time is spent waiting.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class RetrySessionBenchmark {

    private static final IOException TRANSIENT = new IOException("transient");

    @Param({"0", "3"})
    private int failuresBeforeSuccess;

    private RetryConfig config;
    private ClassificationLists lists;
    private int remaining;

    @Setup
    public void setup() {
        config = RetryConfig.builder()
                .backoff(ConstantBackoff.builder().delayMillis(0).maxRetries(10).build())
                .build();
        lists = new ClassificationLists();
        lists.addBlacklisted(IOException.class);
    }

    @Benchmark
    public Integer runSession() {
        remaining = failuresBeforeSuccess;
        return new RetrySession(config, lists).run(() -> {
            if (remaining-- > 0) {
                throw TRANSIENT;
            }
            return remaining;
        });
    }
}
