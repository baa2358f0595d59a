package org.overf.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.overf.OverflowBlocks;
import org.overf.TransformOptions;
import org.overf.TransformResult;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads transforming different blocks through one shared {@link OverflowBlocks}.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentTransformBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final String[] blocks = {
                "int c = a + b;\nreturn Optional.of(c * 2);",
                "long h = 17;\nfor (int i = 0; i < n; i++) {\n    h = h * 31 + i;\n}"
        };

        OverflowBlocks transformer;

        @Setup(Level.Trial)
        public void init() {
            transformer = new OverflowBlocks(TransformOptions.builder().build());
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public TransformResult concurrentPropagatingTransform(SharedState shared, ThreadState local) {
        return shared.transformer.propagating(shared.blocks[local.threadIndex]);
    }
}
