package org.overf.benchmark;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.overf.runtime.OverflowArithmetic;
import org.overf.runtime.OverflowSignal;
import org.openjdk.jmh.annotations.*;

/**
 * Runtime cost of each policy's operations against Java's own operators, on operands that
 * rarely overflow. The loop bodies are what the transformer emits for {@code acc += a[i] * b[i]}.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class PolicyArithmeticBenchmark {

    @State(Scope.Thread)
    public static class Operands {

        @Param({"1024"})
        int size;

        long[] left;
        long[] right;

        @Setup(Level.Trial)
        public void fill() {
            ThreadLocalRandom rng = ThreadLocalRandom.current();
            left = new long[size];
            right = new long[size];
            for (int i = 0; i < size; i++) {
                left[i] = rng.nextLong(-1_000_000, 1_000_000);
                right[i] = rng.nextLong(-1_000_000, 1_000_000);
            }
        }
    }

    @Benchmark
    public long plainJava(Operands o) {
        long acc = 0;
        for (int i = 0; i < o.size; i++) {
            acc += o.left[i] * o.right[i];
        }
        return acc;
    }

    @Benchmark
    public long checked(Operands o) {
        long acc = 0;
        for (int i = 0; i < o.size; i++) {
            acc = OverflowArithmetic.checkedAdd(acc, OverflowArithmetic.checkedMul(o.left[i], o.right[i])
                            .orElseThrow(() -> new ArithmeticException("attempt to multiply with overflow: a[i] * b[i]")))
                    .orElseThrow(() -> new ArithmeticException("attempt to add with overflow: acc += a[i] * b[i]"));
        }
        return acc;
    }

    @Benchmark
    public long wrapping(Operands o) {
        long acc = 0;
        for (int i = 0; i < o.size; i++) {
            acc = OverflowArithmetic.wrappingAdd(acc, OverflowArithmetic.wrappingMul(o.left[i], o.right[i]));
        }
        return acc;
    }

    @Benchmark
    public long saturating(Operands o) {
        long acc = 0;
        for (int i = 0; i < o.size; i++) {
            acc = OverflowArithmetic.saturatingAdd(acc, OverflowArithmetic.saturatingMul(o.left[i], o.right[i]));
        }
        return acc;
    }

    @Benchmark
    public long propagating(Operands o) {
        long acc = 0;
        try {
            for (int i = 0; i < o.size; i++) {
                acc = OverflowArithmetic.checkedAdd(acc, OverflowArithmetic.checkedMul(o.left[i], o.right[i])
                                .orElseThrow(OverflowSignal::new))
                        .orElseThrow(OverflowSignal::new);
            }
        } catch (OverflowSignal overflow) {
            return Long.MIN_VALUE;
        }
        return acc;
    }

    @Benchmark
    public long propagatingOverflow() {
        try {
            return OverflowArithmetic.checkedAdd(Long.MAX_VALUE, 1L).orElseThrow(OverflowSignal::new);
        } catch (OverflowSignal overflow) {
            return Long.MIN_VALUE;
        }
    }
}
