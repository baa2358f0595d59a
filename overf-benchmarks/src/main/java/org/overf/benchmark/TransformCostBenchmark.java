package org.overf.benchmark;

import java.util.concurrent.TimeUnit;

import org.overf.OverflowBlocks;
import org.overf.OverflowPolicy;
import org.overf.TransformOptions;
import org.overf.TransformResult;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the cost of parsing, rewriting and printing blocks of increasing size.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TransformCostBenchmark {

    private static final String SIMPLE = "int c = a + b;";

    private static final String LOOP =
            "long sum = 0;\n"
            + "for (int i = 0; i < values.length; i++) {\n"
            + "    sum += values[i] * weights[i];\n"
            + "}\n"
            + "return Optional.of(sum / values.length);";

    private static final String NESTED =
            "long x = a + b;\n"
            + "overflowing: {\n"
            + "    long h = x * 31 + y;\n"
            + "    saturating: {\n"
            + "        budget -= h % 7;\n"
            + "    }\n"
            + "}\n"
            + "defaults: {\n"
            + "    x = -x;\n"
            + "}\n"
            + "x++;";

    @State(Scope.Thread)
    public static class TransformState {

        @Param({"CHECKED", "OVERFLOWING", "SATURATING", "PROPAGATING"})
        OverflowPolicy policy;

        OverflowBlocks blocks;

        @Setup(Level.Trial)
        public void init() {
            blocks = new OverflowBlocks(TransformOptions.builder().build());
        }
    }

    @Benchmark
    public TransformResult transformSimpleBlock(TransformState state) {
        return state.blocks.transform(SIMPLE, state.policy);
    }

    @Benchmark
    public TransformResult transformLoopBlock(TransformState state) {
        return state.blocks.transform(LOOP, state.policy);
    }

    @Benchmark
    public TransformResult transformNestedBlock(TransformState state) {
        return state.blocks.transform(NESTED, state.policy);
    }

    @Benchmark
    public TransformResult defaultsPassThrough(TransformState state) {
        return state.blocks.defaults(SIMPLE);
    }
}
