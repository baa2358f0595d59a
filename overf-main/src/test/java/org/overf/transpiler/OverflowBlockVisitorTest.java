package org.overf.transpiler;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.junit.jupiter.api.Test;
import org.overf.OverflowPolicy;
import org.overf.TransformOptions;
import org.overf.diagnostics.Diagnostic;
import org.overf.diagnostics.DiagnosticsEngine;
import org.overf.parser.BlockParser;
import org.overf.printer.BlockPrinter;

import static org.assertj.core.api.Assertions.assertThat;

class OverflowBlockVisitorTest {

    private final BlockParser parser = new BlockParser();
    private final BlockPrinter printer = new BlockPrinter();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private String transform(String input, OverflowPolicy policy) {
        BlockStmt block = new OverflowBlockVisitor(TransformOptions.builder().build(), diagnostics, BlockParser.BLOCK_LINE_OFFSET)
                .visitBlock(parser.parseBlock(input), policy);
        return printer.printStatements(block.getStatements());
    }

    private String transformUnit(String source) {
        CompilationUnit unit = new OverflowBlockVisitor(TransformOptions.builder().build(), diagnostics, 0)
                .visitCompilationUnit(parser.parseCompilationUnit(source));
        return printer.print(unit);
    }

    // ── policy blocks ──────────────────────────────────────────────────────

    @Test
    void policyLabel_isDroppedWithoutBreak() {
        String out = transform("saturating: {\n    x = a + b;\n}", OverflowPolicy.CHECKED);
        assertThat(out).startsWith("{").doesNotContain("saturating:").contains("saturatingAdd(a, b)");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void policyLabel_isKeptWhenBrokenOutOf() {
        String out = transform("overflowing: {\n    x = a + b;\n    if (x < 0) break overflowing;\n    y = x * 2;\n}",
                               OverflowPolicy.DEFAULT);
        assertThat(out).startsWith("overflowing: {")
                       .contains("break overflowing;")
                       .contains("wrappingAdd(a, b)")
                       .contains("wrappingMul(x, 2)");
    }

    @Test
    void unrelatedLabels_areLeftAlone() {
        String out = transform("outer: for (int i = 0; i < n; i++) {\n    sum += i;\n}", OverflowPolicy.OVERFLOWING);
        assertThat(out).startsWith("outer: for")
                       .contains("i = org.overf.runtime.OverflowArithmetic.wrappingAdd(i, 1)")
                       .contains("sum = org.overf.runtime.OverflowArithmetic.wrappingAdd(sum, i)");
    }

    @Test
    void policyLabelOnNonBlock_reportsErrorAndLeavesStatement() {
        String out = transform("int a = 1;\nchecked: a += b;", OverflowPolicy.DEFAULT);

        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.line()).isEqualTo(2);
            assertThat(d.message()).contains("'checked'").contains("block");
        });
        assertThat(out).contains("checked: a += b;").contains("overf error");
    }

    @Test
    void deepNesting_eachBlockUsesItsOwnPolicy() {
        String out = transform("a = a + 1;\n"
                               + "overflowing: {\n"
                               + "    b = b + 1;\n"
                               + "    saturating: {\n"
                               + "        c = c + 1;\n"
                               + "        defaults: {\n"
                               + "            d = d + 1;\n"
                               + "        }\n"
                               + "        e = e + 1;\n"
                               + "    }\n"
                               + "    f = f + 1;\n"
                               + "}\n"
                               + "g = g + 1;", OverflowPolicy.CHECKED);
        assertThat(out).contains("a = org.overf.runtime.OverflowArithmetic.checkedAdd(a, 1)")
                       .contains("b = org.overf.runtime.OverflowArithmetic.wrappingAdd(b, 1)")
                       .contains("c = org.overf.runtime.OverflowArithmetic.saturatingAdd(c, 1)")
                       .contains("d = d + 1;")
                       .contains("e = org.overf.runtime.OverflowArithmetic.saturatingAdd(e, 1)")
                       .contains("f = org.overf.runtime.OverflowArithmetic.wrappingAdd(f, 1)")
                       .contains("g = org.overf.runtime.OverflowArithmetic.checkedAdd(g, 1)");
    }

    // ── evaluation order ───────────────────────────────────────────────────

    @Test
    void compoundAssignmentWithSideEffectingTarget_isAnError() {
        String out = transform("values[next()] += 1;", OverflowPolicy.CHECKED);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).message()).contains("values[next()]");
        assertThat(out).isEqualTo("values[next()] += 1;");
    }

    @Test
    void compoundAssignmentWithSideEffectingValue_isRewritten() {
        String out = transform("values[i] += next();", OverflowPolicy.OVERFLOWING);

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(out).isEqualTo("values[i] = org.overf.runtime.OverflowArithmetic.wrappingAdd(values[i], next());");
    }

    @Test
    void postfixIncrementInValuePosition_warnsAndKeepsJavaSemantics() {
        String out = transform("int j = i++ * 2;", OverflowPolicy.SATURATING);

        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.message()).contains("i++");
        });
        assertThat(out).isEqualTo("int j = org.overf.runtime.OverflowArithmetic.saturatingMul(i++, 2);");
    }

    @Test
    void incrementOfSideEffectingTarget_isAnError() {
        transform("counts[index()]++;", OverflowPolicy.CHECKED);
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    // ── propagation ────────────────────────────────────────────────────────

    @Test
    void propagation_innerBlocksShareTheOutermostHandler() {
        String out = transform("propagating: {\n"
                               + "    x = a + b;\n"
                               + "    checked: {\n"
                               + "        propagating: {\n"
                               + "            y = x * 2;\n"
                               + "        }\n"
                               + "    }\n"
                               + "}\n"
                               + "return Optional.of(y);", OverflowPolicy.DEFAULT);

        assertThat(out.split("catch \\(", -1)).hasSize(2);
        assertThat(out).contains("checkedMul(x, 2).orElseThrow(org.overf.runtime.OverflowSignal::new)");
    }

    @Test
    void propagation_insideLambdaIsHandledInTheLambda() {
        String out = transform("Function<Integer, Optional<Integer>> twice = v -> Optional.of(v * 2);", OverflowPolicy.PROPAGATING);

        assertThat(out).startsWith("Function<Integer, Optional<Integer>> twice = v -> {")
                       .contains("return Optional.of(")
                       .contains("return java.util.Optional.empty();");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void propagation_inMethodUsesItsReturnType() {
        String out = transformUnit("class A {\n"
                                   + "    OptionalLong sum(long a, long b) {\n"
                                   + "        propagating: {\n"
                                   + "            return OptionalLong.of(a + b);\n"
                                   + "        }\n"
                                   + "    }\n"
                                   + "}\n");

        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(out).contains("return java.util.OptionalLong.empty();");
    }

    @Test
    void propagation_inMethodWithoutOptionalReturn_isAnError() {
        transformUnit("class A {\n"
                      + "    long sum(long a, long b) {\n"
                      + "        propagating: {\n"
                      + "            return a + b;\n"
                      + "        }\n"
                      + "    }\n"
                      + "}\n");

        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.isError()).isTrue();
            assertThat(d.line()).isEqualTo(3);
            assertThat(d.message()).contains("method `sum` returns long");
        });
    }

    @Test
    void propagation_inConstructor_isAnError() {
        transformUnit("class A {\n"
                      + "    long total;\n"
                      + "    A(long a, long b) {\n"
                      + "        propagating: {\n"
                      + "            total = a + b;\n"
                      + "        }\n"
                      + "    }\n"
                      + "}\n");

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).message()).contains("constructor `A`");
    }

    @Test
    void compilationUnit_outsidePolicyBlocksIsUntouched() {
        String out = transformUnit("class A {\n"
                                   + "    int f(int a) {\n"
                                   + "        int b = a + 1;\n"
                                   + "        checked: {\n"
                                   + "            b = b * a;\n"
                                   + "        }\n"
                                   + "        return b - 1;\n"
                                   + "    }\n"
                                   + "}\n");

        assertThat(out).contains("int b = a + 1;")
                       .contains("checkedMul(b, a)")
                       .contains("return b - 1;");
    }
}
