package org.overf;

import org.junit.jupiter.api.Test;
import org.overf.parser.BlockParser;
import org.overf.printer.BlockPrinter;

import static org.assertj.core.api.Assertions.assertThat;

class OverflowBlocksTest {

    private static final String ARITH = "org.overf.runtime.OverflowArithmetic.";

    private final OverflowBlocks blocks = new OverflowBlocks(TransformOptions.builder().build());

    @Test
    void checked_addThrowsWithOperationText() {
        String out = blocks.checked("int c = a + b;").getSourceOrThrow();
        assertThat(out).isEqualTo("int c = " + ARITH + "checkedAdd(a, b)"
                                  + ".orElseThrow(() -> new ArithmeticException(\"attempt to add with overflow: a + b\"));");
    }

    @Test
    void overflowing_usesWrappingForms() {
        String out = blocks.overflowing("int c = a + b;").getSourceOrThrow();
        assertThat(out).isEqualTo("int c = " + ARITH + "wrappingAdd(a, b);");
    }

    @Test
    void saturating_usesSaturatingForms() {
        String out = blocks.saturating("long c = a * b - d;").getSourceOrThrow();
        assertThat(out).isEqualTo("long c = " + ARITH + "saturatingSub(" + ARITH + "saturatingMul(a, b), d);");
    }

    @Test
    void propagating_wrapsTopLevelInHandler() {
        String out = blocks.propagating("int c = a + b;\nreturn Optional.of(c);").getSourceOrThrow();
        assertThat(out).startsWith("try {")
                       .contains(ARITH + "checkedAdd(a, b).orElseThrow(org.overf.runtime.OverflowSignal::new)")
                       .contains("return Optional.of(c);")
                       .contains("catch (org.overf.runtime.OverflowSignal overflow$)")
                       .contains("return java.util.Optional.empty();");
    }

    @Test
    void propagating_withoutArithmeticNeedsNoHandler() {
        String out = blocks.propagating("return Optional.of(a);").getSourceOrThrow();
        assertThat(out).isEqualTo("return Optional.of(a);");
    }

    @Test
    void defaults_withoutNestedBlocksReturnsInputVerbatim() {
        String input = "int   c = a+b;   // spacing kept";
        assertThat(blocks.defaults(input).getSourceOrThrow()).isEqualTo(input);
    }

    @Test
    void defaults_rewritesNestedPolicyBlocksOnly() {
        String out = blocks.defaults("int c = a + b;\nchecked: {\n    c = c * 2;\n}").getSourceOrThrow();
        assertThat(out).startsWith("int c = a + b;")
                       .contains("c = " + ARITH + "checkedMul(c, 2)")
                       .doesNotContain("checked:");
    }

    @Test
    void nestedBlocks_innerPolicyWinsAndOuterResumes() {
        String out = blocks.checked("x = a + b;\noverflowing: {\n    y = c - d;\n}\nz = e * f;").getSourceOrThrow();
        assertThat(out).contains("x = " + ARITH + "checkedAdd(a, b)")
                       .contains("y = " + ARITH + "wrappingSub(c, d);")
                       .contains("z = " + ARITH + "checkedMul(e, f)")
                       .doesNotContain("overflowing:");
    }

    @Test
    void passThrough_nonArithmeticIsUnchanged() {
        String input = "boolean p = a > b && (c & d) != 0 || !q;\nlong m = a << 3 ^ b >>> 1 | ~c;\ndouble r = x * 2.0;";
        String printed = new BlockPrinter().printStatements(new BlockParser().parseBlock(input).getStatements());
        for (OverflowPolicy policy : OverflowPolicy.values()) {
            String out = blocks.transform(input, policy).getSourceOrThrow();
            assertThat(out).as(policy.name()).isEqualTo(policy.rewrites() ? printed : input);
        }
    }

    @Test
    void stringConcatenation_isNotRewritten() {
        String out = blocks.checked("String s = \"n=\" + n + 1;\nint t = n + 1;").getSourceOrThrow();
        assertThat(out).contains("String s = \"n=\" + n + 1;")
                       .contains("int t = " + ARITH + "checkedAdd(n, 1)");
    }

    @Test
    void literalNegation_isNotRewritten() {
        String out = blocks.checked("long m = -9223372036854775808L;\nint n = -x;").getSourceOrThrow();
        assertThat(out).contains("long m = -9223372036854775808L;")
                       .contains("int n = " + ARITH + "checkedNeg(x)");
    }

    @Test
    void compoundAssignment_expandsToPlainAssignment() {
        String out = blocks.saturating("total += price * qty;").getSourceOrThrow();
        assertThat(out).isEqualTo("total = " + ARITH + "saturatingAdd(total, " + ARITH + "saturatingMul(price, qty));");
    }

    @Test
    void increments_rewrittenWhenValueDiscardedOrPrefix() {
        String out = blocks.overflowing("i++;\nint j = ++k;").getSourceOrThrow();
        assertThat(out).isEqualTo("i = " + ARITH + "wrappingAdd(i, 1);\n"
                                  + "int j = (k = " + ARITH + "wrappingAdd(k, 1));");
    }

    @Test
    void multiLineInput_diagnosticLinesAreRelativeToInput() {
        TransformResult result = blocks.checked("int a = 1;\n\nint b = a++ + 2;");
        assertThat(result.getDiagnostics()).singleElement()
                                           .satisfies(d -> assertThat(d.line()).isEqualTo(3));
    }

    @Test
    void switchCaseLabels_areNotRewritten() {
        String out = blocks.checked("switch (k) {\n    case 1 + 1:\n        return k * 3;\n    default:\n        return 0;\n}")
                .getSourceOrThrow();
        assertThat(out).contains("case 1 + 1:")
                       .contains(ARITH + "checkedMul(k, 3)");
    }

    @Test
    void postfixInExpressionLambda_isLeftUnchangedWithWarning() {
        TransformResult result = blocks.checked("IntSupplier s = () -> c[0]++;");
        assertThat(result.getSourceOrThrow()).isEqualTo("IntSupplier s = () -> c[0]++;");
        assertThat(result.getDiagnostics()).singleElement()
                                           .satisfies(d -> assertThat(d.message()).contains("c[0]++"));
    }

    @Test
    void customLabels_areHonoured() {
        TransformOptions options = TransformOptions.builder()
                .label(OverflowPolicy.SATURATING, "clamp")
                .build();
        String out = new OverflowBlocks(options).checked("clamp: {\n    x = a + b;\n}").getSourceOrThrow();
        assertThat(out).contains("x = " + ARITH + "saturatingAdd(a, b);");
    }
}
