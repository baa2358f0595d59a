package org.overf.transpiler;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.UnaryExpr;

import java.util.Optional;

/**
 * The operators governed by an overflow policy. Each maps to a family of runtime methods named
 * {@code checked<Suffix>}, {@code wrapping<Suffix>} and {@code saturating<Suffix>}.
 */
public enum ArithmeticOperator {

    ADD("Add", "attempt to add with overflow"),
    SUB("Sub", "attempt to subtract with overflow"),
    MUL("Mul", "attempt to multiply with overflow"),
    DIV("Div", "attempt to divide with overflow or by zero"),
    REM("Rem", "attempt to calculate the remainder with a divisor of zero"),
    NEG("Neg", "attempt to negate with overflow");

    private final String suffix;
    private final String failure;

    ArithmeticOperator(String suffix, String failure) {
        this.suffix = suffix;
        this.failure = failure;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * @return the message of the {@link ArithmeticException} thrown by checked code
     */
    public String failureMessage(String sourceText) {
        return failure + ": " + sourceText;
    }

    public static Optional<ArithmeticOperator> fromBinary(BinaryExpr.Operator operator) {
        switch (operator) {
            case PLUS:
                return Optional.of(ADD);
            case MINUS:
                return Optional.of(SUB);
            case MULTIPLY:
                return Optional.of(MUL);
            case DIVIDE:
                return Optional.of(DIV);
            case REMAINDER:
                return Optional.of(REM);
            default:
                return Optional.empty();
        }
    }

    public static Optional<ArithmeticOperator> fromAssign(AssignExpr.Operator operator) {
        return operator.toBinaryOperator().flatMap(ArithmeticOperator::fromBinary);
    }

    /**
     * Negation and increments; unary plus, bitwise complement and logical not are not arithmetic.
     */
    public static Optional<ArithmeticOperator> fromUnary(UnaryExpr.Operator operator) {
        switch (operator) {
            case MINUS:
                return Optional.of(NEG);
            case PREFIX_INCREMENT:
            case POSTFIX_INCREMENT:
                return Optional.of(ADD);
            case PREFIX_DECREMENT:
            case POSTFIX_DECREMENT:
                return Optional.of(SUB);
            default:
                return Optional.empty();
        }
    }
}
