package org.overf.transpiler;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.utils.StringEscapeUtils;
import org.overf.OverflowPolicy;
import org.overf.TransformOptions;
import org.overf.parser.util.AstUtils;
import org.overf.printer.BlockPrinter;

import java.util.Optional;

/**
 * Rewrites a single arithmetic node under a policy. Children are expected to have been
 * rewritten already; this class never recurses.
 * <p>
 * Shapes handled: binary {@code + - * / %}, the compound assignments {@code += -= *= /= %=},
 * unary minus on a non-literal, and increments/decrements whose value is discarded or that are
 * prefix forms. Anything else is returned unchanged.
 */
public class ArithmeticRewriter {

    private final Expression arithmeticClass;
    private final ClassOrInterfaceType signalType;
    private final BlockPrinter printer;

    public ArithmeticRewriter(TransformOptions options) {
        JavaParser parser = new JavaParser();
        this.arithmeticClass = parser.parseExpression(options.getArithmeticClass()).getResult()
                .orElseThrow(() -> new IllegalArgumentException("Invalid arithmetic class " + options.getArithmeticClass()));
        this.signalType = parser.parseClassOrInterfaceType(options.getSignalClass()).getResult()
                .orElseThrow(() -> new IllegalArgumentException("Invalid signal class " + options.getSignalClass()));
        this.printer = new BlockPrinter();
    }

    /**
     * Whether {@code node} has a shape this rewriter governs, independent of policy.
     */
    public boolean isArithmetic(Expression node) {
        return operatorOf(node).isPresent();
    }

    public Expression rewrite(Expression node, OverflowPolicy policy) {
        if (!policy.rewrites()) {
            return node;
        }
        Optional<ArithmeticOperator> operator = operatorOf(node);
        if (operator.isEmpty()) {
            return node;
        }
        if (node instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) node;
            return emit(policy, operator.get(), sourceText(node), binary.getLeft(), binary.getRight());
        }
        if (node instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) node;
            Expression target = assign.getTarget();
            Expression value = emit(policy, operator.get(), sourceText(node), target.clone(), assign.getValue());
            return new AssignExpr(target, value, AssignExpr.Operator.ASSIGN);
        }
        UnaryExpr unary = (UnaryExpr) node;
        if (operator.get() == ArithmeticOperator.NEG) {
            return emit(policy, ArithmeticOperator.NEG, sourceText(node), unary.getExpression());
        }
        return rewriteIncrement(unary, operator.get(), policy);
    }

    private Expression rewriteIncrement(UnaryExpr unary, ArithmeticOperator operator, OverflowPolicy policy) {
        boolean discarded = AstUtils.isValueDiscarded(unary);
        if (unary.getOperator().isPostfix() && !discarded) {
            // the old value would have to be recomputed from the new one, which saturation loses
            return unary;
        }
        Expression target = unary.getExpression();
        Expression value = emit(policy, operator, sourceText(unary), target.clone(), new IntegerLiteralExpr("1"));
        AssignExpr assign = new AssignExpr(target, value, AssignExpr.Operator.ASSIGN);
        return AstUtils.isStatementExpression(unary) ? assign : new EnclosedExpr(assign);
    }

    private Optional<ArithmeticOperator> operatorOf(Expression node) {
        if (node instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) node;
            Optional<ArithmeticOperator> operator = ArithmeticOperator.fromBinary(binary.getOperator());
            if (operator.isEmpty() || isNonIntegral(binary.getLeft(), binary.getRight())) {
                return Optional.empty();
            }
            if (operator.get() == ArithmeticOperator.ADD && AstUtils.isStringConcatenation(binary)) {
                return Optional.empty();
            }
            return operator;
        }
        if (node instanceof AssignExpr) {
            AssignExpr assign = (AssignExpr) node;
            Optional<ArithmeticOperator> operator = ArithmeticOperator.fromAssign(assign.getOperator());
            if (operator.isEmpty() || isNonIntegral(assign.getTarget(), assign.getValue())) {
                return Optional.empty();
            }
            return operator;
        }
        if (node instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) node;
            Optional<ArithmeticOperator> operator = ArithmeticOperator.fromUnary(unary.getOperator());
            if (operator.isPresent() && operator.get() == ArithmeticOperator.NEG && AstUtils.isLiteral(unary.getExpression())) {
                return Optional.empty();
            }
            return operator;
        }
        return Optional.empty();
    }

    private static boolean isNonIntegral(Expression left, Expression right) {
        return AstUtils.isFloatingLiteral(left) || AstUtils.isFloatingLiteral(right)
               || AstUtils.isStringConcatenation(right);
    }

    private Expression emit(OverflowPolicy policy, ArithmeticOperator operator, String sourceText, Expression... operands) {
        NodeList<Expression> arguments = new NodeList<>();
        for (Expression operand : operands) {
            arguments.add(AstUtils.unwrapEnclosed(operand));
        }
        switch (policy) {
            case CHECKED:
                return new MethodCallExpr(call("checked", operator, arguments), "orElseThrow",
                                          NodeList.nodeList(failure(operator, sourceText)));
            case OVERFLOWING:
                return call("wrapping", operator, arguments);
            case SATURATING:
                return call("saturating", operator, arguments);
            case PROPAGATING:
                return new MethodCallExpr(call("checked", operator, arguments), "orElseThrow",
                                          NodeList.nodeList(new MethodReferenceExpr(new TypeExpr(signalType.clone()), null, "new")));
            case DEFAULT:
            default:
                throw new IllegalStateException("No rewrite for " + policy);
        }
    }

    private MethodCallExpr call(String kind, ArithmeticOperator operator, NodeList<Expression> arguments) {
        return new MethodCallExpr(arithmeticClass.clone(), kind + operator.getSuffix(), arguments);
    }

    private LambdaExpr failure(ArithmeticOperator operator, String sourceText) {
        StringLiteralExpr message = new StringLiteralExpr(StringEscapeUtils.escapeJava(operator.failureMessage(sourceText)));
        ObjectCreationExpr exception = new ObjectCreationExpr(null, new ClassOrInterfaceType(null, "ArithmeticException"),
                                                              NodeList.nodeList(message));
        return new LambdaExpr(new NodeList<>(), new ExpressionStmt(exception), true);
    }

    private String sourceText(Node node) {
        String text = AstUtils.sourceText(node);
        return text != null ? text : printer.printInline(node);
    }
}
