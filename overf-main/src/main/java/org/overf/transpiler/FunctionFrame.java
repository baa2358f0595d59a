package org.overf.transpiler;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;

import java.util.Optional;
import java.util.Set;

/**
 * What propagation needs to know about one function body: the value returned when an overflow
 * is propagated out of it, and how many propagating operations were emitted in it.
 * <p>
 * A frame is created per body and only lives for one traversal.
 */
public final class FunctionFrame {

    private static final Set<String> OPTIONAL_TYPES = Set.of("Optional", "OptionalInt", "OptionalLong", "OptionalDouble");

    private final String description;
    private final Expression absentValue;
    private final String returnDescription;

    private int propagations;
    private int unhandledPropagations;

    private FunctionFrame(String description, Expression absentValue, String returnDescription) {
        this.description = description;
        this.absentValue = absentValue;
        this.returnDescription = returnDescription;
    }

    /**
     * The top-level block of block input; its enclosing function is not visible.
     */
    public static FunctionFrame forBlock(Expression absentValue) {
        return new FunctionFrame("block", absentValue, null);
    }

    public static FunctionFrame forLambda(Expression absentValue) {
        return new FunctionFrame("lambda", absentValue, null);
    }

    public static FunctionFrame forMethod(MethodDeclaration method) {
        String description = "method `" + method.getNameAsString() + "`";
        Type type = method.getType();
        if (type instanceof ClassOrInterfaceType) {
            ClassOrInterfaceType classType = (ClassOrInterfaceType) type;
            String name = classType.getNameAsString();
            boolean javaUtil = classType.getScope().map(scope -> scope.asString().equals("java.util")).orElse(true);
            if (javaUtil && OPTIONAL_TYPES.contains(name)) {
                return new FunctionFrame(description, emptyOf(name), null);
            }
        }
        return new FunctionFrame(description, null, "returns " + type.asString());
    }

    public static FunctionFrame forConstructor(String name) {
        return new FunctionFrame("constructor `" + name + "`", null, "cannot return a value");
    }

    public static FunctionFrame forInitializer() {
        return new FunctionFrame("initializer", null, "cannot return a value");
    }

    private static Expression emptyOf(String optionalType) {
        return new MethodCallExpr(new FieldAccessExpr(new FieldAccessExpr(new NameExpr("java"), "util"), optionalType), "empty");
    }

    /**
     * @return a fresh copy of the absent value, or empty when the function cannot represent
     * absence
     */
    public Optional<Expression> absentValue() {
        return Optional.ofNullable(absentValue).map(Expression::clone);
    }

    public String describeViolation() {
        return "propagating arithmetic requires the enclosing function to return Optional, OptionalInt, "
               + "OptionalLong or OptionalDouble, but " + description + " " + returnDescription;
    }

    void recordPropagation(boolean handled) {
        propagations++;
        if (!handled) {
            unhandledPropagations++;
        }
    }

    public int getPropagations() {
        return propagations;
    }

    public boolean hasUnhandledPropagations() {
        return unhandledPropagations > 0;
    }
}
