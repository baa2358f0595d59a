/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.overf.parser.util;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;

import java.util.Optional;

/**
 * Shape predicates over JavaParser nodes, used to decide what gets rewritten and how.
 */
public class AstUtils {

    private AstUtils() {
    }

    public static Expression unwrapEnclosed(Expression expr) {
        Expression current = expr;
        while (current instanceof EnclosedExpr) {
            current = ((EnclosedExpr) current).getInner();
        }
        return current;
    }

    /**
     * Whether {@code expr} is string concatenation judged by shape alone: a string literal, a
     * text block, or a {@code +} with such an operand.
     */
    public static boolean isStringConcatenation(Expression expr) {
        Expression inner = unwrapEnclosed(expr);
        if (inner instanceof StringLiteralExpr || inner instanceof TextBlockLiteralExpr) {
            return true;
        }
        if (inner instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) inner;
            return binary.getOperator() == BinaryExpr.Operator.PLUS
                   && (isStringConcatenation(binary.getLeft()) || isStringConcatenation(binary.getRight()));
        }
        return false;
    }

    public static boolean isFloatingLiteral(Expression expr) {
        Expression inner = unwrapEnclosed(expr);
        if (inner instanceof UnaryExpr && ((UnaryExpr) inner).getOperator() == UnaryExpr.Operator.MINUS) {
            inner = unwrapEnclosed(((UnaryExpr) inner).getExpression());
        }
        return inner instanceof DoubleLiteralExpr;
    }

    public static boolean isLiteral(Expression expr) {
        return unwrapEnclosed(expr) instanceof LiteralExpr;
    }

    /**
     * Whether evaluating {@code expr} a second time is indistinguishable from evaluating it
     * once. Compound assignments are only expanded for such targets.
     */
    public static boolean isReevaluationSafe(Expression expr) {
        if (expr instanceof NameExpr || expr instanceof ThisExpr || expr instanceof SuperExpr
            || expr instanceof LiteralExpr) {
            return true;
        }
        if (expr instanceof EnclosedExpr) {
            return isReevaluationSafe(((EnclosedExpr) expr).getInner());
        }
        if (expr instanceof FieldAccessExpr) {
            return isReevaluationSafe(((FieldAccessExpr) expr).getScope());
        }
        if (expr instanceof ArrayAccessExpr) {
            ArrayAccessExpr access = (ArrayAccessExpr) expr;
            return isReevaluationSafe(access.getName()) && isReevaluationSafe(access.getIndex());
        }
        if (expr instanceof CastExpr) {
            return isReevaluationSafe(((CastExpr) expr).getExpression());
        }
        if (expr instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expr;
            return isReevaluationSafe(binary.getLeft()) && isReevaluationSafe(binary.getRight());
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            return !isIncrementOrDecrement(unary.getOperator()) && isReevaluationSafe(unary.getExpression());
        }
        return false;
    }

    public static boolean isIncrementOrDecrement(UnaryExpr.Operator operator) {
        switch (operator) {
            case PREFIX_INCREMENT:
            case PREFIX_DECREMENT:
            case POSTFIX_INCREMENT:
            case POSTFIX_DECREMENT:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether the value of {@code expr} is thrown away: it is an expression statement or part of
     * a {@code for} update list. The body of an expression lambda and of an arrow case in a
     * {@code switch} expression are expression statements whose value is used.
     */
    public static boolean isValueDiscarded(Expression expr) {
        Optional<Node> parent = expr.getParentNode();
        if (parent.isEmpty()) {
            return false;
        }
        if (parent.get() instanceof ExpressionStmt) {
            return !isYieldedValue((ExpressionStmt) parent.get());
        }
        if (parent.get() instanceof ForStmt) {
            return ((ForStmt) parent.get()).getUpdate().stream().anyMatch(update -> update == expr);
        }
        return false;
    }

    /**
     * Whether {@code expr} stands where Java requires a statement expression, so it must not be
     * parenthesized.
     */
    public static boolean isStatementExpression(Expression expr) {
        return isValueDiscarded(expr) || expr.getParentNode().filter(ExpressionStmt.class::isInstance).isPresent();
    }

    private static boolean isYieldedValue(ExpressionStmt statement) {
        Optional<Node> owner = statement.getParentNode();
        if (owner.isEmpty()) {
            return false;
        }
        if (owner.get() instanceof LambdaExpr) {
            return true;
        }
        if (owner.get() instanceof SwitchEntry) {
            SwitchEntry entry = (SwitchEntry) owner.get();
            return entry.getType() == SwitchEntry.Type.EXPRESSION
                   && entry.getParentNode().filter(SwitchExpr.class::isInstance).isPresent();
        }
        return false;
    }

    public static boolean hasBreakTo(Statement statement, String label) {
        return statement.findFirst(BreakStmt.class,
                                   b -> b.getLabel().map(l -> l.getIdentifier().equals(label)).orElse(false))
                .isPresent();
    }

    /**
     * The original source text of {@code node}, whitespace collapsed, or {@code null} when the
     * node was not produced by the parser.
     */
    public static String sourceText(Node node) {
        return node.getTokenRange()
                .map(range -> range.toString().replaceAll("\\s+", " ").trim())
                .orElse(null);
    }
}
