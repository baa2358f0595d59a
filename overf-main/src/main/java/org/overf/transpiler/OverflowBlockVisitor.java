package org.overf.transpiler;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.comments.LineComment;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;
import org.overf.OverflowPolicy;
import org.overf.TransformOptions;
import org.overf.diagnostics.DiagnosticsEngine;
import org.overf.parser.util.AstUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Walks a block depth-first, tracking the active overflow policy in a {@link PolicyScope} that is
 * passed down as the visitor argument, and replaces arithmetic nodes with the rewriter's output.
 * <p>
 * Policy blocks are labeled blocks ({@code checked: { ... }}). Entering one pushes its policy;
 * the enclosing policy applies again to whatever follows it. The reset label pushes
 * {@link OverflowPolicy#DEFAULT}.
 * <p>
 * Propagating operations throw the runtime's overflow signal. The outermost propagating region
 * of each function body is wrapped in a handler that catches it and returns the function's
 * absent value. Lambda, method, constructor and initializer bodies are separate functions.
 * <p>
 * A visitor instance serves one traversal: function frames and diagnostics accumulate in it.
 */
public class OverflowBlockVisitor extends ModifierVisitor<PolicyScope> {

    private static final Logger logger = LoggerFactory.getLogger(OverflowBlockVisitor.class);

    private final TransformOptions options;
    private final ArithmeticRewriter rewriter;
    private final DiagnosticsEngine diagnostics;
    private final int lineOffset;
    private final Expression absentValue;
    private final ClassOrInterfaceType signalType;

    public OverflowBlockVisitor(TransformOptions options, DiagnosticsEngine diagnostics, int lineOffset) {
        this.options = options;
        this.rewriter = new ArithmeticRewriter(options);
        this.diagnostics = diagnostics;
        this.lineOffset = lineOffset;
        JavaParser parser = new JavaParser();
        this.absentValue = parser.parseExpression(options.getAbsentValue()).getResult()
                .orElseThrow(() -> new IllegalArgumentException("Invalid absent value " + options.getAbsentValue()));
        this.signalType = parser.parseClassOrInterfaceType(options.getSignalClass()).getResult()
                .orElseThrow(() -> new IllegalArgumentException("Invalid signal class " + options.getSignalClass()));
    }

    /**
     * Rewrites block input under {@code initialPolicy}. The returned block holds the statements
     * to emit; when propagation needs a handler at top level it is a single {@code try}.
     */
    public BlockStmt visitBlock(BlockStmt block, OverflowPolicy initialPolicy) {
        FunctionFrame frame = FunctionFrame.forBlock(absentValue);
        PolicyScope scope = PolicyScope.base(frame).push(initialPolicy);
        logger.debug("Transforming block under {}", initialPolicy);

        BlockStmt result = (BlockStmt) block.accept(this, scope);
        if (frame.hasUnhandledPropagations()) {
            result = new BlockStmt(NodeList.nodeList(handler(new NodeList<>(result.getStatements()), frame)));
        }
        return result;
    }

    /**
     * Rewrites the policy blocks of a whole source file. Outside them Java's arithmetic is kept.
     */
    public CompilationUnit visitCompilationUnit(CompilationUnit unit) {
        PolicyScope scope = PolicyScope.base(FunctionFrame.forBlock(absentValue));
        return (CompilationUnit) unit.accept(this, scope);
    }

    // ── policy blocks ──────────────────────────────────────────────────────

    @Override
    public Visitable visit(LabeledStmt n, PolicyScope scope) {
        String label = n.getLabel().getIdentifier();
        Optional<OverflowPolicy> labeled = options.policyForLabel(label);
        if (labeled.isEmpty()) {
            return super.visit(n, scope);
        }
        if (!n.getStatement().isBlockStmt()) {
            String message = "policy label '" + label + "' must be applied to a block, found "
                             + n.getStatement().getClass().getSimpleName();
            error(message, n);
            n.setComment(new LineComment(" overf error: " + message));
            return n;
        }

        OverflowPolicy policy = labeled.get();
        FunctionFrame frame = scope.frame();
        PolicyScope inner = scope.push(policy);
        boolean installsHandler = policy == OverflowPolicy.PROPAGATING && !scope.isPropagationHandled();
        if (installsHandler) {
            inner = inner.withPropagationHandled();
        }
        logger.debug("Entering {} block at line {} (scope depth {})", policy, line(n), inner.depth());

        int before = frame.getPropagations();
        BlockStmt body = (BlockStmt) n.getStatement().accept(this, inner);
        boolean keepLabel = AstUtils.hasBreakTo(body, label);
        Statement replacement = body;
        if (installsHandler && frame.getPropagations() > before) {
            if (frame.absentValue().isPresent()) {
                replacement = handler(new NodeList<>(body.getStatements()), frame);
            } else {
                error(frame.describeViolation(), n);
            }
        }

        if (keepLabel) {
            n.setStatement(replacement.isBlockStmt() ? replacement : new BlockStmt(NodeList.nodeList(replacement)));
            return n;
        }
        return replacement;
    }

    // ── function boundaries ────────────────────────────────────────────────

    @Override
    public Visitable visit(LambdaExpr n, PolicyScope scope) {
        FunctionFrame frame = FunctionFrame.forLambda(absentValue);
        LambdaExpr lambda = (LambdaExpr) super.visit(n, scope.enterFunction(frame));
        if (frame.hasUnhandledPropagations()) {
            Statement body = lambda.getBody();
            NodeList<Statement> statements = body.isBlockStmt()
                    ? new NodeList<>(body.asBlockStmt().getStatements())
                    : NodeList.nodeList(new ReturnStmt(body.asExpressionStmt().getExpression()));
            lambda.setBody(new BlockStmt(NodeList.nodeList(handler(statements, frame))));
        }
        return lambda;
    }

    @Override
    public Visitable visit(MethodDeclaration n, PolicyScope scope) {
        FunctionFrame frame = FunctionFrame.forMethod(n);
        MethodDeclaration method = (MethodDeclaration) super.visit(n, scope.enterFunction(frame));
        if (frame.hasUnhandledPropagations()) {
            method.getBody().ifPresent(body -> method.setBody(wrapBody(body, frame, n)));
        }
        return method;
    }

    @Override
    public Visitable visit(ConstructorDeclaration n, PolicyScope scope) {
        FunctionFrame frame = FunctionFrame.forConstructor(n.getNameAsString());
        ConstructorDeclaration constructor = (ConstructorDeclaration) super.visit(n, scope.enterFunction(frame));
        if (frame.hasUnhandledPropagations()) {
            error(frame.describeViolation(), n);
        }
        return constructor;
    }

    @Override
    public Visitable visit(InitializerDeclaration n, PolicyScope scope) {
        FunctionFrame frame = FunctionFrame.forInitializer();
        InitializerDeclaration initializer = (InitializerDeclaration) super.visit(n, scope.enterFunction(frame));
        if (frame.hasUnhandledPropagations()) {
            error(frame.describeViolation(), n);
        }
        return initializer;
    }

    // ── switch labels ──────────────────────────────────────────────────────

    /**
     * Case labels must stay constant expressions, so only the entry's statements are rewritten.
     */
    @Override
    public Visitable visit(SwitchEntry n, PolicyScope scope) {
        NodeList<Expression> labels = n.getLabels();
        n.setLabels(new NodeList<>());
        SwitchEntry entry = (SwitchEntry) super.visit(n, scope);
        entry.setLabels(labels);
        return entry;
    }

    // ── arithmetic ─────────────────────────────────────────────────────────

    @Override
    public Visitable visit(BinaryExpr n, PolicyScope scope) {
        Visitable visited = super.visit(n, scope);
        if (visited != n) {
            return visited;
        }
        return rewrite(n, scope);
    }

    @Override
    public Visitable visit(AssignExpr n, PolicyScope scope) {
        if (scope.current().rewrites() && rewriter.isArithmetic(n) && !AstUtils.isReevaluationSafe(n.getTarget())) {
            error("compound assignment target `" + n.getTarget() + "` has side effects and would be evaluated twice; "
                  + "assign it to a local variable first", n);
            return super.visit(n, scope);
        }
        Visitable visited = super.visit(n, scope);
        if (visited != n) {
            return visited;
        }
        return rewrite(n, scope);
    }

    @Override
    public Visitable visit(UnaryExpr n, PolicyScope scope) {
        if (scope.current().rewrites() && AstUtils.isIncrementOrDecrement(n.getOperator())) {
            if (n.getOperator().isPostfix() && !AstUtils.isValueDiscarded(n)) {
                warning("value of `" + n + "` is used; postfix " + (n.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT
                        ? "increment" : "decrement") + " keeps Java's default arithmetic here", n);
                return super.visit(n, scope);
            }
            if (!AstUtils.isReevaluationSafe(n.getExpression())) {
                error("increment target `" + n.getExpression() + "` has side effects and would be evaluated twice", n);
                return super.visit(n, scope);
            }
        }
        Visitable visited = super.visit(n, scope);
        if (visited != n) {
            return visited;
        }
        return rewrite(n, scope);
    }

    private Expression rewrite(Expression node, PolicyScope scope) {
        OverflowPolicy policy = scope.current();
        Expression result = rewriter.rewrite(node, policy);
        if (result != node) {
            if (logger.isDebugEnabled()) {
                logger.debug("Rewrote `{}` at line {} under {}", AstUtils.sourceText(node), line(node), policy);
            }
            if (policy == OverflowPolicy.PROPAGATING) {
                scope.frame().recordPropagation(scope.isPropagationHandled());
            }
        }
        return result;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private BlockStmt wrapBody(BlockStmt body, FunctionFrame frame, Node function) {
        if (frame.absentValue().isEmpty()) {
            error(frame.describeViolation(), function);
            return body;
        }
        return new BlockStmt(NodeList.nodeList(handler(new NodeList<>(body.getStatements()), frame)));
    }

    /**
     * {@code try { statements } catch (Signal handler) { return absent; }}
     */
    private TryStmt handler(NodeList<Statement> statements, FunctionFrame frame) {
        Expression absent = frame.absentValue()
                .orElseThrow(() -> new IllegalStateException(frame.describeViolation()));
        CatchClause catchClause = new CatchClause(
                new Parameter(signalType.clone(), options.getHandlerVariable()),
                new BlockStmt(NodeList.nodeList(new ReturnStmt(absent))));
        return new TryStmt(new BlockStmt(statements), NodeList.nodeList(catchClause), null);
    }

    private void error(String message, Node node) {
        logger.debug("Error at line {}: {}", line(node), message);
        diagnostics.reportError(message, line(node), column(node));
    }

    private void warning(String message, Node node) {
        diagnostics.reportWarning(message, line(node), column(node));
    }

    private int line(Node node) {
        return node.getBegin().map(p -> Math.max(1, p.line - lineOffset)).orElse(0);
    }

    private int column(Node node) {
        return node.getBegin().map(p -> p.column).orElse(0);
    }
}
