package org.overf;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import org.overf.diagnostics.Diagnostic;
import org.overf.diagnostics.DiagnosticsEngine;
import org.overf.parser.BlockParser;
import org.overf.printer.BlockPrinter;
import org.overf.transpiler.OverflowBlockVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry points of the transformer. Each block entry point takes Java block statements (the text
 * between a block's braces), rewrites their arithmetic under one policy and returns the
 * statements to splice back in place of the invocation.
 * <p>
 * <pre>{@code
 * TransformResult result = new OverflowBlocks().checked("int c = a + b;");
 * // int c = org.overf.runtime.OverflowArithmetic.checkedAdd(a, b).orElseThrow(...);
 * }</pre>
 * Instances only hold immutable options and can be shared.
 */
public class OverflowBlocks {

    private static final Logger logger = LoggerFactory.getLogger(OverflowBlocks.class);

    private final TransformOptions options;
    private final BlockParser parser;
    private final BlockPrinter printer;

    public OverflowBlocks() {
        this(TransformOptions.load());
    }

    public OverflowBlocks(TransformOptions options) {
        this.options = options;
        this.parser = new BlockParser();
        this.printer = new BlockPrinter();
    }

    /**
     * Overflow throws {@link ArithmeticException} naming the operation.
     */
    public TransformResult checked(String statements) {
        return transform(statements, OverflowPolicy.CHECKED);
    }

    /**
     * Overflow wraps around.
     */
    public TransformResult overflowing(String statements) {
        return transform(statements, OverflowPolicy.OVERFLOWING);
    }

    /**
     * Overflow clamps to the type's bounds.
     */
    public TransformResult saturating(String statements) {
        return transform(statements, OverflowPolicy.SATURATING);
    }

    /**
     * Overflow returns the enclosing function's absent value, by default
     * {@code java.util.Optional.empty()}. The statements are expected to end by returning the
     * present value.
     */
    public TransformResult propagating(String statements) {
        return transform(statements, OverflowPolicy.PROPAGATING);
    }

    /**
     * Java's own arithmetic. Input without nested policy blocks is returned verbatim.
     */
    public TransformResult defaults(String statements) {
        return transform(statements, OverflowPolicy.DEFAULT);
    }

    public TransformResult transform(String statements, OverflowPolicy policy) {
        BlockStmt block;
        try {
            block = parser.parseBlock(statements);
        } catch (BlockParseException e) {
            logger.debug("Could not parse block: {}", e.getMessage());
            return TransformResult.failed(new Diagnostic(Diagnostic.Type.ERROR, e.getMessage(), e.getLine(), e.getColumn()));
        }
        if (policy == OverflowPolicy.DEFAULT && !containsPolicyBlock(block)) {
            return new TransformResult(statements, List.of());
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        BlockStmt rewritten = new OverflowBlockVisitor(options, diagnostics, BlockParser.BLOCK_LINE_OFFSET)
                .visitBlock(block, policy);
        if (diagnostics.hasErrors()) {
            logger.debug("Block transformed under {} with errors:\n{}", policy, diagnostics.summary());
        }
        return new TransformResult(printer.printStatements(rewritten.getStatements()), diagnostics.getDiagnostics());
    }

    /**
     * Rewrites the policy blocks of a complete source file. The absent value of propagation is
     * derived from each method's declared return type.
     */
    public TransformResult transformCompilationUnit(String source) {
        CompilationUnit unit;
        try {
            unit = parser.parseCompilationUnit(source);
        } catch (BlockParseException e) {
            logger.debug("Could not parse compilation unit: {}", e.getMessage());
            return TransformResult.failed(new Diagnostic(Diagnostic.Type.ERROR, e.getMessage(), e.getLine(), e.getColumn()));
        }
        if (!containsPolicyBlock(unit)) {
            return new TransformResult(source, List.of());
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        CompilationUnit rewritten = new OverflowBlockVisitor(options, diagnostics, 0).visitCompilationUnit(unit);
        return new TransformResult(printer.print(rewritten), diagnostics.getDiagnostics());
    }

    private boolean containsPolicyBlock(Node node) {
        return node.findFirst(LabeledStmt.class, l -> options.policyForLabel(l.getLabel().getIdentifier()).isPresent())
                .isPresent();
    }
}
