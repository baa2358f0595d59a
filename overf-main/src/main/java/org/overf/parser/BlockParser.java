package org.overf.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.overf.BlockParseException;

import java.util.Optional;

/**
 * Parses Java source handed to the transformer. Block input is a sequence of block statements
 * without the enclosing braces.
 */
public class BlockParser {

    /**
     * Block input is parsed as {@code "{\n" + input + "\n}"}: node lines are one past the input's
     * own lines, columns are unchanged.
     */
    public static final int BLOCK_LINE_OFFSET = 1;

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
            .setStoreTokens(true);

    public BlockStmt parseBlock(String statements) {
        ParseResult<BlockStmt> result = new JavaParser(configuration).parseBlock("{\n" + statements + "\n}");
        return unwrap(result, statements, BLOCK_LINE_OFFSET);
    }

    public CompilationUnit parseCompilationUnit(String source) {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);
        return unwrap(result, source, 0);
    }

    private static <T> T unwrap(ParseResult<T> result, String source, int lineOffset) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
        if (problem == null) {
            throw new BlockParseException("Parse error: no result", source, 0, 0);
        }
        Optional<Position> position = problem.getLocation()
                .flatMap(range -> range.getBegin().getRange())
                .map(range -> range.begin);
        int line = position.map(p -> Math.max(1, p.line - lineOffset)).orElse(0);
        int column = position.map(p -> p.column).orElse(0);
        throw new BlockParseException("Parse error: " + firstLine(problem.getMessage()), source, line, column,
                                      problem.getCause().orElse(null));
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline).trim();
    }
}
