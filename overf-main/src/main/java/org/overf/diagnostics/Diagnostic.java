package org.overf.diagnostics;

/**
 * A single problem found while transforming a block.
 *
 * @param type    the severity
 * @param message the diagnostic message
 * @param line    the 1-based line in the transformed input, 0 when unknown
 * @param column  the 1-based column, 0 when unknown
 */
public record Diagnostic(
        Type type,
        String message,
        int line,
        int column
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        /** The output must not be compiled. */
        ERROR,
        /** The output is valid but part of it keeps Java's default semantics. */
        WARNING
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        return String.format("%d:%d: %s: %s", line, column, type.name().toLowerCase(), message);
    }
}
