package org.overf;

public class BlockParseException extends OverflowBlocksException {

    private final String source;
    private final int line;
    private final int column;

    public BlockParseException(String message, String source, int line, int column) {
        super(message);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public BlockParseException(String message, String source, int line, int column, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return 1-based line in {@link #getSource()}, or 0 when the parser reported no location
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
