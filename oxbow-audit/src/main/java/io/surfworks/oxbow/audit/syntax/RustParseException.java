package io.surfworks.oxbow.audit.syntax;

/**
 * Exception thrown when Rust source text cannot be tokenized or parsed.
 */
public class RustParseException extends RuntimeException {

    private final int line;
    private final int column;

    public RustParseException(String message) {
        super(message);
        this.line = -1;
        this.column = -1;
    }

    public RustParseException(String message, int line, int column) {
        super(String.format("%s at line %d, column %d", message, line, column));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
