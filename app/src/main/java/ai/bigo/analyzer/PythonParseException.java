package ai.bigo.analyzer;

/** Thrown when the source text is not syntactically valid Python. */
public final class PythonParseException extends Exception {
    private final int line;
    private final int column;

    public PythonParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /** 1-based line of the first syntax error. */
    public int line() {
        return line;
    }

    /** 1-based column (in bytes) of the first syntax error. */
    public int column() {
        return column;
    }
}
