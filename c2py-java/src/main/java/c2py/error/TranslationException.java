package c2py.error;

/**
 * Base of every failure the pipeline reports for bad input.
 * The message is always prefixed with the source position as {@code [line:col]}.
 */
public abstract class TranslationException extends RuntimeException {
    private final int line;
    private final int column;

    protected TranslationException(String message, int line, int column) {
        super("[" + line + ":" + column + "] " + message);
        this.line = line;
        this.column = column;
    }

    public int line() { return line; }

    public int column() { return column; }
}
