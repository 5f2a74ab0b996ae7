package c2py.error;

public class LexerException extends TranslationException {
    public LexerException(String message, int line, int column) {
        super(message, line, column);
    }
}
