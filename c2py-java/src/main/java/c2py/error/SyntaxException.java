package c2py.error;

import c2py.lexer.Token;

public class SyntaxException extends TranslationException {
    private final String expected;
    private final Token found;

    public SyntaxException(String expected, Token found) {
        super(expected + " (got " + found.type() + " '" + found.lexeme() + "')", found.line(), found.column());
        this.expected = expected;
        this.found = found;
    }

    public String expected() { return expected; }

    public Token found() { return found; }
}
