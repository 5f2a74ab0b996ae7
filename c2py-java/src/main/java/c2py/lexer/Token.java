package c2py.lexer;

public record Token(
        TokenType type,
        String lexeme,
        int line,
        int column
) {
    public TokenKind kind() { return type.kind(); }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
