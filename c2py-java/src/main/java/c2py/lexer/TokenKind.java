package c2py.lexer;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    OPERATOR,
    PUNCTUATION,
    EOF
}
