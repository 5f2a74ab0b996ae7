package c2py.lexer;

public enum TokenType {

    // literals
    IDENTIFIER(TokenKind.IDENTIFIER),
    INT_LITERAL(TokenKind.INT_LITERAL),
    FLOAT_LITERAL(TokenKind.FLOAT_LITERAL),
    STRING_LITERAL(TokenKind.STRING_LITERAL),
    // 'a' shares the quoted-literal kind with strings
    CHAR_LITERAL(TokenKind.STRING_LITERAL),

    // keywords
    IF(TokenKind.KEYWORD),
    ELSE(TokenKind.KEYWORD),
    WHILE(TokenKind.KEYWORD),
    FOR(TokenKind.KEYWORD),
    RETURN(TokenKind.KEYWORD),
    COUT(TokenKind.KEYWORD),
    CIN(TokenKind.KEYWORD),
    ENDL(TokenKind.KEYWORD),
    MAIN(TokenKind.KEYWORD),
    TRUE(TokenKind.KEYWORD),
    FALSE(TokenKind.KEYWORD),
    USING(TokenKind.KEYWORD),
    NAMESPACE(TokenKind.KEYWORD),
    // C++ keywords outside the subset
    RESERVED(TokenKind.KEYWORD),

    // types
    INT(TokenKind.KEYWORD),
    FLOAT(TokenKind.KEYWORD),
    DOUBLE(TokenKind.KEYWORD),
    BOOL(TokenKind.KEYWORD),
    CHAR(TokenKind.KEYWORD),
    STRING(TokenKind.KEYWORD),

    // operators
    PLUS(TokenKind.OPERATOR), MINUS(TokenKind.OPERATOR),
    STAR(TokenKind.OPERATOR), SLASH(TokenKind.OPERATOR),
    INCREMENT(TokenKind.OPERATOR), DECREMENT(TokenKind.OPERATOR),
    ASSIGN(TokenKind.OPERATOR),
    PLUS_ASSIGN(TokenKind.OPERATOR), MINUS_ASSIGN(TokenKind.OPERATOR),
    STAR_ASSIGN(TokenKind.OPERATOR), SLASH_ASSIGN(TokenKind.OPERATOR),
    EQ(TokenKind.OPERATOR), NEQ(TokenKind.OPERATOR),
    LT(TokenKind.OPERATOR), LE(TokenKind.OPERATOR),
    GT(TokenKind.OPERATOR), GE(TokenKind.OPERATOR),
    AND(TokenKind.OPERATOR), OR(TokenKind.OPERATOR), NOT(TokenKind.OPERATOR),
    SHL(TokenKind.OPERATOR), SHR(TokenKind.OPERATOR),

    // symbols
    LPAREN(TokenKind.PUNCTUATION), RPAREN(TokenKind.PUNCTUATION),
    LBRACE(TokenKind.PUNCTUATION), RBRACE(TokenKind.PUNCTUATION),
    LBRACKET(TokenKind.PUNCTUATION), RBRACKET(TokenKind.PUNCTUATION),
    SEMICOLON(TokenKind.PUNCTUATION), COMMA(TokenKind.PUNCTUATION),

    EOF(TokenKind.EOF);

    private final TokenKind kind;

    TokenType(TokenKind kind) {
        this.kind = kind;
    }

    public TokenKind kind() { return kind; }

    public boolean isTypeKeyword() {
        return this == INT || this == FLOAT || this == DOUBLE || this == BOOL || this == CHAR || this == STRING;
    }
}
