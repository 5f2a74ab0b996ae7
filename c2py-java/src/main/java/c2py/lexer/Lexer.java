package c2py.lexer;

import c2py.error.LexerException;
import c2py.error.UnsupportedConstructException;

import java.util.*;

public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;
    private int lineStart = 0;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("return", TokenType.RETURN),
            Map.entry("cout", TokenType.COUT),
            Map.entry("cin", TokenType.CIN),
            Map.entry("endl", TokenType.ENDL),
            Map.entry("main", TokenType.MAIN),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("using", TokenType.USING),
            Map.entry("namespace", TokenType.NAMESPACE),
            Map.entry("int", TokenType.INT),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("double", TokenType.DOUBLE),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("char", TokenType.CHAR),
            Map.entry("string", TokenType.STRING)
    );

    private static final Set<String> reserved = Set.of(
            "class", "struct", "union", "enum", "template", "typename",
            "void", "long", "short", "unsigned", "signed", "const", "auto",
            "switch", "case", "default", "do", "break", "continue", "goto",
            "new", "delete", "this", "operator", "typedef", "sizeof",
            "try", "catch", "throw", "public", "private", "protected",
            "virtual", "static", "friend", "inline", "extern", "nullptr"
    );

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            int startCol = col;
            int startLine = line;

            if (isAtEnd()) break;

            boolean atLineStart = source.substring(lineStart, pos).isBlank();
            char c = advance();

            switch (c) {
                case '+' -> {
                    if (match('+')) add(TokenType.INCREMENT, "++", startLine, startCol);
                    else if (match('=')) add(TokenType.PLUS_ASSIGN, "+=", startLine, startCol);
                    else add(TokenType.PLUS, "+", startLine, startCol);
                }
                case '-' -> {
                    if (match('-')) add(TokenType.DECREMENT, "--", startLine, startCol);
                    else if (match('=')) add(TokenType.MINUS_ASSIGN, "-=", startLine, startCol);
                    else add(TokenType.MINUS, "-", startLine, startCol);
                }
                case '*' -> {
                    boolean assign = match('=');
                    add(assign ? TokenType.STAR_ASSIGN : TokenType.STAR, assign ? "*=" : "*", startLine, startCol);
                }

                case '=' -> {
                    boolean eq = match('=');
                    add(eq ? TokenType.EQ : TokenType.ASSIGN, eq ? "==" : "=", startLine, startCol);
                }
                case '!' -> {
                    boolean neq = match('=');
                    add(neq ? TokenType.NEQ : TokenType.NOT, neq ? "!=" : "!", startLine, startCol);
                }

                case '<' -> {
                    if (match('<')) add(TokenType.SHL, "<<", startLine, startCol);
                    else if (match('=')) add(TokenType.LE, "<=", startLine, startCol);
                    else add(TokenType.LT, "<", startLine, startCol);
                }

                case '>' -> {
                    if (match('>')) add(TokenType.SHR, ">>", startLine, startCol);
                    else if (match('=')) add(TokenType.GE, ">=", startLine, startCol);
                    else add(TokenType.GT, ">", startLine, startCol);
                }

                case '&' -> {
                    if (match('&')) add(TokenType.AND, "&&", startLine, startCol);
                    else error("Unexpected character: '&'", startLine, startCol);
                }

                case '|' -> {
                    if (match('|')) add(TokenType.OR, "||", startLine, startCol);
                    else error("Unexpected character: '|'", startLine, startCol);
                }

                case '/' -> {
                    if (match('/')) {
                        skipLineComment();
                    } else if (match('*')) {
                        skipBlockComment(startLine, startCol);
                    } else if (match('=')) {
                        add(TokenType.SLASH_ASSIGN, "/=", startLine, startCol);
                    } else {
                        add(TokenType.SLASH, "/", startLine, startCol);
                    }
                }

                case '#' -> {
                    if (!atLineStart) error("Unexpected character: '#'", startLine, startCol);
                    directive(startLine, startCol);
                }

                case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
                case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
                case '{' -> add(TokenType.LBRACE, "{", startLine, startCol);
                case '}' -> add(TokenType.RBRACE, "}", startLine, startCol);
                case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
                case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
                case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
                case ',' -> add(TokenType.COMMA, ",", startLine, startCol);

                case '"' -> stringLiteral(startLine, startCol);
                case '\'' -> charLiteral(startLine, startCol);

                default -> {
                    if (isDigit(c) || (c == '.' && isDigit(peek()))) numberLiteral(c, startLine, startCol);
                    else if (isAlpha(c)) identifier(c, startLine, startCol);
                    else error("Unexpected character: '" + c + "'", startLine, startCol);
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= helpers =================

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        boolean isFloat = first == '.';

        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }

        if (!isFloat && peek() == '.') {
            isFloat = true;
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            isFloat = true;
            sb.append(advance());
            if (peek() == '+' || peek() == '-') sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) {
                sb.append(advance());
            }
        }

        String text = sb.toString();
        if (!isFloat && text.length() > 1 && text.charAt(0) == '0') {
            for (char d : text.toCharArray()) {
                if (d > '7') error("Invalid digit '" + d + "' in octal literal " + text, line, col);
            }
        }

        add(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL, text, line, col);
    }

    private void identifier(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);

        while (!isAtEnd() && isAlphaNumeric(peek())) {
            sb.append(advance());
        }

        String text = sb.toString();
        TokenType type = keywords.getOrDefault(text,
                reserved.contains(text) ? TokenType.RESERVED : TokenType.IDENTIFIER);

        add(type, text, line, col);
    }

    private void stringLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder("\"");

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\n') error("Unterminated string literal", line, col);
            sb.append(c);
            // the escaped character is copied as-is and never closes the literal
            if (c == '\\' && !isAtEnd() && peek() != '\n') sb.append(advance());
        }

        if (isAtEnd()) error("Unterminated string literal", line, col);

        sb.append(advance()); // closing "
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private void charLiteral(int line, int col) {
        StringBuilder sb = new StringBuilder("'");
        if (isAtEnd() || peek() == '\n') error("Unterminated character literal", line, col);
        if (peek() == '\'') error("Empty character literal", line, col);

        char c = advance();
        sb.append(c);
        if (c == '\\') {
            if (isAtEnd() || peek() == '\n') error("Unterminated character literal", line, col);
            sb.append(advance());
        }

        if (peek() != '\'') error("Unterminated character literal", line, col);
        sb.append(advance());
        add(TokenType.CHAR_LITERAL, sb.toString(), line, col);
    }

    private void directive(int line, int col) {
        int start = pos;
        while (!isAtEnd() && peek() != '\n') advance();
        String text = source.substring(start, pos).strip();
        if (!text.startsWith("include")) {
            String name = text.split("\\s+", 2)[0];
            throw new UnsupportedConstructException("preprocessor directive '#" + name + "'", line, col);
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            switch (c) {
                case ' ', '\t', '\r', '\f' -> advance();
                case '\n' -> newline();
                default -> { return; }
            }
        }
    }

    private void skipLineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
    }

    private void skipBlockComment(int line, int col) {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (c == '/' && peekNext() == '*') {
                error("Nested block comment", this.line, this.col);
            }
            if (c == '\n') newline();
            else advance();
        }
        error("Unterminated block comment", line, col);
    }

    private void newline() {
        advance();
        line++;
        col = 1;
        lineStart = pos;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(pos++);
        col++;
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 >= source.length() ? '\0' : source.charAt(pos + 1);
    }

    private char peekAt(int offset) {
        return pos + offset >= source.length() ? '\0' : source.charAt(pos + offset);
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private void error(String message, int line, int col) {
        throw new LexerException(message, line, col);
    }
}
