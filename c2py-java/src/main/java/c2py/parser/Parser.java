package c2py.parser;

import c2py.ast.Program;
import c2py.ast.expr.*;
import c2py.ast.stmt.AssignStmt;
import c2py.ast.stmt.BlockStmt;
import c2py.ast.stmt.CinStmt;
import c2py.ast.stmt.CoutStmt;
import c2py.ast.stmt.ExprStmt;
import c2py.ast.stmt.ForStmt;
import c2py.ast.stmt.IfStmt;
import c2py.ast.stmt.ReturnStmt;
import c2py.ast.stmt.Stmt;
import c2py.ast.stmt.VarDeclStmt;
import c2py.ast.stmt.WhileStmt;
import c2py.error.SyntaxException;
import c2py.error.TranslationException;
import c2py.error.UnsupportedConstructException;
import c2py.lexer.Token;
import c2py.lexer.TokenType;
import c2py.types.VarType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class Parser {
    private final List<Token> tokens;
    private int pos = 0;

    // no scoping: the last declaration of a name wins
    private final Map<String, VarType> declared = new HashMap<>();

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<Stmt> stmts = new ArrayList<>();
        boolean sawMain = false;

        while (!check(TokenType.EOF)) {
            if (match(TokenType.USING)) {
                parseUsingDirective();
                continue;
            }
            if (check(TokenType.INT) && checkNext(TokenType.MAIN)) {
                if (sawMain) throw error(tokens.get(pos + 1), "Expected a single 'main' definition");
                stmts.addAll(parseMain().statements());
                sawMain = true;
                continue;
            }
            if (isFunctionHeader()) {
                Token name = tokens.get(pos + 1);
                throw unsupported("function definition '" + name.lexeme() + "' (only main is translated)", name);
            }
            if (peek().type().isTypeKeyword()) {
                stmts.addAll(parseDeclaration());
                consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
                continue;
            }
            throw error(peek(), "Expected declaration or 'int main()'");
        }
        if (!sawMain) throw error(peek(), "Expected 'int main()' definition");
        return new Program(stmts);
    }

    private void parseUsingDirective() {
        consume(TokenType.NAMESPACE, "Expected 'namespace' after 'using'");
        Token ns = consume(TokenType.IDENTIFIER, "Expected namespace name");
        if (!ns.lexeme().equals("std")) {
            throw unsupported("namespace '" + ns.lexeme() + "'", ns);
        }
        consume(TokenType.SEMICOLON, "Expected ';' after using directive");
    }

    private BlockStmt parseMain() {
        consume(TokenType.INT, "Expected 'int'");
        consume(TokenType.MAIN, "Expected 'main'");
        consume(TokenType.LPAREN, "Expected '(' after main");
        consume(TokenType.RPAREN, "Expected ')': main takes no parameters");
        return parseBlock();
    }

    private boolean isFunctionHeader() {
        TokenType t = peek().type();
        return (t.isTypeKeyword() || t == TokenType.RESERVED)
                && checkNext(TokenType.IDENTIFIER)
                && checkAt(2, TokenType.LPAREN);
    }

    // ---------- block / statements ----------
    private BlockStmt parseBlock() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (peek().type().isTypeKeyword()) {
                stmts.addAll(parseDeclaration());
                consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
            } else {
                stmts.add(parseStmt());
            }
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new BlockStmt(stmts);
    }

    // body of if/while/for: a block or a single statement
    private BlockStmt parseBody() {
        if (check(TokenType.LBRACE)) return parseBlock();
        return new BlockStmt(List.of(parseStmt()));
    }

    private Stmt parseStmt() {
        if (check(TokenType.LBRACE)) return parseBlock();

        if (match(TokenType.IF)) return parseIf();
        if (match(TokenType.WHILE)) return parseWhile();
        if (match(TokenType.FOR)) return parseFor();
        if (match(TokenType.RETURN)) return parseReturn();
        if (match(TokenType.COUT)) return parseCout();
        if (match(TokenType.CIN)) return parseCin();

        if (peek().type().isTypeKeyword()) {
            List<Stmt> decls = parseDeclaration();
            consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
            return decls.size() == 1 ? decls.get(0) : new BlockStmt(decls);
        }

        // empty statement
        if (match(TokenType.SEMICOLON)) return new BlockStmt(List.of());

        if (startsAssignment()) {
            AssignStmt a = parseAssignment();
            consume(TokenType.SEMICOLON, "Expected ';' after assignment");
            return a;
        }

        // expr stmt
        Expr e = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExprStmt(e);
    }

    private List<Stmt> parseDeclaration() {
        VarType type = parseType();
        List<Stmt> decls = new ArrayList<>();
        do {
            decls.add(parseDeclarator(type));
        } while (match(TokenType.COMMA));
        return decls;
    }

    private VarDeclStmt parseDeclarator(VarType type) {
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        if (check(TokenType.LBRACKET)) {
            throw unsupported("array declaration '" + name.lexeme() + "[]'", peek());
        }
        if (check(TokenType.LPAREN)) {
            throw unsupported("function declaration '" + name.lexeme() + "'", name);
        }

        Expr init = null;
        if (match(TokenType.ASSIGN)) {
            init = parseExpr();
        }
        // registered after the initializer: `int x = x;` sees the previous x
        declared.put(name.lexeme(), type);
        return new VarDeclStmt(name.lexeme(), type, init);
    }

    private VarType parseType() {
        Token t = advance();
        return switch (t.type()) {
            case INT -> VarType.INT;
            case FLOAT, DOUBLE -> VarType.FLOAT;
            case BOOL -> VarType.BOOL;
            case CHAR -> VarType.CHAR;
            case STRING -> VarType.STRING;
            default -> throw error(t, "Expected type name");
        };
    }

    private boolean startsAssignment() {
        if (check(TokenType.INCREMENT) || check(TokenType.DECREMENT)) {
            return checkNext(TokenType.IDENTIFIER);
        }
        if (!check(TokenType.IDENTIFIER)) return false;
        return checkNext(TokenType.ASSIGN)
                || checkNext(TokenType.PLUS_ASSIGN) || checkNext(TokenType.MINUS_ASSIGN)
                || checkNext(TokenType.STAR_ASSIGN) || checkNext(TokenType.SLASH_ASSIGN)
                || checkNext(TokenType.INCREMENT) || checkNext(TokenType.DECREMENT);
    }

    private AssignStmt parseAssignment() {
        if (match(TokenType.INCREMENT, TokenType.DECREMENT)) {
            Token op = previous();
            Token name = consume(TokenType.IDENTIFIER, "Expected variable after '" + op.lexeme() + "'");
            return step(name, op);
        }

        Token name = consume(TokenType.IDENTIFIER, "Expected assignment target");
        if (match(TokenType.INCREMENT, TokenType.DECREMENT)) {
            return step(name, previous());
        }

        AssignStmt.Op op = switch (peek().type()) {
            case ASSIGN -> AssignStmt.Op.SET;
            case PLUS_ASSIGN -> AssignStmt.Op.ADD;
            case MINUS_ASSIGN -> AssignStmt.Op.SUB;
            case STAR_ASSIGN -> AssignStmt.Op.MUL;
            case SLASH_ASSIGN -> AssignStmt.Op.DIV;
            default -> throw error(peek(), "Expected assignment operator");
        };
        advance();
        Expr value = parseExpr();
        return new AssignStmt(name.lexeme(), op, value, declared.get(name.lexeme()));
    }

    private AssignStmt step(Token name, Token op) {
        AssignStmt.Op kind = op.type() == TokenType.INCREMENT ? AssignStmt.Op.ADD : AssignStmt.Op.SUB;
        return new AssignStmt(name.lexeme(), kind, new IntLiteral(1), declared.get(name.lexeme()));
    }

    private IfStmt parseIf() {
        consume(TokenType.LPAREN, "Expected '(' after if");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')' after if condition");
        BlockStmt thenB = parseBody();

        BlockStmt elseB = null;
        if (match(TokenType.ELSE)) {
            // `else if` comes back as a block holding a single IfStmt
            elseB = parseBody();
        }
        return new IfStmt(cond, thenB, elseB);
    }

    private WhileStmt parseWhile() {
        consume(TokenType.LPAREN, "Expected '(' after while");
        Expr cond = parseExpr();
        consume(TokenType.RPAREN, "Expected ')' after while condition");
        BlockStmt body = parseBody();
        return new WhileStmt(cond, body);
    }

    private ForStmt parseFor() {
        consume(TokenType.LPAREN, "Expected '(' after for");

        Stmt init;
        if (peek().type().isTypeKeyword()) {
            init = parseDeclarator(parseType());
            if (check(TokenType.COMMA)) {
                throw unsupported("several declarations in a for-loop initializer", peek());
            }
        } else if (startsAssignment()) {
            init = parseAssignment();
        } else {
            throw error(peek(), "Expected for-loop initializer");
        }
        consume(TokenType.SEMICOLON, "Expected ';' after for-loop initializer");

        if (check(TokenType.SEMICOLON)) throw error(peek(), "Expected for-loop condition");
        Expr cond = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after for-loop condition");

        if (!startsAssignment()) throw error(peek(), "Expected for-loop increment");
        AssignStmt update = parseAssignment();
        consume(TokenType.RPAREN, "Expected ')' after for-loop clauses");

        BlockStmt body = parseBody();
        return new ForStmt(init, cond, update, body);
    }

    private ReturnStmt parseReturn() {
        if (match(TokenType.SEMICOLON)) {
            return new ReturnStmt(null);
        }
        Expr value = parseExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(value);
    }

    private CoutStmt parseCout() {
        consume(TokenType.SHL, "Expected '<<' after cout");
        List<CoutStmt.Item> items = new ArrayList<>();
        do {
            if (match(TokenType.ENDL)) items.add(new CoutStmt.Endl());
            else items.add(new CoutStmt.Print(parseExpr()));
        } while (match(TokenType.SHL));
        consume(TokenType.SEMICOLON, "Expected ';' after cout statement");
        return new CoutStmt(items);
    }

    private CinStmt parseCin() {
        consume(TokenType.SHR, "Expected '>>' after cin");
        Token name = consume(TokenType.IDENTIFIER, "Expected variable after '>>'");
        if (check(TokenType.SHR)) {
            throw unsupported("chained 'cin >>' extraction, use one statement per variable", peek());
        }
        consume(TokenType.SEMICOLON, "Expected ';' after cin statement");
        return new CinStmt(name.lexeme(), declared.get(name.lexeme()));
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() { return parseOr(); }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseCompare();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseAdd();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE, TokenType.EQ, TokenType.NEQ)) {
            Token op = previous();
            Expr r = parseAdd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) {
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary());
        }
        if (match(TokenType.MINUS)) {
            return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        if (match(TokenType.INT_LITERAL)) return new IntLiteral(intValue(previous()));
        if (match(TokenType.FLOAT_LITERAL)) return new FloatLiteral(previous().lexeme());
        if (match(TokenType.STRING_LITERAL)) {
            String quoted = previous().lexeme();
            return new StringLiteral(quoted.substring(1, quoted.length() - 1));
        }
        if (match(TokenType.CHAR_LITERAL)) {
            String quoted = previous().lexeme();
            return new CharLiteral(quoted.substring(1, quoted.length() - 1));
        }
        if (match(TokenType.TRUE)) return new BoolLiteral(true);
        if (match(TokenType.FALSE)) return new BoolLiteral(false);
        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (check(TokenType.LPAREN)) {
                throw unsupported("function call '" + name.lexeme() + "(...)'", name);
            }
            if (check(TokenType.INCREMENT) || check(TokenType.DECREMENT)) {
                throw unsupported("'" + peek().lexeme() + "' inside an expression", peek());
            }
            return new VarExpr(name.lexeme(), declared.get(name.lexeme()));
        }
        if (check(TokenType.INCREMENT) || check(TokenType.DECREMENT)) {
            throw unsupported("'" + peek().lexeme() + "' inside an expression", peek());
        }
        if (match(TokenType.LPAREN)) {
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        throw error(peek(), "Expected expression");
    }

    private long intValue(Token literal) {
        String text = literal.lexeme();
        try {
            // leading zero means octal, as in C++
            if (text.length() > 1 && text.charAt(0) == '0') return Long.parseLong(text.substring(1), 8);
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw error(literal, "Integer literal out of range");
        }
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        return checkAt(1, t);
    }

    private boolean checkAt(int offset, TokenType t) {
        if (pos + offset >= tokens.size()) return false;
        return tokens.get(pos + offset).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private TranslationException error(Token at, String msg) {
        return switch (at.type()) {
            case RESERVED -> unsupported("keyword '" + at.lexeme() + "'", at);
            case LBRACKET, RBRACKET -> unsupported("arrays", at);
            default -> new SyntaxException(msg, at);
        };
    }

    private static UnsupportedConstructException unsupported(String construct, Token at) {
        return new UnsupportedConstructException(construct, at.line(), at.column());
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS  -> BinaryExpr.Operator.ADD;
            case MINUS -> BinaryExpr.Operator.SUB;
            case STAR  -> BinaryExpr.Operator.MUL;
            case SLASH -> BinaryExpr.Operator.DIV;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            case AND -> BinaryExpr.Operator.AND;
            case OR  -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }
}
