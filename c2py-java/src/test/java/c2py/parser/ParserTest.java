package c2py.parser;

import c2py.ast.Program;
import c2py.ast.expr.*;
import c2py.ast.stmt.*;
import c2py.error.SyntaxException;
import c2py.error.UnsupportedConstructException;
import c2py.lexer.Lexer;
import c2py.lexer.TokenType;
import c2py.types.VarType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Program parse(String src) {
        var tokens = new Lexer(src).tokenize();
        return new Parser(tokens).parseProgram();
    }

    private static List<Stmt> parseMain(String body) {
        return parse("int main() {\n" + body + "\n}").statements();
    }

    private static Expr assignedValue(String body) {
        var stmts = parseMain(body);
        return ((AssignStmt) stmts.get(stmts.size() - 1)).value();
    }

    private static VarExpr var(String name) {
        return new VarExpr(name, null);
    }

    @Test
    void parse_simple_declaration() {
        var stmts = parseMain("int a = 5;");
        assertEquals(List.of(new VarDeclStmt("a", VarType.INT, new IntLiteral(5))), stmts);
    }

    @Test
    void parse_globals_before_main_and_drops_preamble() {
        var p = parse("""
            #include <iostream>
            using namespace std;
            int g = 1;
            int main() {
                g = 2;
                return 0;
            }
            """);
        assertEquals(3, p.statements().size());
        assertEquals(new VarDeclStmt("g", VarType.INT, new IntLiteral(1)), p.statements().get(0));
        assertEquals(new AssignStmt("g", AssignStmt.Op.SET, new IntLiteral(2), VarType.INT), p.statements().get(1));
        assertEquals(new ReturnStmt(new IntLiteral(0)), p.statements().get(2));
    }

    @Test
    void parse_declaration_types() {
        var stmts = parseMain("float f; double d = 1.5; bool b = true; string s = \"hi\";");
        assertEquals(List.of(
                new VarDeclStmt("f", VarType.FLOAT, null),
                new VarDeclStmt("d", VarType.FLOAT, new FloatLiteral("1.5")),
                new VarDeclStmt("b", VarType.BOOL, new BoolLiteral(true)),
                new VarDeclStmt("s", VarType.STRING, new StringLiteral("hi"))
        ), stmts);
    }

    @Test
    void parse_multiple_declarators() {
        var stmts = parseMain("int a, b = 2;");
        assertEquals(List.of(
                new VarDeclStmt("a", VarType.INT, null),
                new VarDeclStmt("b", VarType.INT, new IntLiteral(2))
        ), stmts);
    }

    @Test
    void parse_duplicate_declarations_are_kept() {
        var stmts = parseMain("int a = 1; int a = 2;");
        assertEquals(2, stmts.size());
    }

    @Test
    void parse_declared_types_flow_into_references() {
        var stmts = parseMain("float x; x = x + 1;");
        var assign = (AssignStmt) stmts.get(1);
        assertEquals(VarType.FLOAT, assign.targetType());
        var sum = (BinaryExpr) assign.value();
        assertEquals(new VarExpr("x", VarType.FLOAT), sum.left());
        assertEquals(VarType.FLOAT, sum.staticType());
    }

    @Test
    void parse_precedence_mul_over_add_and_unary_minus() {
        var e = assignedValue("x = -1 + 2 * 3;");
        var expected = new BinaryExpr(
                new UnaryExpr(UnaryExpr.Operator.NEG, new IntLiteral(1)),
                BinaryExpr.Operator.ADD,
                new BinaryExpr(new IntLiteral(2), BinaryExpr.Operator.MUL, new IntLiteral(3)));
        assertEquals(expected, e);
    }

    @Test
    void parse_binary_operators_are_left_associative() {
        var e = assignedValue("x = a - b - c;");
        var expected = new BinaryExpr(
                new BinaryExpr(var("a"), BinaryExpr.Operator.SUB, var("b")),
                BinaryExpr.Operator.SUB,
                var("c"));
        assertEquals(expected, e);
    }

    @Test
    void parse_logical_tiers() {
        var e = (BinaryExpr) assignedValue("x = a || b && c;");
        assertEquals(BinaryExpr.Operator.OR, e.op());
        assertEquals(BinaryExpr.Operator.AND, ((BinaryExpr) e.right()).op());
    }

    @Test
    void parse_relational_operators_share_one_tier() {
        var e = (BinaryExpr) assignedValue("x = a < b == c;");
        assertEquals(BinaryExpr.Operator.EQ, e.op());
        assertEquals(BinaryExpr.Operator.LT, ((BinaryExpr) e.left()).op());
    }

    @Test
    void parse_parentheses_override_precedence() {
        var e = (BinaryExpr) assignedValue("x = (a + b) * c;");
        assertEquals(BinaryExpr.Operator.MUL, e.op());
        assertEquals(BinaryExpr.Operator.ADD, ((BinaryExpr) e.left()).op());
    }

    @Test
    void parse_not_binds_tighter_than_comparison() {
        var e = (BinaryExpr) assignedValue("x = !a == b;");
        assertEquals(BinaryExpr.Operator.EQ, e.op());
        assertEquals(new UnaryExpr(UnaryExpr.Operator.NOT, var("a")), e.left());
    }

    @Test
    void parse_char_declaration_and_input() {
        var stmts = parseMain("char c = 'x'; cin >> c;");
        assertEquals(new VarDeclStmt("c", VarType.CHAR, new CharLiteral("x")), stmts.get(0));
        assertEquals(new CinStmt("c", VarType.CHAR), stmts.get(1));
    }

    @Test
    void parse_exponent_float_literal() {
        assertEquals(List.of(new VarDeclStmt("d", VarType.FLOAT, new FloatLiteral("1.5e3"))),
                parseMain("double d = 1.5e3;"));
    }

    @Test
    void parse_octal_literal() {
        assertEquals(new IntLiteral(8), assignedValue("x = 010;"));
    }

    @Test
    void parse_if_else_with_cout() {
        var stmts = parseMain("""
            int a = 5;
            int b = 10;
            if (a < b) {
                cout << "x" << endl;
            } else {
                cout << "y" << endl;
            }
            """);
        var s = (IfStmt) stmts.get(2);
        assertEquals(new BinaryExpr(new VarExpr("a", VarType.INT), BinaryExpr.Operator.LT,
                new VarExpr("b", VarType.INT)), s.condition());
        var cout = (CoutStmt) s.thenBlock().statements().get(0);
        assertEquals(List.of(new CoutStmt.Print(new StringLiteral("x")), new CoutStmt.Endl()), cout.items());
        assertNotNull(s.elseBlock());
    }

    @Test
    void parse_else_if_chain() {
        var s = (IfStmt) parseMain("if (a) x = 1; else if (b) x = 2; else x = 3;").get(0);
        var elseIf = (IfStmt) s.elseBlock().statements().get(0);
        assertEquals(1, s.elseBlock().statements().size());
        assertEquals(var("b"), elseIf.condition());
        assertEquals(1, elseIf.elseBlock().statements().size());
    }

    @Test
    void parse_single_statement_bodies() {
        var s = (IfStmt) parseMain("if (a) x = 1;").get(0);
        assertEquals(List.of(new AssignStmt("x", AssignStmt.Op.SET, new IntLiteral(1), null)),
                s.thenBlock().statements());
        assertNull(s.elseBlock());

        var w = (WhileStmt) parseMain("while (a) a--;").get(0);
        assertEquals(new AssignStmt("a", AssignStmt.Op.SUB, new IntLiteral(1), null),
                w.body().statements().get(0));
    }

    @Test
    void parse_for_with_all_clauses() {
        var f = (ForStmt) parseMain("for (int i = 0; i < 3; i++) { }").get(0);
        var expected = new ForStmt(
                new VarDeclStmt("i", VarType.INT, new IntLiteral(0)),
                new BinaryExpr(new VarExpr("i", VarType.INT), BinaryExpr.Operator.LT, new IntLiteral(3)),
                new AssignStmt("i", AssignStmt.Op.ADD, new IntLiteral(1), VarType.INT),
                new BlockStmt(List.of()));
        assertEquals(expected, f);
    }

    @Test
    void parse_for_with_assignment_initializer() {
        var f = (ForStmt) parseMain("int i; for (i = 10; i >= 0; i -= 2) cout << i;").get(1);
        assertEquals(new AssignStmt("i", AssignStmt.Op.SET, new IntLiteral(10), VarType.INT), f.init());
        assertEquals(new AssignStmt("i", AssignStmt.Op.SUB, new IntLiteral(2), VarType.INT), f.update());
        assertEquals(1, f.body().statements().size());
    }

    @Test
    void parse_for_missing_clause_is_syntax_error() {
        var e1 = assertThrows(SyntaxException.class, () -> parseMain("for (; i < 3; i++) {}"));
        assertEquals("Expected for-loop initializer", e1.expected());
        var e2 = assertThrows(SyntaxException.class, () -> parseMain("for (i = 0; ; i++) {}"));
        assertEquals("Expected for-loop condition", e2.expected());
        var e3 = assertThrows(SyntaxException.class, () -> parseMain("for (i = 0; i < 3; ) {}"));
        assertEquals("Expected for-loop increment", e3.expected());
    }

    @Test
    void parse_increment_and_compound_assignment() {
        var stmts = parseMain("int x; x++; --x; x += 2; x *= 3; x /= 4;");
        assertEquals(List.of(
                new VarDeclStmt("x", VarType.INT, null),
                new AssignStmt("x", AssignStmt.Op.ADD, new IntLiteral(1), VarType.INT),
                new AssignStmt("x", AssignStmt.Op.SUB, new IntLiteral(1), VarType.INT),
                new AssignStmt("x", AssignStmt.Op.ADD, new IntLiteral(2), VarType.INT),
                new AssignStmt("x", AssignStmt.Op.MUL, new IntLiteral(3), VarType.INT),
                new AssignStmt("x", AssignStmt.Op.DIV, new IntLiteral(4), VarType.INT)
        ), stmts);
    }

    @Test
    void parse_cout_with_endl_in_the_middle() {
        var cout = (CoutStmt) parseMain("cout << a << endl << 1;").get(0);
        assertEquals(List.of(
                new CoutStmt.Print(var("a")),
                new CoutStmt.Endl(),
                new CoutStmt.Print(new IntLiteral(1))
        ), cout.items());
    }

    @Test
    void parse_cin_uses_declared_type() {
        var stmts = parseMain("int n; cin >> n; cin >> m;");
        assertEquals(new CinStmt("n", VarType.INT), stmts.get(1));
        assertEquals(new CinStmt("m", null), stmts.get(2));
    }

    @Test
    void parse_return_with_and_without_value() {
        var stmts = parseMain("return; return 1;");
        assertEquals(new ReturnStmt(null), stmts.get(0));
        assertEquals(new ReturnStmt(new IntLiteral(1)), stmts.get(1));
    }

    @Test
    void parse_empty_statement_and_nested_block() {
        var stmts = parseMain("; { int a = 1; }");
        assertEquals(new BlockStmt(List.of()), stmts.get(0));
        assertEquals(new BlockStmt(List.of(new VarDeclStmt("a", VarType.INT, new IntLiteral(1)))), stmts.get(1));
    }

    @Test
    void parse_ignores_whitespace_and_comments() {
        var compact = parse("int main(){int a=1;if(a<2){a=a+1;}else a=0;}");
        var spaced = parse("""
            // entry point
            int main ( )
            {
                int a = 1;   /* start */
                if (a < 2) {
                    a = a + 1;
                } else
                    a = 0;
            }
            """);
        assertEquals(compact, spaced);
    }

    // ---------- errors ----------

    @Test
    void parse_missing_semicolon_reports_position() {
        var e = assertThrows(SyntaxException.class, () -> parse("int main() { int x = 1 }"));
        assertEquals("Expected ';' after variable declaration", e.expected());
        assertEquals(TokenType.RBRACE, e.found().type());
        assertEquals(1, e.line());
        assertEquals(24, e.column());
        assertEquals("[1:24] Expected ';' after variable declaration (got RBRACE '}')", e.getMessage());
    }

    @Test
    void parse_requires_main() {
        assertThrows(SyntaxException.class, () -> parse("int g;"));
        assertThrows(SyntaxException.class, () -> parse("int main(int argc) {}"));
        assertThrows(SyntaxException.class, () -> parse("int main() {} int main() {}"));
    }

    @Test
    void parse_array_access_is_unsupported() {
        var e = assertThrows(UnsupportedConstructException.class, () -> parseMain("""
            for (i = 0; i < 3; i = i + 1) {
                arr[i] = i;
            }
            """));
        assertEquals("arrays", e.construct());
        assertThrows(UnsupportedConstructException.class, () -> parseMain("int arr[5];"));
    }

    @Test
    void parse_other_functions_are_unsupported() {
        var e = assertThrows(UnsupportedConstructException.class, () -> parse("""
            int square(int x) { return x * x; }
            int main() { return 0; }
            """));
        assertTrue(e.construct().contains("square"));
        assertEquals(1, e.line());

        assertThrows(UnsupportedConstructException.class, () -> parseMain("x = f(1);"));
        assertThrows(UnsupportedConstructException.class, () -> parse("void f() {}\nint main() {}"));
    }

    @Test
    void parse_reserved_keywords_are_unsupported() {
        var e = assertThrows(UnsupportedConstructException.class, () -> parse("class A {};\nint main() {}"));
        assertEquals("keyword 'class'", e.construct());
        assertThrows(UnsupportedConstructException.class, () -> parseMain("while (true) { break; }"));
    }

    @Test
    void parse_chained_cin_is_unsupported() {
        assertThrows(UnsupportedConstructException.class, () -> parseMain("int a, b; cin >> a >> b;"));
    }

    @Test
    void parse_increment_inside_expression_is_unsupported() {
        assertThrows(UnsupportedConstructException.class, () -> parseMain("y = x++ + 1;"));
        assertThrows(UnsupportedConstructException.class, () -> parseMain("y = ++x;"));
    }

    @Test
    void parse_other_namespaces_are_unsupported() {
        assertThrows(UnsupportedConstructException.class,
                () -> parse("using namespace boost;\nint main() {}"));
    }
}
