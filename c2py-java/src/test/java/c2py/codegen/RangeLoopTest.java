package c2py.codegen;

import c2py.ast.expr.BinaryExpr;
import c2py.ast.expr.FloatLiteral;
import c2py.ast.expr.IntLiteral;
import c2py.ast.expr.VarExpr;
import c2py.ast.stmt.AssignStmt;
import c2py.ast.stmt.BlockStmt;
import c2py.ast.stmt.CinStmt;
import c2py.ast.stmt.ForStmt;
import c2py.ast.stmt.Stmt;
import c2py.ast.stmt.VarDeclStmt;
import c2py.types.VarType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RangeLoopTest {

    private static final VarExpr I = new VarExpr("i", VarType.INT);

    private static ForStmt loop(BinaryExpr.Operator cmp, Object bound, AssignStmt update, Stmt... body) {
        var right = bound instanceof Long n ? new IntLiteral(n) : new VarExpr((String) bound, VarType.INT);
        return new ForStmt(
                new VarDeclStmt("i", VarType.INT, new IntLiteral(0)),
                new BinaryExpr(I, cmp, right),
                update,
                new BlockStmt(List.of(body)));
    }

    private static AssignStmt inc(long k) {
        return new AssignStmt("i", AssignStmt.Op.ADD, new IntLiteral(k), VarType.INT);
    }

    @Test
    void matches_literal_prefix_step() {
        var update = new AssignStmt("i", AssignStmt.Op.SET,
                new BinaryExpr(new IntLiteral(3), BinaryExpr.Operator.ADD, I), VarType.INT);
        var r = RangeLoop.match(loop(BinaryExpr.Operator.LT, 10L, update));
        assertNotNull(r);
        assertEquals(3, r.step());
        assertEquals(new IntLiteral(10), r.end());
    }

    @Test
    void inclusive_bound_is_folded_for_literals() {
        var r = RangeLoop.match(loop(BinaryExpr.Operator.LE, 3L, inc(1)));
        assertNotNull(r);
        assertEquals(new IntLiteral(4), r.end());
    }

    @Test
    void inclusive_bound_adds_one_for_variables() {
        var r = RangeLoop.match(loop(BinaryExpr.Operator.LE, "n", inc(1)));
        assertNotNull(r);
        assertEquals(new BinaryExpr(new VarExpr("n", VarType.INT), BinaryExpr.Operator.ADD, new IntLiteral(1)),
                r.end());
    }

    @Test
    void rejects_zero_step_and_not_equal_condition() {
        assertNull(RangeLoop.match(loop(BinaryExpr.Operator.LT, 3L, inc(0))));
        assertNull(RangeLoop.match(loop(BinaryExpr.Operator.NE, 3L, inc(1))));
    }

    @Test
    void rejects_body_reading_bound_from_input() {
        assertNull(RangeLoop.match(loop(BinaryExpr.Operator.LT, "n", inc(1), new CinStmt("n", VarType.INT))));
    }

    @Test
    void rejects_non_int_loop_variable() {
        var f = new ForStmt(
                new VarDeclStmt("x", VarType.FLOAT, new FloatLiteral("0.0")),
                new BinaryExpr(new VarExpr("x", VarType.FLOAT), BinaryExpr.Operator.LT, new IntLiteral(1)),
                new AssignStmt("x", AssignStmt.Op.ADD, new IntLiteral(1), VarType.FLOAT),
                new BlockStmt(List.of()));
        assertNull(RangeLoop.match(f));
    }

    @Test
    void rejects_update_of_other_variable() {
        var update = new AssignStmt("j", AssignStmt.Op.ADD, new IntLiteral(1), VarType.INT);
        assertNull(RangeLoop.match(loop(BinaryExpr.Operator.LT, 3L, update)));
    }
}
