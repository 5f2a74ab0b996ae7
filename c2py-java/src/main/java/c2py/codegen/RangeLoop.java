package c2py.codegen;

import c2py.ast.expr.BinaryExpr;
import c2py.ast.expr.Expr;
import c2py.ast.expr.IntLiteral;
import c2py.ast.expr.VarExpr;
import c2py.ast.stmt.AssignStmt;
import c2py.ast.stmt.ForStmt;
import c2py.ast.stmt.VarDeclStmt;
import c2py.types.VarType;

import java.util.Set;

/**
 * A counted for-loop that {@code for v in range(start, end, step)} reproduces
 * exactly: the loop owns an int variable, steps it by a constant towards a
 * bound that the body cannot change, and the body never writes the variable.
 */
record RangeLoop(String variable, Expr start, Expr end, long step) {

    /** Returns null when the loop has to keep its while shape. */
    static RangeLoop match(ForStmt loop) {
        if (!(loop.init() instanceof VarDeclStmt decl)) return null;
        if (decl.type() != VarType.INT || decl.initializer() == null) return null;
        if (decl.initializer().staticType() != VarType.INT) return null;
        String v = decl.name();

        if (!(loop.condition() instanceof BinaryExpr cond)) return null;
        if (!(cond.left() instanceof VarExpr lhs) || !lhs.name().equals(v)) return null;
        if (cond.right().staticType() != VarType.INT) return null;

        Long step = stepOf(loop.update(), v);
        if (step == null || step == 0) return null;

        Set<String> written = NameAnalysis.assignedIn(loop.body());
        if (written.contains(v)) return null;
        Set<String> bound = NameAnalysis.referencedIn(cond.right());
        if (bound.contains(v)) return null;
        for (String name : bound) {
            if (written.contains(name)) return null;
        }

        Expr end = switch (cond.op()) {
            case LT -> step > 0 ? cond.right() : null;
            case LE -> step > 0 ? offset(cond.right(), 1) : null;
            case GT -> step < 0 ? cond.right() : null;
            case GE -> step < 0 ? offset(cond.right(), -1) : null;
            default -> null;
        };
        if (end == null) return null;
        return new RangeLoop(v, decl.initializer(), end, step);
    }

    private static Long stepOf(AssignStmt update, String v) {
        if (!update.target().equals(v)) return null;
        Expr value = update.value();
        switch (update.op()) {
            case ADD:
                return (value instanceof IntLiteral k) ? k.value() : null;
            case SUB:
                return (value instanceof IntLiteral k) ? -k.value() : null;
            case SET:
                if (!(value instanceof BinaryExpr b)) return null;
                if (isVar(b.left(), v) && b.right() instanceof IntLiteral k) {
                    if (b.op() == BinaryExpr.Operator.ADD) return k.value();
                    if (b.op() == BinaryExpr.Operator.SUB) return -k.value();
                }
                if (b.op() == BinaryExpr.Operator.ADD && b.left() instanceof IntLiteral k && isVar(b.right(), v)) {
                    return k.value();
                }
                return null;
            default:
                return null;
        }
    }

    private static boolean isVar(Expr e, String name) {
        return e instanceof VarExpr var && var.name().equals(name);
    }

    private static Expr offset(Expr e, long delta) {
        if (e instanceof IntLiteral k) return new IntLiteral(k.value() + delta);
        BinaryExpr.Operator op = delta > 0 ? BinaryExpr.Operator.ADD : BinaryExpr.Operator.SUB;
        return new BinaryExpr(e, op, new IntLiteral(Math.abs(delta)));
    }
}
