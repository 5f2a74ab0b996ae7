package c2py.ast.stmt;

import c2py.ast.expr.Expr;
import c2py.types.VarType;

/**
 * {@code x = e}, {@code x += e} and friends. {@code x++} and {@code --x}
 * arrive here as {@code x += 1} / {@code x -= 1}.
 */
public record AssignStmt(
        String target,
        Op op,
        Expr value,
        VarType targetType // null if the target was never declared
) implements Stmt {

    public enum Op {
        SET, ADD, SUB, MUL, DIV
    }

    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitAssign(this, param); }
}
