package c2py.ast.stmt;

import c2py.types.VarType;

public record CinStmt(
        String target,
        VarType type // null if the target was never declared
) implements Stmt {
    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitCin(this, param); }
}
