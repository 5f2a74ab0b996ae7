package c2py.ast.stmt;

import c2py.ast.expr.Expr;
import c2py.types.VarType;

public record VarDeclStmt(
        String name,
        VarType type,
        Expr initializer // null when absent
) implements Stmt {
    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitVarDecl(this, param); }
}
