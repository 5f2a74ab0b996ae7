package c2py.ast.stmt;

import c2py.ast.expr.Expr;

public record ForStmt(
        Stmt init, // VarDeclStmt or AssignStmt
        Expr condition,
        AssignStmt update,
        BlockStmt body
) implements Stmt {
    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitFor(this, param); }
}
