package c2py.ast.stmt;

import c2py.ast.expr.Expr;

public record ExprStmt(Expr expr) implements Stmt {
    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitExpr(this, param); }
}
