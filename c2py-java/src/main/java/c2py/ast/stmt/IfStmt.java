package c2py.ast.stmt;

import c2py.ast.expr.Expr;

public record IfStmt(
        Expr condition,
        BlockStmt thenBlock,
        BlockStmt elseBlock // null when absent
) implements Stmt {
    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitIf(this, param); }
}
