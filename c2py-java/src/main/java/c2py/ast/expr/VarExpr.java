package c2py.ast.expr;

import c2py.types.VarType;

public record VarExpr(
        String name,
        VarType type // null if never declared
) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitVar(this); }

    @Override
    public VarType staticType() { return type; }
}
