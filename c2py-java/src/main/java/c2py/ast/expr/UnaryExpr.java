package c2py.ast.expr;

import c2py.types.VarType;

public record UnaryExpr(
        Operator op,
        Expr expr
) implements Expr {
    public enum Operator {
        NEG, NOT
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitUnary(this); }

    @Override
    public VarType staticType() {
        if (op == Operator.NOT) return VarType.BOOL;
        VarType t = expr.staticType();
        return t == VarType.BOOL ? VarType.INT : t;
    }
}
