package c2py.ast.expr;

import c2py.types.VarType;

public record BoolLiteral(boolean value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitBoolLiteral(this); }

    @Override
    public VarType staticType() { return VarType.BOOL; }
}
