package c2py.ast.expr;

import c2py.types.VarType;

public record IntLiteral(long value) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitIntLiteral(this); }

    @Override
    public VarType staticType() { return VarType.INT; }
}
