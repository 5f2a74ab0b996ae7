package c2py.ast.expr;

import c2py.types.VarType;

/** Keeps the source spelling; {@code 5.} and {@code .5} are legal. */
public record FloatLiteral(String text) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitFloatLiteral(this); }

    @Override
    public VarType staticType() { return VarType.FLOAT; }
}
