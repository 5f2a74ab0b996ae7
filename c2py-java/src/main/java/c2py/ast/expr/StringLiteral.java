package c2py.ast.expr;

import c2py.types.VarType;

/** Text between the quotes, escapes left untouched. */
public record StringLiteral(String text) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitStringLiteral(this); }

    @Override
    public VarType staticType() { return VarType.STRING; }
}
