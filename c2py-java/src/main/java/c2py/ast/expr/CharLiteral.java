package c2py.ast.expr;

import c2py.types.VarType;

/** Text between the single quotes: one character or a backslash escape. */
public record CharLiteral(String text) implements Expr {
    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitCharLiteral(this); }

    @Override
    public VarType staticType() { return VarType.CHAR; }
}
