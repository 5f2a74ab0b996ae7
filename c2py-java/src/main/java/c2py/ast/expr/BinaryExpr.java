package c2py.ast.expr;

import c2py.types.TypeUtil;
import c2py.types.VarType;

public record BinaryExpr(
        Expr left,
        Operator op,
        Expr right
) implements Expr {

    public enum Operator {
        ADD, SUB, MUL, DIV,
        EQ, NE, LT, GT, LE, GE,
        AND, OR;

        public boolean isComparison() {
            return switch (this) {
                case EQ, NE, LT, GT, LE, GE -> true;
                default -> false;
            };
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitBinary(this); }

    @Override
    public VarType staticType() {
        if (op.isComparison() || op == Operator.AND || op == Operator.OR) return VarType.BOOL;
        VarType result = TypeUtil.arithmeticResult(left.staticType(), right.staticType());
        // only + is defined on strings
        if (result == VarType.STRING && op != Operator.ADD) return null;
        return result;
    }
}
