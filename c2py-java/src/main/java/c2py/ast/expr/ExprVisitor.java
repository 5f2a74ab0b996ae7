package c2py.ast.expr;

public interface ExprVisitor<R> {
    R visitIntLiteral(IntLiteral e);
    R visitFloatLiteral(FloatLiteral e);
    R visitStringLiteral(StringLiteral e);
    R visitCharLiteral(CharLiteral e);
    R visitBoolLiteral(BoolLiteral e);
    R visitVar(VarExpr e);
    R visitUnary(UnaryExpr e);
    R visitBinary(BinaryExpr e);
}
