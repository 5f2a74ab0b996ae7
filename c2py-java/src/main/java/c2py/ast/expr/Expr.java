package c2py.ast.expr;

import c2py.types.VarType;

public sealed interface Expr
        permits IntLiteral, FloatLiteral, StringLiteral, CharLiteral, BoolLiteral,
        VarExpr, UnaryExpr, BinaryExpr {

    <R> R accept(ExprVisitor<R> visitor);

    /** Best-effort C++ type of the value, null when it cannot be known. */
    VarType staticType();
}
