package c2py.codegen;

import c2py.ast.expr.*;
import c2py.types.TypeUtil;
import c2py.types.VarType;

/**
 * Renders expressions as Python with the fewest parentheses that keep the
 * C++ grouping. Python's precedence differs from C++ for {@code not}
 * (below comparisons) and chains comparisons, both handled here.
 */
final class ExpressionRenderer implements ExprVisitor<ExpressionRenderer.Fragment> {

    // Python binding strength, loosest first
    static final int PREC_OR = 1;
    static final int PREC_AND = 2;
    static final int PREC_NOT = 3;
    static final int PREC_COMPARE = 4;
    static final int PREC_ADD = 5;
    static final int PREC_MUL = 6;
    static final int PREC_NEG = 7;
    static final int PREC_ATOM = 8;

    record Fragment(String text, int precedence) {}

    String render(Expr e) {
        return e.accept(this).text();
    }

    /**
     * Renders {@code value} for storage into a variable declared as {@code target},
     * reproducing the implicit C++ conversion.
     */
    String coerce(Expr value, VarType target) {
        VarType source = value.staticType();
        String text = render(value);
        if (target == null || source == null || target == source) return text;

        return switch (target) {
            case FLOAT -> {
                if (value instanceof IntLiteral literal) yield literal.value() + ".0";
                yield TypeUtil.isIntegral(source) ? "float(" + text + ")" : text;
            }
            case INT -> (source == VarType.FLOAT || source == VarType.BOOL) ? "int(" + text + ")" : text;
            case BOOL -> source.isNumeric() ? "bool(" + text + ")" : text;
            case CHAR, STRING -> text;
        };
    }

    /** cout prints bools as 1/0. */
    String printable(Expr value) {
        String text = render(value);
        return value.staticType() == VarType.BOOL ? "int(" + text + ")" : text;
    }

    @Override
    public Fragment visitIntLiteral(IntLiteral e) {
        return new Fragment(Long.toString(e.value()), e.value() < 0 ? PREC_NEG : PREC_ATOM);
    }

    @Override
    public Fragment visitFloatLiteral(FloatLiteral e) {
        String text = e.text();
        if (text.startsWith(".")) text = "0" + text;
        if (text.endsWith(".")) text = text + "0";
        return new Fragment(text, PREC_ATOM);
    }

    @Override
    public Fragment visitStringLiteral(StringLiteral e) {
        return new Fragment("\"" + e.text() + "\"", PREC_ATOM);
    }

    @Override
    public Fragment visitCharLiteral(CharLiteral e) {
        // C++ and Python spell a one-character literal the same way
        return new Fragment("'" + e.text() + "'", PREC_ATOM);
    }

    @Override
    public Fragment visitBoolLiteral(BoolLiteral e) {
        return new Fragment(e.value() ? "True" : "False", PREC_ATOM);
    }

    @Override
    public Fragment visitVar(VarExpr e) {
        return new Fragment(PythonNames.safe(e.name()), PREC_ATOM);
    }

    @Override
    public Fragment visitUnary(UnaryExpr e) {
        Fragment operand = e.expr().accept(this);
        return switch (e.op()) {
            case NEG -> new Fragment("-" + wrapIf(operand, operand.precedence() <= PREC_NEG), PREC_NEG);
            case NOT -> new Fragment("not " + wrapIf(operand, operand.precedence() < PREC_NEG), PREC_NOT);
        };
    }

    @Override
    public Fragment visitBinary(BinaryExpr e) {
        Fragment left = e.left().accept(this);
        Fragment right = e.right().accept(this);

        if (e.op() == BinaryExpr.Operator.DIV
                && TypeUtil.isIntegerDivision(e.left().staticType(), e.right().staticType())) {
            // C++ integer division truncates toward zero, Python's // floors
            String text = "int(" + wrapIf(left, left.precedence() < PREC_MUL)
                    + " / " + wrapIf(right, right.precedence() <= PREC_MUL) + ")";
            return new Fragment(text, PREC_ATOM);
        }

        if (e.op() == BinaryExpr.Operator.AND || e.op() == BinaryExpr.Operator.OR) {
            // Python's and/or yield an operand, C++ always yields a bool
            left = truthValue(left, e.left());
            right = truthValue(right, e.right());
        }

        int prec = precedence(e.op());
        boolean wrapLeft = left.precedence() < prec
                || (prec == PREC_COMPARE && left.precedence() == PREC_COMPARE);
        boolean wrapRight = right.precedence() <= prec;
        String text = wrapIf(left, wrapLeft) + " " + symbol(e.op()) + " " + wrapIf(right, wrapRight);
        return new Fragment(text, prec);
    }

    private static Fragment truthValue(Fragment f, Expr operand) {
        if (operand.staticType() == VarType.BOOL) return f;
        return new Fragment("bool(" + f.text() + ")", PREC_ATOM);
    }

    private static String wrapIf(Fragment f, boolean wrap) {
        return wrap ? "(" + f.text() + ")" : f.text();
    }

    private static int precedence(BinaryExpr.Operator op) {
        return switch (op) {
            case OR -> PREC_OR;
            case AND -> PREC_AND;
            case EQ, NE, LT, GT, LE, GE -> PREC_COMPARE;
            case ADD, SUB -> PREC_ADD;
            case MUL, DIV -> PREC_MUL;
        };
    }

    private static String symbol(BinaryExpr.Operator op) {
        return switch (op) {
            case ADD -> "+";
            case SUB -> "-";
            case MUL -> "*";
            case DIV -> "/";
            case EQ -> "==";
            case NE -> "!=";
            case LT -> "<";
            case GT -> ">";
            case LE -> "<=";
            case GE -> ">=";
            case AND -> "and";
            case OR -> "or";
        };
    }
}
