package c2py.types;

public final class TypeUtil {
    private TypeUtil() {}

    /** int and bool behave as integers in C++ arithmetic. */
    public static boolean isIntegral(VarType t) {
        return t == VarType.INT || t == VarType.BOOL;
    }

    public static VarType arithmeticResult(VarType a, VarType b) {
        if (a == null || b == null) return null;
        // C++ promotes char to int, a Python str does not add to numbers
        if (a == VarType.CHAR || b == VarType.CHAR) return null;
        if (a == VarType.STRING || b == VarType.STRING) {
            return (a == b) ? VarType.STRING : null;
        }
        return (a == VarType.FLOAT || b == VarType.FLOAT) ? VarType.FLOAT : VarType.INT;
    }

    /** Both operands known to be integral, so {@code /} truncates. */
    public static boolean isIntegerDivision(VarType a, VarType b) {
        return isIntegral(a) && isIntegral(b);
    }
}
