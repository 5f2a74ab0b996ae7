package c2py.types;

/**
 * Declared type of a variable. Only used to pick literal defaults and
 * conversions in the generated Python, never for checking.
 */
public enum VarType {
    INT("0", "int(input())"),
    FLOAT("0.0", "float(input())"),
    BOOL("False", "bool(int(input()))"),
    // a one-character Python str
    CHAR("\"\"", "input()"),
    STRING("\"\"", "input()");

    private final String pythonDefault;
    private final String pythonInput;

    VarType(String pythonDefault, String pythonInput) {
        this.pythonDefault = pythonDefault;
        this.pythonInput = pythonInput;
    }

    /** Value a declaration without initializer is bound to. */
    public String pythonDefault() { return pythonDefault; }

    /** Expression reading one line of input converted to this type. */
    public String pythonInput() { return pythonInput; }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
