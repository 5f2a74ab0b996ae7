package c2py.error;

/**
 * Input that is valid C++ but lies outside the translatable subset
 * (arrays, function calls, classes, most keywords, preprocessor macros).
 */
public class UnsupportedConstructException extends TranslationException {
    private final String construct;

    public UnsupportedConstructException(String construct, int line, int column) {
        super("Unsupported construct: " + construct, line, column);
        this.construct = construct;
    }

    public String construct() { return construct; }
}
