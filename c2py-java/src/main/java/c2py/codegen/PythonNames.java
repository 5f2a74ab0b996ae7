package c2py.codegen;

import java.util.Set;

/**
 * C++ identifiers that would be keywords in Python, or would shadow the
 * builtins the generated code calls, get a trailing underscore. So does any
 * such name already followed by underscores ({@code print_} becomes
 * {@code print__}), which keeps distinct C++ names distinct in Python.
 */
final class PythonNames {
    private PythonNames() {}

    private static final Set<String> RESERVED = Set.of(
            // keywords
            "False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except",
            "finally", "for", "from", "global", "if", "import", "in", "is",
            "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
            "while", "with", "yield",
            // builtins used by generated code
            "print", "input", "int", "float", "bool", "range", "SystemExit"
    );

    static String safe(String name) {
        int end = name.length();
        while (end > 0 && name.charAt(end - 1) == '_') end--;
        return RESERVED.contains(name.substring(0, end)) ? name + "_" : name;
    }
}
