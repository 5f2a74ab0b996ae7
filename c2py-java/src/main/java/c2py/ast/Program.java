package c2py.ast;

import c2py.ast.stmt.Stmt;

import java.util.List;

/**
 * Global declarations followed by the body of {@code main}, flattened,
 * in source order.
 */
public record Program(List<Stmt> statements) {
    public Program {
        statements = List.copyOf(statements);
    }
}
