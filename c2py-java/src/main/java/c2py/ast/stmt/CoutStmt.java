package c2py.ast.stmt;

import c2py.ast.expr.Expr;

import java.util.List;

/** Operands of one {@code cout << a << b << endl} chain, in order. */
public record CoutStmt(List<Item> items) implements Stmt {
    public CoutStmt {
        items = List.copyOf(items);
    }

    public sealed interface Item permits Print, Endl {}

    public record Print(Expr value) implements Item {}

    public record Endl() implements Item {}

    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitCout(this, param); }
}
