package c2py.ast.stmt;

import java.util.List;

public record BlockStmt(List<Stmt> statements) implements Stmt {
    public BlockStmt {
        statements = List.copyOf(statements);
    }

    @Override
    public <R, P> R accept(StmtVisitor<R, P> visitor, P param) { return visitor.visitBlock(this, param); }
}
