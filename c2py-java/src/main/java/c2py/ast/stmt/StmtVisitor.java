package c2py.ast.stmt;

/**
 * One method per statement kind; {@code P} is whatever the pass threads
 * through the walk (indentation depth, an accumulator, ...).
 */
public interface StmtVisitor<R, P> {
    R visitBlock(BlockStmt s, P param);
    R visitVarDecl(VarDeclStmt s, P param);
    R visitAssign(AssignStmt s, P param);
    R visitIf(IfStmt s, P param);
    R visitWhile(WhileStmt s, P param);
    R visitFor(ForStmt s, P param);
    R visitCout(CoutStmt s, P param);
    R visitCin(CinStmt s, P param);
    R visitReturn(ReturnStmt s, P param);
    R visitExpr(ExprStmt s, P param);
}
