package c2py.ast.stmt;

public sealed interface Stmt
        permits BlockStmt, VarDeclStmt, AssignStmt, IfStmt, WhileStmt, ForStmt,
        CoutStmt, CinStmt, ReturnStmt, ExprStmt {

    <R, P> R accept(StmtVisitor<R, P> visitor, P param);
}
