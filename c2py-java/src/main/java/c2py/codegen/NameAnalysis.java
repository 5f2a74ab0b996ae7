package c2py.codegen;

import c2py.ast.expr.*;
import c2py.ast.stmt.*;

import java.util.HashSet;
import java.util.Set;

/** Which variables a statement writes and an expression reads. */
final class NameAnalysis {
    private NameAnalysis() {}

    static Set<String> assignedIn(Stmt s) {
        Set<String> names = new HashSet<>();
        s.accept(new AssignedNames(), names);
        return names;
    }

    static Set<String> referencedIn(Expr e) {
        Set<String> names = new HashSet<>();
        e.accept(new ReferencedNames(names));
        return names;
    }

    private static final class AssignedNames implements StmtVisitor<Void, Set<String>> {
        @Override
        public Void visitBlock(BlockStmt s, Set<String> names) {
            for (Stmt child : s.statements()) child.accept(this, names);
            return null;
        }

        @Override
        public Void visitVarDecl(VarDeclStmt s, Set<String> names) {
            // a redeclaration rebinds the same Python name
            names.add(s.name());
            return null;
        }

        @Override
        public Void visitAssign(AssignStmt s, Set<String> names) {
            names.add(s.target());
            return null;
        }

        @Override
        public Void visitIf(IfStmt s, Set<String> names) {
            s.thenBlock().accept(this, names);
            if (s.elseBlock() != null) s.elseBlock().accept(this, names);
            return null;
        }

        @Override
        public Void visitWhile(WhileStmt s, Set<String> names) {
            return s.body().accept(this, names);
        }

        @Override
        public Void visitFor(ForStmt s, Set<String> names) {
            s.init().accept(this, names);
            s.update().accept(this, names);
            return s.body().accept(this, names);
        }

        @Override
        public Void visitCout(CoutStmt s, Set<String> names) { return null; }

        @Override
        public Void visitCin(CinStmt s, Set<String> names) {
            names.add(s.target());
            return null;
        }

        @Override
        public Void visitReturn(ReturnStmt s, Set<String> names) { return null; }

        @Override
        public Void visitExpr(ExprStmt s, Set<String> names) { return null; }
    }

    private static final class ReferencedNames implements ExprVisitor<Void> {
        private final Set<String> names;

        ReferencedNames(Set<String> names) {
            this.names = names;
        }

        @Override public Void visitIntLiteral(IntLiteral e) { return null; }
        @Override public Void visitFloatLiteral(FloatLiteral e) { return null; }
        @Override public Void visitStringLiteral(StringLiteral e) { return null; }
        @Override public Void visitCharLiteral(CharLiteral e) { return null; }
        @Override public Void visitBoolLiteral(BoolLiteral e) { return null; }

        @Override
        public Void visitVar(VarExpr e) {
            names.add(e.name());
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpr e) {
            return e.expr().accept(this);
        }

        @Override
        public Void visitBinary(BinaryExpr e) {
            e.left().accept(this);
            return e.right().accept(this);
        }
    }
}
