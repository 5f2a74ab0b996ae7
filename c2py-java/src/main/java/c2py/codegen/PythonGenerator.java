package c2py.codegen;

import c2py.ast.Program;
import c2py.ast.expr.BinaryExpr;
import c2py.ast.expr.Expr;
import c2py.ast.expr.IntLiteral;
import c2py.ast.expr.VarExpr;
import c2py.ast.stmt.*;
import c2py.types.VarType;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a parsed program as Python 3 source.
 *
 * <p>Every statement renders to complete lines, each ending in a newline,
 * indented by the depth it is given; concatenating siblings in order is
 * always a valid suite. The generator keeps no state between calls.
 */
public final class PythonGenerator implements StmtVisitor<String, Integer> {
    public static final String HEADER = "# Translated from C++ by c2py\n";
    private static final String INDENT = "    ";

    private final ExpressionRenderer exprs = new ExpressionRenderer();

    public String generate(Program program) {
        List<Stmt> stmts = program.statements();
        // main's final return 0 is just the end of the script
        if (!stmts.isEmpty() && stmts.get(stmts.size() - 1) instanceof ReturnStmt last && exitsCleanly(last)) {
            stmts = stmts.subList(0, stmts.size() - 1);
        }

        StringBuilder sb = new StringBuilder(HEADER);
        for (Stmt s : stmts) {
            sb.append(render(s, 0));
        }
        return sb.toString();
    }

    public String render(Stmt stmt, int depth) {
        return stmt.accept(this, depth);
    }

    // ---------- statements ----------

    @Override
    public String visitBlock(BlockStmt s, Integer depth) {
        // a nested { } has no Python counterpart, its statements join the enclosing suite
        return statements(s.statements(), depth);
    }

    @Override
    public String visitVarDecl(VarDeclStmt s, Integer depth) {
        String value = s.initializer() == null
                ? s.type().pythonDefault()
                : exprs.coerce(s.initializer(), s.type());
        return line(depth, PythonNames.safe(s.name()) + " = " + value);
    }

    @Override
    public String visitAssign(AssignStmt s, Integer depth) {
        String target = PythonNames.safe(s.target());
        if (s.op() == AssignStmt.Op.SET) {
            return line(depth, target + " = " + exprs.coerce(s.value(), s.targetType()));
        }

        BinaryExpr.Operator op = switch (s.op()) {
            case ADD -> BinaryExpr.Operator.ADD;
            case SUB -> BinaryExpr.Operator.SUB;
            case MUL -> BinaryExpr.Operator.MUL;
            case DIV -> BinaryExpr.Operator.DIV;
            case SET -> throw new IllegalStateException("plain assignment handled above");
        };
        // an int target must stay int: x /= 2 or x += 0.5 become x = int(...)
        if (s.targetType() == VarType.INT
                && (op == BinaryExpr.Operator.DIV || s.value().staticType() == VarType.FLOAT)) {
            Expr expanded = new BinaryExpr(new VarExpr(s.target(), s.targetType()), op, s.value());
            return line(depth, target + " = " + exprs.coerce(expanded, VarType.INT));
        }
        return line(depth, target + " " + symbol(s.op()) + " " + exprs.render(s.value()));
    }

    @Override
    public String visitIf(IfStmt s, Integer depth) {
        StringBuilder sb = new StringBuilder();
        sb.append(line(depth, "if " + exprs.render(s.condition()) + ":"));
        sb.append(suite(s.thenBlock(), depth + 1));

        BlockStmt otherwise = s.elseBlock();
        while (otherwise != null) {
            List<Stmt> inner = otherwise.statements();
            if (inner.size() == 1 && inner.get(0) instanceof IfStmt nested) {
                sb.append(line(depth, "elif " + exprs.render(nested.condition()) + ":"));
                sb.append(suite(nested.thenBlock(), depth + 1));
                otherwise = nested.elseBlock();
            } else {
                sb.append(line(depth, "else:"));
                sb.append(suite(otherwise, depth + 1));
                otherwise = null;
            }
        }
        return sb.toString();
    }

    @Override
    public String visitWhile(WhileStmt s, Integer depth) {
        return line(depth, "while " + exprs.render(s.condition()) + ":")
                + suite(s.body(), depth + 1);
    }

    @Override
    public String visitFor(ForStmt s, Integer depth) {
        RangeLoop range = RangeLoop.match(s);
        if (range != null) {
            List<String> args = new ArrayList<>();
            args.add(exprs.render(range.start()));
            args.add(exprs.render(range.end()));
            if (range.step() != 1) args.add(Long.toString(range.step()));
            return line(depth, "for " + PythonNames.safe(range.variable())
                    + " in range(" + String.join(", ", args) + "):")
                    + suite(s.body(), depth + 1);
        }

        // init; while cond: body; update
        return render(s.init(), depth)
                + line(depth, "while " + exprs.render(s.condition()) + ":")
                + statements(s.body().statements(), depth + 1)
                + render(s.update(), depth + 1);
    }

    @Override
    public String visitCout(CoutStmt s, Integer depth) {
        List<CoutStmt.Item> items = s.items();
        boolean trailingEndl = items.get(items.size() - 1) instanceof CoutStmt.Endl;
        int printed = trailingEndl ? items.size() - 1 : items.size();

        List<String> args = new ArrayList<>();
        for (CoutStmt.Item item : items.subList(0, printed)) {
            if (item instanceof CoutStmt.Print p) args.add(exprs.printable(p.value()));
            else args.add("\"\\n\"");
        }
        if (args.size() > 1) args.add("sep=\"\"");
        if (!trailingEndl) args.add("end=\"\"");
        return line(depth, "print(" + String.join(", ", args) + ")");
    }

    @Override
    public String visitCin(CinStmt s, Integer depth) {
        String read = s.type() == null ? "input()" : s.type().pythonInput();
        return line(depth, PythonNames.safe(s.target()) + " = " + read);
    }

    @Override
    public String visitReturn(ReturnStmt s, Integer depth) {
        String code = s.value() == null ? "" : exprs.render(s.value());
        return line(depth, "raise SystemExit(" + code + ")");
    }

    @Override
    public String visitExpr(ExprStmt s, Integer depth) {
        return line(depth, exprs.render(s.expr()));
    }

    // ---------- helpers ----------

    private static boolean exitsCleanly(ReturnStmt s) {
        return s.value() == null || (s.value() instanceof IntLiteral code && code.value() == 0);
    }

    private String statements(List<Stmt> stmts, int depth) {
        StringBuilder sb = new StringBuilder();
        for (Stmt s : stmts) {
            sb.append(render(s, depth));
        }
        return sb.toString();
    }

    /** Indented body of a compound statement; Python needs at least one line. */
    private String suite(BlockStmt block, int depth) {
        String body = statements(block.statements(), depth);
        return body.isEmpty() ? line(depth, "pass") : body;
    }

    private static String line(int depth, String text) {
        return INDENT.repeat(depth) + text + "\n";
    }

    private static String symbol(AssignStmt.Op op) {
        return switch (op) {
            case SET -> "=";
            case ADD -> "+=";
            case SUB -> "-=";
            case MUL -> "*=";
            case DIV -> "/=";
        };
    }
}
