package com.cellsafety.analysis.syntax;

import com.cellsafety.analysis.syntax.Ast.*;
import com.cellsafety.analysis.syntax.Ast.Module;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders syntax trees back to cell-language source.
 * Markers print as {@code __site__(cell, counter)} and tracer calls as {@code __tracer.<hook>(...)}.
 * Compound operands are always parenthesized, so the output is unambiguous rather than minimal.
 */
public final class SourcePrinter {

    public static final String TRACER_HANDLE = "__tracer";
    public static final String MARKER_FUNCTION = "__site__";

    private static final String INDENT = "    ";

    private SourcePrinter() {}

    public static String print(Node node) {
        StringBuilder sb = new StringBuilder();
        if (node instanceof Module m) {
            block(sb, m.body(), "");
        } else if (node instanceof Stmt s) {
            statement(sb, s, "");
        } else if (node instanceof Expr e) {
            sb.append(expr(e));
        } else if (node instanceof ExceptHandler h) {
            handler(sb, h, "");
        }
        return sb.toString();
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    private static void block(StringBuilder sb, List<Stmt> body, String indent) {
        for (Stmt s : body) {
            statement(sb, s, indent);
        }
    }

    private static void suite(StringBuilder sb, List<Stmt> body, String indent) {
        if (body.isEmpty()) {
            sb.append(indent).append(INDENT).append("pass\n");
        } else {
            block(sb, body, indent + INDENT);
        }
    }

    private static void statement(StringBuilder sb, Stmt stmt, String indent) {
        sb.append(indent);
        if (stmt instanceof Assign a) {
            for (Expr t : a.targets()) sb.append(expr(t)).append(" = ");
            sb.append(expr(a.value())).append('\n');
        } else if (stmt instanceof AugAssign a) {
            sb.append(expr(a.target())).append(' ').append(a.op()).append("= ").append(expr(a.value())).append('\n');
        } else if (stmt instanceof ExprStmt e) {
            sb.append(expr(e.value())).append('\n');
        } else if (stmt instanceof For f) {
            sb.append("for ").append(expr(f.target())).append(" in ").append(expr(f.iter())).append(":\n");
            suite(sb, f.body(), indent);
            elseBlock(sb, f.orElse(), indent);
        } else if (stmt instanceof While w) {
            sb.append("while ").append(expr(w.test())).append(":\n");
            suite(sb, w.body(), indent);
            elseBlock(sb, w.orElse(), indent);
        } else if (stmt instanceof If i) {
            sb.append("if ").append(expr(i.test())).append(":\n");
            suite(sb, i.body(), indent);
            elseBlock(sb, i.orElse(), indent);
        } else if (stmt instanceof With w) {
            sb.append("with ").append(w.items().stream()
                .map(it -> expr(it.contextExpr()) + (it.optionalVars() == null ? "" : " as " + expr(it.optionalVars())))
                .collect(Collectors.joining(", "))).append(":\n");
            suite(sb, w.body(), indent);
        } else if (stmt instanceof FunctionDef f) {
            sb.append(f.async() ? "async def " : "def ").append(f.name())
              .append('(').append(arguments(f.args())).append("):\n");
            suite(sb, f.body(), indent);
        } else if (stmt instanceof ClassDef c) {
            sb.append("class ").append(c.name());
            List<String> parts = new ArrayList<>();
            c.bases().forEach(b -> parts.add(expr(b)));
            c.keywords().forEach(k -> parts.add(keyword(k)));
            if (!parts.isEmpty()) sb.append('(').append(String.join(", ", parts)).append(')');
            sb.append(":\n");
            suite(sb, c.body(), indent);
        } else if (stmt instanceof Return r) {
            sb.append(r.value() == null ? "return" : "return " + expr(r.value())).append('\n');
        } else if (stmt instanceof Try t) {
            sb.append("try:\n");
            suite(sb, t.body(), indent);
            for (ExceptHandler h : t.handlers()) handler(sb, h, indent);
            elseBlock(sb, t.orElse(), indent);
            if (!t.finalBody().isEmpty()) {
                sb.append(indent).append("finally:\n");
                suite(sb, t.finalBody(), indent);
            }
        } else if (stmt instanceof Raise r) {
            sb.append(r.exc() == null ? "raise" : "raise " + expr(r.exc())).append('\n');
        } else if (stmt instanceof Import i) {
            String names = i.names().stream()
                .map(a -> a.asName() == null ? a.name() : a.name() + " as " + a.asName())
                .collect(Collectors.joining(", "));
            sb.append(i.module() == null ? "import " + names : "from " + i.module() + " import " + names).append('\n');
        } else if (stmt instanceof Pass) {
            sb.append("pass\n");
        } else if (stmt instanceof Break) {
            sb.append("break\n");
        } else if (stmt instanceof Continue) {
            sb.append("continue\n");
        } else if (stmt instanceof Marker m) {
            sb.append(MARKER_FUNCTION).append('(').append(m.site().cellNumber())
              .append(", ").append(m.site().counter()).append(")\n");
        }
    }

    private static void handler(StringBuilder sb, ExceptHandler h, String indent) {
        sb.append(indent).append("except");
        if (h.type() != null) sb.append(' ').append(expr(h.type()));
        if (h.name() != null) sb.append(" as ").append(h.name());
        sb.append(":\n");
        suite(sb, h.body(), indent);
    }

    private static void elseBlock(StringBuilder sb, List<Stmt> orElse, String indent) {
        if (orElse.isEmpty()) return;
        sb.append(indent).append("else:\n");
        suite(sb, orElse, indent);
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    static String expr(Expr e) {
        if (e instanceof Name n) {
            return n.id();
        } else if (e instanceof Constant c) {
            return constant(c.value());
        } else if (e instanceof Attribute a) {
            return primary(a.value()) + "." + a.attr();
        } else if (e instanceof Subscript s) {
            return primary(s.value()) + "[" + slice(s.slice()) + "]";
        } else if (e instanceof Call c) {
            List<String> parts = new ArrayList<>();
            c.args().forEach(a -> parts.add(expr(a)));
            c.keywords().forEach(k -> parts.add(keyword(k)));
            return primary(c.func()) + "(" + String.join(", ", parts) + ")";
        } else if (e instanceof Starred s) {
            return "*" + operand(s.value());
        } else if (e instanceof BinOp b) {
            return operand(b.left()) + " " + b.op() + " " + operand(b.right());
        } else if (e instanceof UnaryOp u) {
            return (u.op().equals("not") ? "not " : u.op()) + operand(u.operand());
        } else if (e instanceof BoolOp b) {
            return b.values().stream().map(SourcePrinter::operand).collect(Collectors.joining(" " + b.op() + " "));
        } else if (e instanceof Compare c) {
            StringBuilder sb = new StringBuilder(operand(c.left()));
            for (int i = 0; i < c.ops().size(); i++) {
                sb.append(' ').append(c.ops().get(i)).append(' ').append(operand(c.comparators().get(i)));
            }
            return sb.toString();
        } else if (e instanceof ListExpr l) {
            return "[" + join(l.elts()) + "]";
        } else if (e instanceof TupleExpr t) {
            return t.elts().size() == 1 ? "(" + expr(t.elts().get(0)) + ",)" : "(" + join(t.elts()) + ")";
        } else if (e instanceof SetExpr s) {
            return "{" + join(s.elts()) + "}";
        } else if (e instanceof DictExpr d) {
            List<String> parts = new ArrayList<>();
            for (int i = 0; i < d.keys().size(); i++) {
                parts.add(expr(d.keys().get(i)) + ": " + expr(d.values().get(i)));
            }
            return "{" + String.join(", ", parts) + "}";
        } else if (e instanceof Lambda l) {
            String params = arguments(l.args());
            return "lambda" + (params.isEmpty() ? "" : " " + params) + ": " + expr(l.body());
        } else if (e instanceof IfExp i) {
            return operand(i.body()) + " if " + operand(i.test()) + " else " + operand(i.orElse());
        } else if (e instanceof TracerCall t) {
            return TRACER_HANDLE + "." + t.hook().methodName() + "(" + join(t.args()) + ")";
        }
        throw new IllegalArgumentException("unknown expression " + e);
    }

    private static String join(List<Expr> exprs) {
        return exprs.stream().map(SourcePrinter::expr).collect(Collectors.joining(", "));
    }

    private static String keyword(Keyword k) {
        return k.arg() == null ? "**" + expr(k.value()) : k.arg() + "=" + expr(k.value());
    }

    private static String slice(Slice s) {
        if (s instanceof Index i) {
            return i.value() instanceof TupleExpr t && !t.elts().isEmpty() ? join(t.elts()) : expr(i.value());
        } else if (s instanceof Range r) {
            String text = opt(r.lower()) + ":" + opt(r.upper());
            return r.step() == null ? text : text + ":" + expr(r.step());
        } else if (s instanceof Extended x) {
            return x.dims().stream().map(SourcePrinter::slice).collect(Collectors.joining(", "));
        }
        throw new IllegalArgumentException("unknown slice " + s);
    }

    private static String opt(Expr e) {
        return e == null ? "" : expr(e);
    }

    private static String arguments(Arguments args) {
        List<String> parts = new ArrayList<>();
        for (Param p : args.positional()) parts.add(param(p));
        if (args.vararg() != null) {
            parts.add("*" + args.vararg().name());
        } else if (!args.keywordOnly().isEmpty()) {
            parts.add("*");
        }
        for (Param p : args.keywordOnly()) parts.add(param(p));
        if (args.kwarg() != null) parts.add("**" + args.kwarg().name());
        return String.join(", ", parts);
    }

    private static String param(Param p) {
        return p.defaultValue() == null ? p.name() : p.name() + "=" + expr(p.defaultValue());
    }

    /** Operand of an operator: anything that is not atomic gets parentheses. */
    private static String operand(Expr e) {
        boolean compound = e instanceof BinOp || e instanceof BoolOp || e instanceof Compare
            || e instanceof UnaryOp || e instanceof IfExp || e instanceof Lambda;
        return compound ? "(" + expr(e) + ")" : expr(e);
    }

    /** Receiver of an attribute, subscript or call. */
    private static String primary(Expr e) {
        boolean atomic = e instanceof Name || e instanceof Attribute || e instanceof Subscript
            || e instanceof Call || e instanceof TracerCall || e instanceof ListExpr
            || e instanceof DictExpr || e instanceof SetExpr || e instanceof TupleExpr
            || (e instanceof Constant c && c.value() instanceof String);
        return atomic ? expr(e) : "(" + expr(e) + ")";
    }

    private static String constant(Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean b) return b ? "True" : "False";
        if (value instanceof Ast.ExprContext ctx) return "'" + ctx.label() + "'";
        if (value instanceof String s) {
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'").replace("\n", "\\n").replace("\t", "\\t") + "'";
        }
        return String.valueOf(value);
    }
}
