package com.cellsafety.analysis.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Syntax tree of the cell language.
 *
 * Every node kind is a record implementing one of the sealed {@link Stmt} / {@link Expr}
 * interfaces, so consumers dispatch with {@code instanceof} patterns instead of a visitor.
 * Nodes are immutable; rewriting passes build new trees.
 */
public final class Ast {

    private Ast() {}

    public sealed interface Node {
        /** 1-based source line of the first token of this node. */
        int line();
    }

    public sealed interface Stmt extends Node {}

    public sealed interface Expr extends Node {}

    /** Load/store context of a name, attribute, subscript, list or tuple. */
    public enum ExprContext {
        LOAD("Load"),
        STORE("Store"),
        AUG_STORE("AugStore"),
        DEL("Del");

        private final String label;

        ExprContext(String label) { this.label = label; }

        /** Short name written into instrumented code, e.g. {@code Load}. */
        public String label() { return label; }
    }

    // -----------------------------------------------------------------------
    // Top level and helpers that are not statements themselves
    // -----------------------------------------------------------------------

    public record Module(List<Stmt> body) implements Node {
        @Override
        public int line() { return body.isEmpty() ? 1 : body.get(0).line(); }
    }

    public record ExceptHandler(int line, Expr type, String name, List<Stmt> body) implements Node {}

    public record WithItem(Expr contextExpr, Expr optionalVars) {}

    public record Alias(String name, String asName) {
        /** Name bound in the importing scope: the alias, or the first dotted component. */
        public String boundName() {
            if (asName != null) return asName;
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    public record Keyword(String arg, Expr value) {}

    public record Param(String name, Expr defaultValue) {}

    public record Arguments(List<Param> positional, Param vararg, List<Param> keywordOnly, Param kwarg) {

        public static Arguments empty() {
            return new Arguments(List.of(), null, List.of(), null);
        }

        /** Default-value expressions in declaration order. */
        public List<Expr> defaults() {
            List<Expr> result = new ArrayList<>();
            for (Param p : positional) if (p.defaultValue() != null) result.add(p.defaultValue());
            for (Param p : keywordOnly) if (p.defaultValue() != null) result.add(p.defaultValue());
            return result;
        }

        /** Every name bound by these parameters, including varargs. */
        public List<String> boundNames() {
            List<String> result = new ArrayList<>();
            for (Param p : positional) result.add(p.name());
            if (vararg != null) result.add(vararg.name());
            for (Param p : keywordOnly) result.add(p.name());
            if (kwarg != null) result.add(kwarg.name());
            return result;
        }
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    public record Assign(int line, List<Expr> targets, Expr value) implements Stmt {}

    public record AugAssign(int line, Expr target, String op, Expr value) implements Stmt {}

    public record ExprStmt(int line, Expr value) implements Stmt {}

    public record For(int line, Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse) implements Stmt {}

    public record While(int line, Expr test, List<Stmt> body, List<Stmt> orElse) implements Stmt {}

    public record If(int line, Expr test, List<Stmt> body, List<Stmt> orElse) implements Stmt {}

    public record With(int line, List<WithItem> items, List<Stmt> body) implements Stmt {}

    public record FunctionDef(int line, String name, Arguments args, List<Stmt> body, boolean async)
            implements Stmt {}

    public record ClassDef(int line, String name, List<Expr> bases, List<Keyword> keywords, List<Stmt> body)
            implements Stmt {}

    public record Return(int line, Expr value) implements Stmt {
        public Optional<Expr> valueIfPresent() { return Optional.ofNullable(value); }
    }

    public record Try(int line, List<Stmt> body, List<ExceptHandler> handlers,
                      List<Stmt> orElse, List<Stmt> finalBody) implements Stmt {}

    public record Raise(int line, Expr exc) implements Stmt {}

    /** {@code import a.b as c} when {@code module} is null, {@code from module import ...} otherwise. */
    public record Import(int line, String module, List<Alias> names) implements Stmt {}

    public record Pass(int line) implements Stmt {}

    public record Break(int line) implements Stmt {}

    public record Continue(int line) implements Stmt {}

    /** Synthetic position marker placed before each original statement during instrumentation. */
    public record Marker(int line, SiteId site) implements Stmt {}

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    public record Name(int line, String id, ExprContext ctx) implements Expr {}

    /** Literal; value is a String, Long, Double, Boolean, an ExprContext, or null for None. */
    public record Constant(int line, Object value) implements Expr {}

    public record Attribute(int line, Expr value, String attr, ExprContext ctx) implements Expr {}

    public record Subscript(int line, Expr value, Slice slice, ExprContext ctx) implements Expr {}

    public sealed interface Slice {}

    public record Index(Expr value) implements Slice {}

    public record Range(Expr lower, Expr upper, Expr step) implements Slice {}

    public record Extended(List<Slice> dims) implements Slice {}

    public record Call(int line, Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {}

    public record Starred(int line, Expr value, ExprContext ctx) implements Expr {}

    public record BinOp(int line, Expr left, String op, Expr right) implements Expr {}

    public record UnaryOp(int line, String op, Expr operand) implements Expr {}

    public record BoolOp(int line, String op, List<Expr> values) implements Expr {}

    public record Compare(int line, Expr left, List<String> ops, List<Expr> comparators) implements Expr {}

    public record ListExpr(int line, List<Expr> elts, ExprContext ctx) implements Expr {}

    public record TupleExpr(int line, List<Expr> elts, ExprContext ctx) implements Expr {}

    public record SetExpr(int line, List<Expr> elts) implements Expr {}

    public record DictExpr(int line, List<Expr> keys, List<Expr> values) implements Expr {}

    public record Lambda(int line, Arguments args, Expr body) implements Expr {}

    public record IfExp(int line, Expr test, Expr body, Expr orElse) implements Expr {}

    /**
     * Synthetic call into the tracing runtime handle passed to the executing host.
     * Evaluates its arguments left to right and returns whatever the hook returns: the first
     * argument, or for {@code KEY} the subscript key most recently passed to {@code begin}.
     */
    public record TracerCall(int line, Hook hook, List<Expr> args) implements Expr {

        public enum Hook {
            BEGIN("begin"),
            END("end"),
            RECORD_ARGUMENT("recordArgument"),
            KEY("key");

            private final String methodName;

            Hook(String methodName) { this.methodName = methodName; }

            public String methodName() { return methodName; }
        }
    }
}
