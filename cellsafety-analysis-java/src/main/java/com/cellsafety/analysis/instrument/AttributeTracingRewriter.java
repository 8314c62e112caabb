package com.cellsafety.analysis.instrument;

import com.cellsafety.analysis.syntax.Ast.*;
import com.cellsafety.analysis.syntax.Ast.Module;
import com.cellsafety.analysis.syntax.Ast.TracerCall.Hook;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Rewrites attribute, subscript and method-call expressions into calls on the tracing handle.
 *
 * {@code a.b} becomes {@code end(begin(a, 'b', False, 'Load', False, True).b)}. In a chain such as
 * {@code a.b.c} every link gets a {@code begin} but only the outermost one is wrapped in
 * {@code end}. {@code d[k]} becomes {@code end(begin(d, k, True, 'Load', False, True)[key()])} so that
 * {@code k} is evaluated only once. For {@code obj.method(x, y + 1)} the callee is traced in call position and bare
 * identifier arguments go through {@code recordArgument}, so a mutation can be attributed to them.
 *
 * One rewriter instance handles one cell; it is not thread-safe.
 */
public class AttributeTracingRewriter {

    private final boolean traceSubscripts;
    private boolean insideLoadChain = false;

    public AttributeTracingRewriter(boolean traceSubscripts) {
        this.traceSubscripts = traceSubscripts;
    }

    public Module rewrite(Module module) {
        return new Module(statements(module.body()));
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    private List<Stmt> statements(List<Stmt> body) {
        return map(body, this::statement);
    }

    private Stmt statement(Stmt stmt) {
        if (stmt instanceof Assign a) {
            return new Assign(a.line(), exprs(a.targets()), expr(a.value()));
        } else if (stmt instanceof AugAssign a) {
            return new AugAssign(a.line(), expr(a.target()), a.op(), expr(a.value()));
        } else if (stmt instanceof ExprStmt e) {
            return new ExprStmt(e.line(), expr(e.value()));
        } else if (stmt instanceof For f) {
            return new For(f.line(), expr(f.target()), expr(f.iter()), statements(f.body()), statements(f.orElse()));
        } else if (stmt instanceof While w) {
            return new While(w.line(), expr(w.test()), statements(w.body()), statements(w.orElse()));
        } else if (stmt instanceof If i) {
            return new If(i.line(), expr(i.test()), statements(i.body()), statements(i.orElse()));
        } else if (stmt instanceof With w) {
            List<WithItem> items = map(w.items(),
                it -> new WithItem(expr(it.contextExpr()), nullableExpr(it.optionalVars())));
            return new With(w.line(), items, statements(w.body()));
        } else if (stmt instanceof FunctionDef f) {
            return new FunctionDef(f.line(), f.name(), arguments(f.args()), statements(f.body()), f.async());
        } else if (stmt instanceof ClassDef c) {
            return new ClassDef(c.line(), c.name(), exprs(c.bases()), keywords(c.keywords()), statements(c.body()));
        } else if (stmt instanceof Return r) {
            return new Return(r.line(), nullableExpr(r.value()));
        } else if (stmt instanceof Raise r) {
            return new Raise(r.line(), nullableExpr(r.exc()));
        } else if (stmt instanceof Try t) {
            List<ExceptHandler> handlers = map(t.handlers(),
                h -> new ExceptHandler(h.line(), nullableExpr(h.type()), h.name(), statements(h.body())));
            return new Try(t.line(), statements(t.body()), handlers, statements(t.orElse()), statements(t.finalBody()));
        }
        // markers, imports, pass/break/continue contain no expressions
        return stmt;
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    private Expr expr(Expr e) {
        if (e instanceof Attribute a) {
            return attributeOrSubscript(a, false);
        } else if (e instanceof Subscript s) {
            if (!traceSubscripts) {
                return new Subscript(s.line(), expr(s.value()), s.slice(), s.ctx());
            }
            return attributeOrSubscript(s, false);
        } else if (e instanceof Call c) {
            return call(c);
        } else if (e instanceof Starred s) {
            return new Starred(s.line(), expr(s.value()), s.ctx());
        } else if (e instanceof BinOp b) {
            return new BinOp(b.line(), expr(b.left()), b.op(), expr(b.right()));
        } else if (e instanceof UnaryOp u) {
            return new UnaryOp(u.line(), u.op(), expr(u.operand()));
        } else if (e instanceof BoolOp b) {
            return new BoolOp(b.line(), b.op(), exprs(b.values()));
        } else if (e instanceof Compare c) {
            return new Compare(c.line(), expr(c.left()), c.ops(), exprs(c.comparators()));
        } else if (e instanceof ListExpr l) {
            return new ListExpr(l.line(), exprs(l.elts()), l.ctx());
        } else if (e instanceof TupleExpr t) {
            return new TupleExpr(t.line(), exprs(t.elts()), t.ctx());
        } else if (e instanceof SetExpr s) {
            return new SetExpr(s.line(), exprs(s.elts()));
        } else if (e instanceof DictExpr d) {
            return new DictExpr(d.line(), exprs(d.keys()), exprs(d.values()));
        } else if (e instanceof Lambda l) {
            return new Lambda(l.line(), arguments(l.args()), expr(l.body()));
        } else if (e instanceof IfExp i) {
            return new IfExp(i.line(), expr(i.test()), expr(i.body()), expr(i.orElse()));
        }
        // names, constants and already-instrumented calls stay as they are
        return e;
    }

    private Expr attributeOrSubscript(Expr node, boolean callContext) {
        final ExprContext ctx;
        final Expr value;
        final Expr key;
        final boolean isSubscript;
        if (node instanceof Subscript s) {
            ctx = s.ctx();
            value = s.value();
            key = subscriptKey(s);
            isSubscript = true;
        } else {
            Attribute a = (Attribute) node;
            ctx = a.ctx();
            value = a.value();
            key = new Constant(a.line(), a.attr());
            isSubscript = false;
        }
        int line = node.line();
        boolean makeActive = ctx == ExprContext.LOAD || insideLoadChain;

        boolean saved = insideLoadChain;
        insideLoadChain = makeActive;
        Expr tracedValue;
        try {
            tracedValue = expr(value);
        } finally {
            insideLoadChain = saved;
        }

        Expr begin = new TracerCall(line, Hook.BEGIN, List.of(
            tracedValue,
            key,
            new Constant(line, isSubscript),
            new Constant(line, ctx),
            new Constant(line, callContext),
            new Constant(line, makeActive)));

        // the index is evaluated once, as the key argument of begin
        Expr replaced = isSubscript
            ? new Subscript(line, begin, new Index(new TracerCall(line, Hook.KEY, List.of())), ctx)
            : new Attribute(line, begin, ((Attribute) node).attr(), ctx);
        if (!insideLoadChain && makeActive) {
            return new TracerCall(line, Hook.END, List.of(replaced));
        }
        return replaced;
    }

    private Expr subscriptKey(Subscript s) {
        if (s.slice() instanceof Index i) {
            return i.value();
        }
        throw new InstrumentationException(
            "unsupported subscript form: " + s.slice().getClass().getSimpleName().toLowerCase() + " slice", s.line());
    }

    private Expr call(Call c) {
        if (!(c.func() instanceof Attribute callee)) {
            Expr func = expr(c.func());
            return withoutChain(() -> new Call(c.line(), func, exprs(c.args()), keywords(c.keywords())));
        }

        Expr func;
        boolean saved = insideLoadChain;
        insideLoadChain = true;
        try {
            func = attributeOrSubscript(callee, true);
        } finally {
            insideLoadChain = saved;
        }

        List<Expr> args = new ArrayList<>(c.args().size());
        for (Expr arg : c.args()) {
            if (arg instanceof Name n) {
                args.add(new TracerCall(n.line(), Hook.RECORD_ARGUMENT, List.of(n, new Constant(n.line(), n.id()))));
            } else {
                args.add(withoutChain(() -> expr(arg)));
            }
        }
        List<Keyword> kws = withoutChain(() -> keywords(c.keywords()));
        Call rewritten = new Call(c.line(), func, List.copyOf(args), kws);
        if (insideLoadChain) {
            return rewritten;
        }
        return new TracerCall(c.line(), Hook.END, List.of(rewritten));
    }

    private <T> T withoutChain(Supplier<T> action) {
        boolean saved = insideLoadChain;
        insideLoadChain = false;
        try {
            return action.get();
        } finally {
            insideLoadChain = saved;
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private Arguments arguments(Arguments args) {
        Function<Param, Param> param = p -> p == null ? null : new Param(p.name(), nullableExpr(p.defaultValue()));
        return new Arguments(map(args.positional(), param), param.apply(args.vararg()),
            map(args.keywordOnly(), param), param.apply(args.kwarg()));
    }

    private List<Keyword> keywords(List<Keyword> keywords) {
        return map(keywords, k -> new Keyword(k.arg(), expr(k.value())));
    }

    private List<Expr> exprs(List<Expr> exprs) {
        return map(exprs, this::expr);
    }

    private Expr nullableExpr(Expr e) {
        return e == null ? null : expr(e);
    }

    private static <A, B> List<B> map(List<A> items, Function<A, B> fn) {
        List<B> result = new ArrayList<>(items.size());
        for (A item : items) result.add(fn.apply(item));
        return List.copyOf(result);
    }
}
