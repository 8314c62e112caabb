package com.cellsafety.analysis.static_analysis;

import com.cellsafety.analysis.syntax.Ast.*;
import com.cellsafety.analysis.syntax.Ast.Module;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the {@link Hyperedge} of a single statement.
 *
 * Only the header of a compound statement is examined: loop, function, class, with, if and try
 * bodies are separate statements with hyperedges of their own. Two simplifications are kept on
 * purpose: the target of an augmented assignment is only written (not read), and the index of a
 * subscript is never read.
 */
public class HyperedgeExtractor {

    public Hyperedge extract(Node node) {
        Collector collector = new Collector();
        collector.visitNode(node);
        // a name bound by any lambda of the statement is not a read of the statement
        collector.reads.removeAll(collector.lambdaBound);
        return new Hyperedge(collector.writes, collector.reads);
    }

    private static final class Collector {

        private final Set<String> writes = new LinkedHashSet<>();
        private final Set<String> reads = new LinkedHashSet<>();
        private final Set<String> lambdaBound = new LinkedHashSet<>();
        private Set<String> target = reads;

        void visitNode(Node node) {
            if (node instanceof Module m) {
                m.body().forEach(this::visitStmt);
            } else if (node instanceof Stmt s) {
                visitStmt(s);
            } else if (node instanceof Expr e) {
                visitExpr(e);
            } else if (node instanceof ExceptHandler h) {
                visitExpr(h.type());
                if (h.name() != null) writes.add(h.name());
            }
        }

        private void visitStmt(Stmt stmt) {
            if (stmt instanceof Assign a) {
                inWriteMode(() -> a.targets().forEach(this::visitExpr));
                visitExpr(a.value());
            } else if (stmt instanceof AugAssign a) {
                inWriteMode(() -> visitExpr(a.target()));
                visitExpr(a.value());
            } else if (stmt instanceof For f) {
                inWriteMode(() -> visitExpr(f.target()));
                visitExpr(f.iter());
            } else if (stmt instanceof While w) {
                visitExpr(w.test());
            } else if (stmt instanceof If i) {
                visitExpr(i.test());
            } else if (stmt instanceof With w) {
                for (WithItem item : w.items()) {
                    visitExpr(item.contextExpr());
                    inWriteMode(() -> visitExpr(item.optionalVars()));
                }
            } else if (stmt instanceof FunctionDef f) {
                writes.add(f.name());
                visitAll(f.args().defaults());
            } else if (stmt instanceof ClassDef c) {
                writes.add(c.name());
                visitAll(c.bases());
                c.keywords().forEach(k -> visitExpr(k.value()));
            } else if (stmt instanceof Return r) {
                visitExpr(r.value());
            } else if (stmt instanceof ExprStmt e) {
                visitExpr(e.value());
            } else if (stmt instanceof Raise r) {
                visitExpr(r.exc());
            } else if (stmt instanceof Import i) {
                for (Alias alias : i.names()) {
                    if (!"*".equals(alias.name())) writes.add(alias.boundName());
                }
            }
            // try headers, markers and pass/break/continue name nothing
        }

        private void visitExpr(Expr expr) {
            if (expr == null) {
                return;
            }
            if (expr instanceof Name n) {
                target.add(n.id());
            } else if (expr instanceof Subscript s) {
                visitExpr(s.value());
            } else if (expr instanceof Attribute a) {
                visitExpr(a.value());
            } else if (expr instanceof Lambda l) {
                visitLambda(l);
            } else if (expr instanceof Call c) {
                visitExpr(c.func());
                visitAll(c.args());
                c.keywords().forEach(k -> visitExpr(k.value()));
            } else if (expr instanceof Starred s) {
                visitExpr(s.value());
            } else if (expr instanceof BinOp b) {
                visitExpr(b.left());
                visitExpr(b.right());
            } else if (expr instanceof UnaryOp u) {
                visitExpr(u.operand());
            } else if (expr instanceof BoolOp b) {
                visitAll(b.values());
            } else if (expr instanceof Compare c) {
                visitExpr(c.left());
                visitAll(c.comparators());
            } else if (expr instanceof ListExpr l) {
                visitAll(l.elts());
            } else if (expr instanceof TupleExpr t) {
                visitAll(t.elts());
            } else if (expr instanceof SetExpr s) {
                visitAll(s.elts());
            } else if (expr instanceof DictExpr d) {
                visitAll(d.keys());
                visitAll(d.values());
            } else if (expr instanceof IfExp i) {
                visitExpr(i.test());
                visitExpr(i.body());
                visitExpr(i.orElse());
            } else if (expr instanceof TracerCall t) {
                visitAll(t.args());
            }
        }

        /** Body and defaults are read; the parameter names are struck from the statement's reads. */
        private void visitLambda(Lambda lambda) {
            visitExpr(lambda.body());
            visitAll(lambda.args().defaults());
            lambdaBound.addAll(lambda.args().boundNames());
        }

        private void visitAll(List<? extends Expr> exprs) {
            for (Expr e : exprs) visitExpr(e);
        }

        private void inWriteMode(Runnable action) {
            Set<String> saved = target;
            target = writes;
            action.run();
            target = saved;
        }
    }
}
