package com.cellsafety.analysis.instrument;

import com.cellsafety.analysis.syntax.Ast.*;
import com.cellsafety.analysis.syntax.Ast.Module;
import com.cellsafety.analysis.syntax.SiteId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inserts a {@link Marker} before every statement of every statement sequence of a cell,
 * numbering sites in pre-order. One inserter instruments one cell version.
 */
public class StatementInserter {

    private final int cellNumber;
    private int counter = 0;
    private final Map<SiteId, Stmt> sites = new LinkedHashMap<>();

    public StatementInserter(int cellNumber) {
        this.cellNumber = cellNumber;
    }

    public Module insert(Module module) {
        return new Module(insertAll(module.body()));
    }

    /** Original (unmarked) statement of every site assigned so far. */
    public Map<SiteId, Stmt> getSites() { return sites; }

    private List<Stmt> insertAll(List<Stmt> body) {
        List<Stmt> result = new ArrayList<>(body.size() * 2);
        for (Stmt stmt : body) {
            SiteId site = new SiteId(cellNumber, counter++);
            sites.put(site, stmt);
            result.add(new Marker(stmt.line(), site));
            result.add(insertNested(stmt));
        }
        return List.copyOf(result);
    }

    private Stmt insertNested(Stmt stmt) {
        if (stmt instanceof For f) {
            return new For(f.line(), f.target(), f.iter(), insertAll(f.body()), insertAll(f.orElse()));
        } else if (stmt instanceof While w) {
            return new While(w.line(), w.test(), insertAll(w.body()), insertAll(w.orElse()));
        } else if (stmt instanceof If i) {
            return new If(i.line(), i.test(), insertAll(i.body()), insertAll(i.orElse()));
        } else if (stmt instanceof With w) {
            return new With(w.line(), w.items(), insertAll(w.body()));
        } else if (stmt instanceof FunctionDef f) {
            return new FunctionDef(f.line(), f.name(), f.args(), insertAll(f.body()), f.async());
        } else if (stmt instanceof ClassDef c) {
            return new ClassDef(c.line(), c.name(), c.bases(), c.keywords(), insertAll(c.body()));
        } else if (stmt instanceof Try t) {
            List<Stmt> body = insertAll(t.body());
            List<ExceptHandler> handlers = new ArrayList<>();
            for (ExceptHandler h : t.handlers()) {
                handlers.add(new ExceptHandler(h.line(), h.type(), h.name(), insertAll(h.body())));
            }
            return new Try(t.line(), body, List.copyOf(handlers), insertAll(t.orElse()), insertAll(t.finalBody()));
        }
        return stmt;
    }
}
