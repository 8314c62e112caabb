package com.cellsafety.tracer;

import com.cellsafety.analysis.static_analysis.Hyperedge;
import com.cellsafety.analysis.syntax.Ast;
import com.cellsafety.analysis.syntax.SiteId;
import com.cellsafety.tracer.scope.DataCell;
import com.cellsafety.tracer.scope.NamespaceScope;
import com.cellsafety.tracer.scope.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Execution record of one statement site of an instrumented cell.
 *
 * Static facts (site, node, hyperedge) are fixed when the cell is registered. Everything else
 * describes the current execution of the cell and is cleared by {@link #resetExecutionState()}.
 */
public class TracedStatement {

    /** The statement shapes the state machine distinguishes. */
    public enum Kind {
        FUNCTION_DEF,
        CLASS_DEF,
        RETURN,
        OTHER;

        public static Kind of(Ast.Stmt stmt) {
            if (stmt instanceof Ast.FunctionDef) return FUNCTION_DEF;
            if (stmt instanceof Ast.ClassDef) return CLASS_DEF;
            if (stmt instanceof Ast.Return) return RETURN;
            return OTHER;
        }
    }

    private final SiteId site;
    private final Ast.Stmt node;
    private final Hyperedge hyperedge;
    private final Kind kind;

    private Scope scope;
    private boolean finished;
    private Set<DataCell> loadedDataCells = Set.of();
    private Set<Mutation> mutations = Set.of();
    private Set<DataCell> readDependencies = Set.of();
    private final List<Set<DataCell>> callPointDeps = new ArrayList<>();
    private boolean callPointDepsDoneOnce;
    private NamespaceScope classScope;

    public TracedStatement(SiteId site, Ast.Stmt node, Hyperedge hyperedge) {
        this.site = site;
        this.node = node;
        this.hyperedge = hyperedge;
        this.kind = Kind.of(node);
    }

    public SiteId getSite()           { return site; }
    public Ast.Stmt getNode()         { return node; }
    public Hyperedge getHyperedge()   { return hyperedge; }
    public Kind getKind()             { return kind; }
    public int getLine()              { return node.line(); }

    /** Scope the statement executes in; bound on the first event of each execution. */
    public Scope getScope()           { return scope; }

    void bindScope(Scope executingScope) {
        if (scope == null) {
            scope = executingScope;
        }
    }

    /**
     * Static reads resolved in this statement's scope, plus the data cells the tracer loaded
     * during the statement, plus every dependency set contributed by calls made from it.
     */
    public Set<DataCell> computeReadDependencies(Scope fallbackScope, AttributeTracer tracer) {
        Scope lookupScope = scope != null ? scope : fallbackScope;
        Set<DataCell> result = new LinkedHashSet<>();
        for (String name : hyperedge.reads()) {
            DataCell cell = lookupScope.lookupDataCellByName(name);
            if (cell != null) result.add(cell);
        }
        for (Set<DataCell> deps : callPointDeps) {
            result.addAll(deps);
        }
        result.addAll(tracer.getLoadedDataCells());
        return result;
    }

    void markFinished(Set<DataCell> reads, Set<DataCell> loaded, Set<Mutation> observedMutations) {
        finished = true;
        readDependencies = Collections.unmodifiableSet(new LinkedHashSet<>(reads));
        loadedDataCells = Collections.unmodifiableSet(new LinkedHashSet<>(loaded));
        mutations = Collections.unmodifiableSet(new LinkedHashSet<>(observedMutations));
    }

    public boolean isFinished()                     { return finished; }
    public Set<DataCell> getLoadedDataCells()       { return loadedDataCells; }
    public Set<Mutation> getMutations()             { return mutations; }
    public Set<DataCell> getReadDependencies()      { return readDependencies; }
    public List<Set<DataCell>> getCallPointDeps()   { return Collections.unmodifiableList(callPointDeps); }
    public NamespaceScope getClassScope()           { return classScope; }

    void addCallPointDeps(Set<DataCell> deps) {
        callPointDeps.add(Collections.unmodifiableSet(new LinkedHashSet<>(deps)));
    }

    /** Returns true the first time it is called in an execution, false afterwards. */
    boolean claimCallPointDeps() {
        if (callPointDepsDoneOnce) return false;
        callPointDepsDoneOnce = true;
        return true;
    }

    void setClassScope(NamespaceScope classScope) {
        this.classScope = classScope;
    }

    /** Forgets everything observed during the previous execution of the cell. */
    public void resetExecutionState() {
        scope = null;
        finished = false;
        loadedDataCells = Set.of();
        mutations = Set.of();
        readDependencies = Set.of();
        callPointDeps.clear();
        callPointDepsDoneOnce = false;
        classScope = null;
    }

    @Override
    public String toString() {
        return "TracedStatement" + site + "@" + node.line() + "[" + kind + "]";
    }
}
