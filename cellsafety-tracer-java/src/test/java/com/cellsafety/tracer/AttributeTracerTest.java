package com.cellsafety.tracer;

import com.cellsafety.analysis.config.CellSafetyConfig;
import com.cellsafety.analysis.syntax.Ast.ExprContext;
import com.cellsafety.analysis.syntax.Ast.TracerCall;
import com.cellsafety.tracer.scope.DataCell;
import com.cellsafety.tracer.scope.NamespaceScope;
import com.cellsafety.tracer.scope.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AttributeTracerTest {

    static class Point {
        int x = 1;
        Point next;
    }

    private IdentityRegistry identities;
    private Map<Integer, NamespaceScope> namespaces;
    private AliasIndex aliases;
    private Scope global;
    private TraceEventCounter counter;
    private AttributeTracer tracer;

    @BeforeEach
    void setUp() {
        identities = new IdentityRegistry();
        namespaces = new HashMap<>();
        aliases = new AliasIndex();
        global = new Scope("<module>", null);
        counter = new TraceEventCounter();
        tracer = newTracer(CellSafetyConfig.defaults());
    }

    private AttributeTracer newTracer(CellSafetyConfig config) {
        return new AttributeTracer(identities, namespaces, aliases, global, counter, new ReflectiveObjectModel(), config);
    }

    private NamespaceScope namespaceOf(Object obj) {
        return namespaces.get(identities.find(obj));
    }

    private Object load(Object obj, Object key) {
        return tracer.begin(obj, key, false, ExprContext.LOAD, false, true);
    }

    private Object loadForCall(Object obj, String method) {
        return tracer.begin(obj, method, false, ExprContext.LOAD, true, true);
    }

    // --- begin ---

    @Test
    void beginOnNullIsANoOp() {
        assertNull(tracer.begin(null, "x", false, ExprContext.LOAD, false, true));
        assertTrue(tracer.getLoadedDataCells().isEmpty());
        assertTrue(namespaces.isEmpty());
    }

    @Test
    void loadCreatesNamespaceAndDataCell() {
        Point p = new Point();
        assertSame(p, load(p, "x"));

        NamespaceScope ns = namespaceOf(p);
        assertNotNull(ns);
        assertEquals("<unknown namespace>", ns.getName());
        assertSame(global, ns.getParent());
        assertSame(ns, tracer.getActiveScope());

        DataCell cell = tracer.getLoadedDataCells().iterator().next();
        assertEquals("x", cell.getName());
        assertSame(ns, cell.getScope());
        assertFalse(cell.isSubscript());
        assertEquals(1, identities.objectFor(cell.getValueHandle()));
    }

    @Test
    void endRestoresOriginalActiveScope() {
        Point p = new Point();
        tracer.end(load(p, "x"));
        assertSame(global, tracer.getActiveScope());
    }

    @Test
    void repeatedLoadReusesDataCell() {
        Point p = new Point();
        tracer.end(load(p, "x"));
        DataCell first = namespaceOf(p).lookupDataCellByNameThisIndentation("x");
        tracer.reset();
        tracer.end(load(p, "x"));
        assertSame(first, tracer.getLoadedDataCells().iterator().next());
    }

    @Test
    void aliasIndexNamesNamespaceOfLoadedValue() {
        Point p = new Point();
        Point q = new Point();
        p.next = q;

        // p.next.x: the host evaluates p.next between the two begin calls
        tracer.begin(p, "next", false, ExprContext.LOAD, false, true);
        tracer.begin(q, "x", false, ExprContext.LOAD, false, true);
        tracer.end(1);

        assertEquals("next", namespaceOf(q).getName());
        assertEquals(1, aliases.cellsFor(identities.find(q)).size());
    }

    @Test
    void chainedLoadsParentNewNamespaceUnderActiveScope() {
        Point p = new Point();
        Point q = new Point();
        p.next = q;
        load(p, "next");
        load(q, "x");
        assertSame(namespaceOf(p), namespaceOf(q).getParent());
    }

    @Test
    void missingAttributeDropsTheLoad() {
        Point p = new Point();
        assertSame(p, load(p, "missing"));
        assertTrue(tracer.getLoadedDataCells().isEmpty());
        assertNull(namespaceOf(p).lookupDataCellByNameThisIndentation("missing"));
    }

    @Test
    void keyRejectedByHostMapDropsTheLoad() {
        Map<String, Integer> map = Map.of("a", 1);
        assertSame(map, tracer.begin(map, null, true, ExprContext.LOAD, false, true));
        assertTrue(tracer.getLoadedDataCells().isEmpty());
    }

    @Test
    void sideEffectingMethodIsNotRunByALoad() {
        Deque<String> deque = new ArrayDeque<>(List.of("a", "b"));
        load(deque, "pop");
        assertEquals("a", deque.pop());
        assertTrue(tracer.getLoadedDataCells().isEmpty());
    }

    @Test
    void keyReturnsTheLatestSubscriptKey() {
        List<String> list = List.of("a", "b");
        tracer.begin(list, 1L, true, ExprContext.LOAD, false, true);
        assertEquals(1L, tracer.key());
        tracer.begin(list, 0L, true, ExprContext.STORE, false, false);
        assertEquals(0L, tracer.dispatch(TracerCall.Hook.KEY, List.of()));
    }

    @Test
    void subscriptLoadKeysCellByIndex() {
        List<String> list = List.of("a", "b");
        tracer.begin(list, 1L, true, ExprContext.LOAD, false, true);

        DataCell cell = tracer.getLoadedDataCells().iterator().next();
        assertEquals(1L, cell.getKey());
        assertTrue(cell.isSubscript());
        assertEquals(identities.find("b"), cell.getValueHandle());
    }

    @Test
    void storesAreBufferedNotLoaded() {
        Point p = new Point();
        tracer.begin(p, "x", false, ExprContext.STORE, false, false);
        tracer.begin(p, "x", false, ExprContext.AUG_STORE, false, false);

        assertTrue(tracer.getLoadedDataCells().isEmpty());
        assertEquals(2, tracer.getSavedStores().size());
        SavedStore store = tracer.getSavedStores().get(0);
        assertSame(p, store.obj());
        assertEquals("x", store.key());
        assertSame(namespaceOf(p), store.scope());
        assertSame(global, tracer.getActiveScope());
    }

    // --- class namespaces ---

    @Test
    void instanceNamespaceIsClonedFromClassNamespace() {
        NamespaceScope classScope = new NamespaceScope(identities.handleOf(Point.class), "Point", global);
        DataCell classCell = new DataCell("x", IdentityRegistry.UNBOUND, classScope, false);
        classScope.put("x", classCell);
        namespaces.put(classScope.getObjectHandle(), classScope);

        Point p = new Point();
        load(p, "x");

        NamespaceScope ns = namespaceOf(p);
        assertNotSame(classScope, ns);
        assertEquals("Point", ns.getName());
        assertEquals(identities.find(p), ns.getObjectHandle());
        DataCell loaded = tracer.getLoadedDataCells().iterator().next();
        assertNotSame(classCell, loaded);
        assertSame(ns, loaded.getScope());
    }

    @Test
    void subscriptAccessNeverClonesClassNamespace() {
        List<Integer> list = new ArrayList<>(List.of(7));
        NamespaceScope classScope = new NamespaceScope(identities.handleOf(ArrayList.class), "ArrayList", global);
        namespaces.put(classScope.getObjectHandle(), classScope);

        tracer.begin(list, 0L, true, ExprContext.LOAD, false, true);
        assertEquals("<unknown namespace>", namespaceOf(list).getName());
    }

    // --- mutation heuristic ---

    @Test
    void nullResultAtSameCounterIsAMutation() {
        Point p = new Point();
        Object arg = new Object();
        loadForCall(p, "reset");
        tracer.recordArgument(arg, "arg");

        assertNull(tracer.end(null));

        assertEquals(List.of(new Mutation(identities.find(p), List.of("arg"))), List.copyOf(tracer.getMutations()));
        assertTrue(tracer.getMutationCandidate().isEmpty());
        assertTrue(tracer.getLoadedDataCells().isEmpty());
    }

    @Test
    void interveningEventCancelsCandidate() {
        loadForCall(new Point(), "reset");
        counter.increment();
        tracer.end(null);
        assertTrue(tracer.getMutations().isEmpty());
        assertTrue(tracer.getMutationCandidate().isEmpty());
    }

    @Test
    void nonNullResultIsNotAMutation() {
        loadForCall(new Point(), "copy");
        tracer.end(new Point());
        assertTrue(tracer.getMutations().isEmpty());
    }

    @Test
    void plainLoadClearsCandidate() {
        Point p = new Point();
        loadForCall(p, "reset");
        load(p, "x");
        assertTrue(tracer.getMutationCandidate().isEmpty());
    }

    @Test
    void onlyOneCandidateIsLive() {
        Point p = new Point();
        Point q = new Point();
        loadForCall(p, "a");
        loadForCall(q, "b");
        assertEquals(identities.find(q), tracer.getMutationCandidate().orElseThrow().objectHandle());
    }

    @Test
    void mutationTrackingCanBeDisabled() {
        tracer = newTracer(CellSafetyConfig.defaults().withTrackMutations(false));
        loadForCall(new Point(), "reset");
        tracer.end(null);
        assertTrue(tracer.getMutations().isEmpty());
    }

    @Test
    void recordedArgumentsKeepFirstSeenOrderAndResetAtEnd() {
        tracer.recordArgument(1, "b");
        tracer.recordArgument(2, "a");
        assertSame("v", tracer.recordArgument("v", "b"));
        assertEquals(List.of("b", "a"), List.copyOf(tracer.getRecordedArguments()));
        tracer.end(null);
        assertTrue(tracer.getRecordedArguments().isEmpty());
    }

    // --- frame stack ---

    @Test
    void pushStartsFreshFrameAndPopRestoresIt() {
        Point p = new Point();
        tracer.begin(p, "x", false, ExprContext.STORE, false, false);
        loadForCall(p, "reset");
        tracer.recordArgument(1, "n");
        List<SavedStore> storesBefore = List.copyOf(tracer.getSavedStores());
        Scope activeBefore = tracer.getActiveScope();

        Scope callee = global.makeChildScope("f");
        tracer.push(callee);
        AttributeTracer.FrameSnapshot saved = tracer.peekSnapshot().orElseThrow();

        assertEquals(1, tracer.getStackDepth());
        assertSame(callee, tracer.getActiveScope());
        assertSame(callee, tracer.getOriginalActiveScope());
        assertTrue(tracer.getSavedStores().isEmpty());
        assertTrue(tracer.getRecordedArguments().isEmpty());

        tracer.begin(p, "x", false, ExprContext.STORE, false, false);
        tracer.pop();

        assertEquals(0, tracer.getStackDepth());
        assertEquals(storesBefore, tracer.getSavedStores());
        assertEquals(saved.savedStores(), tracer.getSavedStores());
        assertEquals(saved.mutationCandidate(), tracer.getMutationCandidate().orElseThrow());
        assertEquals(List.of("n"), List.copyOf(tracer.getRecordedArguments()));
        assertSame(activeBefore, tracer.getActiveScope());
        assertSame(global, tracer.getOriginalActiveScope());
    }

    @Test
    void popWithoutPushIsAnInvariantViolation() {
        assertThrows(TracingInvariantError.class, tracer::pop);
    }

    @Test
    void nestedPushesUnwindInOrder() {
        Scope f = global.makeChildScope("f");
        Scope g = f.makeChildScope("g");
        tracer.push(f);
        tracer.push(g);
        tracer.pop();
        assertSame(f, tracer.getActiveScope());
        tracer.pop();
        assertSame(global, tracer.getActiveScope());
    }

    @Test
    void resetClearsStatementStateButKeepsNamespaces() {
        Point p = new Point();
        load(p, "x");
        tracer.begin(p, "x", false, ExprContext.STORE, false, false);
        loadForCall(p, "reset");

        tracer.reset();

        assertTrue(tracer.getLoadedDataCells().isEmpty());
        assertTrue(tracer.getSavedStores().isEmpty());
        assertTrue(tracer.getMutations().isEmpty());
        assertTrue(tracer.getMutationCandidate().isEmpty());
        assertSame(global, tracer.getActiveScope());
        assertNotNull(namespaceOf(p).lookupDataCellByNameThisIndentation("x"));
    }

    // --- dispatch ---

    @Test
    void dispatchRoutesTracerCallsToHooks() {
        Point p = new Point();
        Object result = tracer.dispatch(TracerCall.Hook.BEGIN, List.of(p, "x", false, ExprContext.LOAD, false, true));
        assertSame(p, result);
        assertEquals(1, tracer.getLoadedDataCells().size());
        assertEquals("v", tracer.dispatch(TracerCall.Hook.RECORD_ARGUMENT, List.of("v", "name")));
        assertEquals(1, tracer.dispatch(TracerCall.Hook.END, List.of(1)));
    }
}
