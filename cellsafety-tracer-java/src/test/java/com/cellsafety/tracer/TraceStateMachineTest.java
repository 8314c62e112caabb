package com.cellsafety.tracer;

import com.cellsafety.analysis.config.CellSafetyConfig;
import com.cellsafety.tracer.scope.DataCell;
import com.cellsafety.tracer.scope.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TraceStateMachineTest {

    private final List<TracedStatement> finished = new ArrayList<>();
    private TracingSession session;
    private TraceStateMachine machine;
    private Scope global;

    @BeforeEach
    void setUp() {
        session = new TracingSession(CellSafetyConfig.defaults(), (statement, stores) -> finished.add(statement));
        machine = session.getStateMachine();
        global = session.getGlobalScope();
    }

    private List<TracedStatement> load(String source) {
        session.instrumentCell(1, source);
        session.beginCellExecution(1);
        return List.copyOf(session.getStatements().statementsOf(1));
    }

    private void event(TraceEvent event, int line) {
        assertTrue(session.onTraceEvent(event, new TraceFrame("<cell-1>", line)));
    }

    private DataCell global(String name) {
        DataCell cell = new DataCell(name, IdentityRegistry.UNBOUND, global, false);
        global.put(name, cell);
        return cell;
    }

    // --- straight-line code ---

    @Test
    void lineEventFinishesPreviousStatement() {
        List<TracedStatement> s = load("a = 1\nb = a\n");

        event(TraceEvent.LINE, 1);
        assertFalse(s.get(0).isFinished());
        event(TraceEvent.LINE, 2);
        assertTrue(s.get(0).isFinished());
        assertFalse(s.get(1).isFinished());

        session.endCellExecution();
        assertTrue(s.get(1).isFinished());
        assertEquals(List.of(s.get(0), s.get(1)), finished);
    }

    @Test
    void staticReadsResolveInExecutingScope() {
        DataCell a = global("a");
        List<TracedStatement> s = load("b = a + missing\n");

        event(TraceEvent.LINE, 1);
        session.endCellExecution();

        assertEquals(Set.of(a), s.get(0).getReadDependencies());
        assertSame(global, s.get(0).getScope());
    }

    @Test
    void loopBodyStatementsFinishOncePerExecution() {
        List<TracedStatement> s = load("for i in xs:\n    a = i\nb = 1\n");

        for (int line : new int[] {1, 2, 1, 2, 1, 3}) {
            event(TraceEvent.LINE, line);
        }
        session.endCellExecution();

        assertEquals(List.of(s.get(0), s.get(1), s.get(2)), finished);
    }

    // --- calls ---

    @Test
    void functionReturnDependenciesAttachToCallingStatement() {
        DataCell w = global("w");
        DataCell y = global("y");
        List<TracedStatement> s = load("def f(x):\n    return x + y\nz = f(w)\n");
        TracedStatement def = s.get(0);
        TracedStatement ret = s.get(1);
        TracedStatement call = s.get(2);

        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 3);
        assertTrue(def.isFinished());

        event(TraceEvent.CALL, 1);
        assertEquals(1, machine.getCallDepth());
        assertEquals("f", machine.getCurrentFrameScope().getName());
        assertSame(global, machine.getCurrentFrameScope().getParent());
        assertFalse(machine.isInsideLambda());

        event(TraceEvent.LINE, 2);
        event(TraceEvent.RETURN, 2);
        assertTrue(ret.isFinished());
        assertEquals(Set.of(y), ret.getReadDependencies());
        assertEquals(0, machine.getCallDepth());
        assertSame(global, machine.getCurrentFrameScope());
        assertEquals(List.of(Set.of(y)), call.getCallPointDeps());
        assertFalse(call.isFinished());

        session.endCellExecution();
        assertEquals(Set.of(w, y), call.getReadDependencies());
    }

    @Test
    void lambdaDependenciesAttachOncePerExecution() {
        DataCell y = global("y");
        List<TracedStatement> s = load("g = lambda q: q + y\nr = g(1) + g(2)\n");
        TracedStatement caller = s.get(1);

        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 2);
        event(TraceEvent.CALL, 1);
        assertTrue(machine.isInsideLambda());
        assertSame(global, machine.getCurrentFrameScope());
        event(TraceEvent.RETURN, 1);
        assertFalse(machine.isInsideLambda());
        event(TraceEvent.CALL, 1);
        event(TraceEvent.RETURN, 1);

        assertEquals(List.of(Set.of(y)), caller.getCallPointDeps());
        session.endCellExecution();
        assertTrue(caller.getReadDependencies().contains(y));
    }

    @Test
    void classStatementFinishesAfterBodyReturns() {
        List<TracedStatement> s = load("class Foo(Base):\n    x = 1\nobj = Foo()\n");
        TracedStatement cls = s.get(0);
        TracedStatement body = s.get(1);

        event(TraceEvent.LINE, 1);
        event(TraceEvent.CALL, 1);
        assertEquals("Foo", machine.getCurrentFrameScope().getName());
        event(TraceEvent.LINE, 2);
        event(TraceEvent.RETURN, 2);

        assertTrue(body.isFinished());
        assertEquals("Foo", body.getScope().getName());
        assertFalse(cls.isFinished());
        assertNotNull(cls.getClassScope());
        assertEquals("Foo", cls.getClassScope().getName());
        assertFalse(cls.getClassScope().isBound());

        event(TraceEvent.LINE, 3);
        assertTrue(cls.isFinished());
    }

    @Test
    void exceptionSuppressesCallPointDependencies() {
        global("y");
        List<TracedStatement> s = load("def f():\n    return y\nz = f()\n");

        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 3);
        event(TraceEvent.CALL, 1);
        event(TraceEvent.LINE, 2);
        event(TraceEvent.EXCEPTION, 2);
        event(TraceEvent.RETURN, 2);

        assertEquals(0, machine.getCallDepth());
        assertTrue(s.get(2).getCallPointDeps().isEmpty());
        assertFalse(s.get(1).isFinished());
    }

    @Test
    void tracerFrameStackFollowsCallDepth() {
        load("def f():\n    return 1\nz = f()\n");

        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 3);
        event(TraceEvent.CALL, 1);
        assertEquals(machine.getCallDepth(), session.getTracer().getStackDepth());
        event(TraceEvent.LINE, 2);
        event(TraceEvent.RETURN, 2);
        assertEquals(0, session.getTracer().getStackDepth());
    }

    // --- invariants and filtering ---

    @Test
    void returnWithoutCallIsAnInvariantViolation() {
        load("a = 1\n");
        event(TraceEvent.LINE, 1);
        assertThrows(TracingInvariantError.class,
            () -> session.onTraceEvent(TraceEvent.RETURN, new TraceFrame("<cell-1>", 1)));
    }

    @Test
    void startingWithOpenFramesIsAnInvariantViolation() {
        load("def f():\n    return 1\nz = f()\n");
        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 3);
        event(TraceEvent.CALL, 1);
        assertThrows(TracingInvariantError.class, () -> session.beginCellExecution(1));
    }

    @Test
    void foreignFramesAndUnknownLinesAreIgnored() {
        load("a = 1\n");

        assertFalse(session.onTraceEvent(TraceEvent.LINE, new TraceFrame("<module>", 1)));
        assertFalse(session.onTraceEvent(TraceEvent.CALL, new TraceFrame("helpers.py", 10)));
        assertFalse(session.onTraceEvent(TraceEvent.LINE, new TraceFrame("<cell-1>", 9)));
        assertFalse(session.onTraceEvent(TraceEvent.LINE, new TraceFrame("<cell-2>", 1)));
        assertEquals(0, session.getCounter().get());
        assertTrue(machine.getPrevEvent().isEmpty());
    }

    @Test
    void counterAdvancesOncePerProcessedEvent() {
        load("def f():\n    return 1\nz = f()\n");
        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 3);
        event(TraceEvent.CALL, 1);
        event(TraceEvent.LINE, 2);
        event(TraceEvent.RETURN, 2);
        assertEquals(5, session.getCounter().get());
        assertEquals(TraceEvent.RETURN, machine.getPrevEvent().orElseThrow());
    }

    @Test
    void reExecutionStartsFromCleanRecords() {
        List<TracedStatement> s = load("a = 1\nb = a\n");
        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 2);
        session.endCellExecution();
        assertTrue(s.get(1).isFinished());

        session.beginCellExecution(1);
        assertFalse(s.get(0).isFinished());
        assertFalse(s.get(1).isFinished());
        assertNull(s.get(0).getScope());
        assertTrue(machine.getPrevStatementInCurrentFrame().isEmpty());

        event(TraceEvent.LINE, 1);
        event(TraceEvent.LINE, 2);
        session.endCellExecution();
        assertEquals(4, finished.size());
    }
}
