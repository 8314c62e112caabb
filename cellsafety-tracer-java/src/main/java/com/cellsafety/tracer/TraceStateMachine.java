package com.cellsafety.tracer;

import com.cellsafety.analysis.instrument.CellCodeNames;
import com.cellsafety.tracer.scope.NamespaceScope;
import com.cellsafety.tracer.scope.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Consumes the host's call/line/return/exception events, decides when each statement has
 * finished executing, and keeps the tracer's frame stack in step with the real call depth.
 *
 * Dependencies gathered inside a function or lambda body are attached to the statement that
 * made the call, once per execution. A class statement finishes only after its body's frame
 * has returned, and receives that frame's namespace as its class scope.
 *
 * Events must arrive in execution order from a single call stack.
 */
public class TraceStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TraceStateMachine.class);

    /** Where execution continues when the current frame returns. */
    private record CallRecord(TracedStatement returnTo, boolean returnToInsideLambda) {}

    private final AttributeTracer tracer;
    private final TraceEventCounter counter;
    private final StatementRegistry statements;
    private final CallScopeResolver callScopeResolver;
    private final StatementFinishedListener listener;
    private final String codeNamePrefix;

    private Scope currentFrameScope;
    private TracedStatement prevInCurrentFrame;
    private TracedStatement prevStatement;
    private TraceEvent prevEvent;
    private boolean insideLambda;
    private final Deque<CallRecord> stack = new ArrayDeque<>();

    public TraceStateMachine(
            AttributeTracer tracer,
            TraceEventCounter counter,
            StatementRegistry statements,
            CallScopeResolver callScopeResolver,
            StatementFinishedListener listener,
            Scope globalScope,
            String codeNamePrefix) {
        this.tracer = tracer;
        this.counter = counter;
        this.statements = statements;
        this.callScopeResolver = callScopeResolver;
        this.listener = listener;
        this.currentFrameScope = globalScope;
        this.codeNamePrefix = codeNamePrefix;
    }

    // -----------------------------------------------------------------------
    // Event entry points
    // -----------------------------------------------------------------------

    /**
     * Decodes the executing cell and statement from the frame, then processes the event.
     * Returns false if the frame does not belong to a registered cell; such events are ignored
     * entirely, so a call and its return are always skipped together.
     */
    public boolean onFrameEvent(TraceEvent event, TraceFrame frame) {
        OptionalInt cellNumber = CellCodeNames.parseCellNumber(codeNamePrefix, frame.codeName());
        if (cellNumber.isEmpty()) {
            LOGGER.debug("ignoring {} in non-cell code {}", event, frame.codeName());
            return false;
        }
        Optional<TracedStatement> statement = statements.resolve(cellNumber.getAsInt(), frame.line());
        if (statement.isEmpty()) {
            LOGGER.warn("no statement at line {} of {}, dropping {} event", frame.line(), frame.codeName(), event);
            return false;
        }
        onEvent(event, statement.get());
        return true;
    }

    public void onEvent(TraceEvent event, TracedStatement statement) {
        // 1. Advance the global clock
        counter.increment();
        statement.bindScope(currentFrameScope);

        // 2. Finish the previous statement if this event shows it is done
        checkPreviousStatementFinished(event, statement);

        // 3. Remember the most recent statement overall
        prevStatement = statement;

        // 4. Event-specific transition
        switch (event) {
            case LINE:
                prevInCurrentFrame = statement;
                break;
            case CALL:
                handleCall(statement);
                break;
            case RETURN:
                handleReturn(statement);
                break;
            case EXCEPTION:
                break;
        }

        // 5. Remember the event kind
        prevEvent = event;
    }

    // -----------------------------------------------------------------------
    // Execution boundaries
    // -----------------------------------------------------------------------

    /**
     * Clears per-execution bookkeeping before a cell runs.
     *
     * @throws TracingInvariantError if frames of the previous execution were never returned from
     */
    public void startExecution() {
        if (!stack.isEmpty()) {
            throw new TracingInvariantError(stack.size() + " frames still open from the previous execution");
        }
        prevInCurrentFrame = null;
        prevStatement = null;
        prevEvent = null;
        insideLambda = false;
    }

    /** Finishes the last statement of the cell, which no later line event will finish. */
    public void finishExecution() {
        if (prevInCurrentFrame != null && !prevInCurrentFrame.isFinished()) {
            finish(prevInCurrentFrame);
        }
        prevInCurrentFrame = null;
    }

    // -----------------------------------------------------------------------
    // Transitions
    // -----------------------------------------------------------------------

    private void checkPreviousStatementFinished(TraceEvent event, TracedStatement statement) {
        if ((event != TraceEvent.LINE && event != TraceEvent.RETURN)
                || prevEvent == TraceEvent.CALL || prevEvent == TraceEvent.EXCEPTION) {
            return;
        }

        if (event == TraceEvent.RETURN) {
            CallRecord top = stack.peek();
            if (top == null) {
                throw new TracingInvariantError("return event with an empty call stack");
            }
            // a statement that is the whole content of the returning frame is not done yet
            if (prevStatement != null && prevStatement != top.returnTo()) {
                finish(prevStatement);
            }
            return;
        }

        TracedStatement prevThisFrame = prevInCurrentFrame;
        if (prevThisFrame == null || prevThisFrame.isFinished()) {
            return;
        }
        if (prevThisFrame.getKind() == TracedStatement.Kind.CLASS_DEF) {
            // done only once the class body's frame has returned
            if (prevEvent == TraceEvent.RETURN) {
                finish(prevThisFrame);
            }
        } else if (prevThisFrame != statement) {
            finish(prevThisFrame);
        }
    }

    private void handleCall(TracedStatement statement) {
        boolean lambda = statement.getKind() != TracedStatement.Kind.FUNCTION_DEF
            && statement.getKind() != TracedStatement.Kind.CLASS_DEF;
        stack.push(new CallRecord(prevInCurrentFrame, insideLambda));
        insideLambda = lambda;
        currentFrameScope = callScopeResolver.postCallScope(statement, currentFrameScope);
        LOGGER.debug("entering scope {}", currentFrameScope);
        prevInCurrentFrame = null;
        tracer.push(currentFrameScope);
    }

    private void handleReturn(TracedStatement statement) {
        LOGGER.debug("leaving scope {}", currentFrameScope);
        if (stack.isEmpty()) {
            throw new TracingInvariantError("return event with an empty call stack");
        }
        CallRecord record = stack.pop();
        TracedStatement returnTo = record.returnTo();
        if (returnTo == null) {
            throw new TracingInvariantError("returned to a frame with no current statement");
        }

        // after an exception the frame did not complete normally: attribute nothing
        if (prevEvent != TraceEvent.EXCEPTION) {
            if (returnTo.getKind() == TracedStatement.Kind.CLASS_DEF) {
                if (currentFrameScope instanceof NamespaceScope classScope) {
                    returnTo.setClassScope(classScope);
                }
            } else if (statement.getKind() == TracedStatement.Kind.RETURN || insideLambda) {
                if (statement.claimCallPointDeps()) {
                    returnTo.addCallPointDeps(statement.computeReadDependencies(currentFrameScope, tracer));
                }
            }
        }

        insideLambda = record.returnToInsideLambda();
        // a further call from the same statement pushes it again
        prevInCurrentFrame = returnTo;
        tracer.pop();
        currentFrameScope = tracer.getActiveScope();
        LOGGER.debug("entering scope {}", currentFrameScope);
    }

    private void finish(TracedStatement statement) {
        if (statement.isFinished()) {
            return;
        }
        statement.markFinished(
            statement.computeReadDependencies(currentFrameScope, tracer),
            tracer.getLoadedDataCells(),
            tracer.getMutations());
        listener.statementFinished(statement, List.copyOf(tracer.getSavedStores()));
        tracer.reset();
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public Scope getCurrentFrameScope()             { return currentFrameScope; }
    public int getCallDepth()                       { return stack.size(); }
    public boolean isInsideLambda()                 { return insideLambda; }
    public Optional<TraceEvent> getPrevEvent()      { return Optional.ofNullable(prevEvent); }
    public Optional<TracedStatement> getPrevStatementInCurrentFrame() {
        return Optional.ofNullable(prevInCurrentFrame);
    }
}
