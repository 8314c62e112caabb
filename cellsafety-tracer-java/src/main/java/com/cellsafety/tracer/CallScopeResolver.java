package com.cellsafety.tracer;

import com.cellsafety.tracer.scope.Scope;

/**
 * Decides which scope becomes active when a new frame is entered.
 */
public interface CallScopeResolver {

    /**
     * @param statement    statement reported with the call event: a function or class definition,
     *                     or for lambdas the statement the lambda appears in
     * @param currentScope scope of the calling frame
     */
    Scope postCallScope(TracedStatement statement, Scope currentScope);
}
