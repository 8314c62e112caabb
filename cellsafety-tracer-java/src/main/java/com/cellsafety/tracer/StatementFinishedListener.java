package com.cellsafety.tracer;

import java.util.List;

/**
 * Receives each statement once it has finished executing, together with the attribute and
 * subscript stores buffered while it ran. Turning those stores into data cell writes and
 * deciding staleness happens behind this interface.
 */
@FunctionalInterface
public interface StatementFinishedListener {

    StatementFinishedListener NONE = (statement, stores) -> { };

    void statementFinished(TracedStatement statement, List<SavedStore> stores);
}
