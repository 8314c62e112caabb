package com.cellsafety.tracer;

/**
 * Global, monotonically increasing count of trace events. Incremented exactly once per event;
 * the only clock the mutation heuristic uses.
 */
public final class TraceEventCounter {

    private long value = 0;

    public long increment() { return ++value; }

    public long get() { return value; }
}
