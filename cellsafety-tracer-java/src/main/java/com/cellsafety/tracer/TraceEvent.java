package com.cellsafety.tracer;

/** Kinds of step-level execution events reported by the host. */
public enum TraceEvent {
    CALL,
    LINE,
    RETURN,
    EXCEPTION
}
