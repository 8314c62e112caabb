package com.cellsafety.tracer;

/**
 * Position reported by the host with every event.
 *
 * @param codeName synthetic code identity of the executing code, e.g. {@code <cell-3>}
 * @param line     current 1-based line within that code
 */
public record TraceFrame(String codeName, int line) {}
