package com.cellsafety.analysis.instrument;

/**
 * A cell could not be instrumented. No partially instrumented tree is ever returned.
 */
public class InstrumentationException extends RuntimeException {

    private final int line;

    public InstrumentationException(String message, int line) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public InstrumentationException(String message, int line, Throwable cause) {
        super("line " + line + ": " + message, cause);
        this.line = line;
    }

    public int getLine() { return line; }
}
