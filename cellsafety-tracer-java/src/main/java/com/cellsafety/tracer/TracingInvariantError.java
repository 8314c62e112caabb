package com.cellsafety.tracer;

/**
 * The event stream and the tracer's frame stack went out of step.
 * This is an internal bug, never a data error, so it is an {@link Error} and must not be caught.
 */
public class TracingInvariantError extends Error {

    public TracingInvariantError(String message) {
        super(message);
    }
}
