package com.cellsafety.tracer;

/**
 * How the tracer reads live attribute and subscript values of host objects.
 */
public interface ObjectModel {

    /**
     * Reads {@code obj.key} (or {@code obj[key]} when {@code isSubscript}).
     *
     * @throws LookupFailedException if the object has no such attribute or key
     */
    Object read(Object obj, Object key, boolean isSubscript) throws LookupFailedException;

    /** The object whose namespace holds class-level bindings of {@code obj}. */
    default Object typeOf(Object obj) {
        return obj.getClass();
    }

    class LookupFailedException extends Exception {
        public LookupFailedException(String message) { super(message); }
        public LookupFailedException(String message, Throwable cause) { super(message, cause); }
    }
}
