package com.cellsafety.tracer;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns a stable int handle to every object the tracer encounters, keyed by identity.
 *
 * References are strong: a handle (and the object behind it) lives as long as the registry.
 * Scope and alias maps are keyed by these handles instead of by the objects themselves.
 */
public class IdentityRegistry {

    /** Handle value meaning "no object", e.g. for a class namespace not yet bound to its class. */
    public static final int UNBOUND = -1;

    private final Map<Object, Integer> handles = new IdentityHashMap<>();
    private final List<Object> objects = new ArrayList<>();

    /** Returns the handle of {@code obj}, assigning the next free one on first encounter. */
    public int handleOf(Object obj) {
        if (obj == null) {
            throw new IllegalArgumentException("null has no identity handle");
        }
        Integer handle = handles.get(obj);
        if (handle == null) {
            handle = objects.size();
            handles.put(obj, handle);
            objects.add(obj);
        }
        return handle;
    }

    /** Returns the handle of {@code obj} without assigning one, or {@link #UNBOUND}. */
    public int find(Object obj) {
        if (obj == null) return UNBOUND;
        Integer handle = handles.get(obj);
        return handle == null ? UNBOUND : handle;
    }

    public Object objectFor(int handle) {
        if (handle < 0 || handle >= objects.size()) {
            throw new IllegalArgumentException("unknown handle " + handle);
        }
        return objects.get(handle);
    }

    public int size() { return objects.size(); }
}
