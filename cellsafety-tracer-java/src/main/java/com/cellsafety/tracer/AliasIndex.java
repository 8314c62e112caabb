package com.cellsafety.tracer;

import com.cellsafety.tracer.scope.DataCell;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Object handle to the data cells known to reference that object. Grows monotonically;
 * used to give namespaces of otherwise anonymous objects a readable name.
 */
public class AliasIndex {

    private final Map<Integer, Set<DataCell>> aliases = new HashMap<>();

    public void add(int handle, DataCell cell) {
        aliases.computeIfAbsent(handle, k -> new LinkedHashSet<>()).add(cell);
    }

    public Set<DataCell> cellsFor(int handle) {
        Set<DataCell> cells = aliases.get(handle);
        return cells == null ? Set.of() : Collections.unmodifiableSet(cells);
    }

    /** Name of the first cell that referenced the object, if any. */
    public Optional<String> nameFor(int handle) {
        return cellsFor(handle).stream().findFirst().map(DataCell::getName);
    }
}
