package com.cellsafety.tracer.scope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A symbol table with a fixed parent used for fallback lookup.
 * Lexical scopes (module, function, class body) use this class directly.
 */
public class Scope {

    private final String name;
    private final Scope parent;
    private final Map<Object, DataCell> dataCells = new LinkedHashMap<>();

    public Scope(String name, Scope parent) {
        this.name = name;
        this.parent = parent;
    }

    public String getName()  { return name; }
    public Scope getParent() { return parent; }

    /** Looks up {@code key} in this scope only. */
    public DataCell lookupDataCellByNameThisIndentation(Object key) {
        return dataCells.get(key);
    }

    /** Looks up {@code key} here, then in each enclosing scope. */
    public DataCell lookupDataCellByName(Object key) {
        for (Scope s = this; s != null; s = s.parent) {
            DataCell cell = s.dataCells.get(key);
            if (cell != null) return cell;
        }
        return null;
    }

    public void put(Object key, DataCell cell) {
        dataCells.put(key, cell);
    }

    public Map<Object, DataCell> dataCellsThisIndentation() {
        return Collections.unmodifiableMap(dataCells);
    }

    public Scope makeChildScope(String childName) {
        return new Scope(childName, this);
    }

    public String fullPath() {
        return parent == null ? name : parent.fullPath() + "." + name;
    }

    @Override
    public String toString() {
        return "<Scope " + fullPath() + ">";
    }
}
