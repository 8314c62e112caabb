package com.cellsafety.tracer.scope;

import com.cellsafety.tracer.IdentityRegistry;

/**
 * Scope holding the attribute/subscript bindings of one runtime object, or of a class.
 * A class namespace starts unbound and is bound to the class object's handle once it exists;
 * instances receive a clone of their class namespace on first attribute access.
 */
public class NamespaceScope extends Scope {

    private int objectHandle;

    public NamespaceScope(int objectHandle, String name, Scope parent) {
        super(name, parent);
        this.objectHandle = objectHandle;
    }

    public int getObjectHandle() { return objectHandle; }

    public boolean isBound() { return objectHandle != IdentityRegistry.UNBOUND; }

    public void bind(int handle) {
        this.objectHandle = handle;
    }

    /** Namespace for the object {@code handle} that starts with a copy of every binding of this one. */
    public NamespaceScope cloneFor(int handle) {
        NamespaceScope clone = new NamespaceScope(handle, getName(), getParent());
        for (DataCell cell : dataCellsThisIndentation().values()) {
            clone.put(cell.getKey(), cell.copyInto(clone));
        }
        return clone;
    }

    @Override
    public String toString() {
        return "<Namespace " + fullPath() + " #" + objectHandle + ">";
    }
}
