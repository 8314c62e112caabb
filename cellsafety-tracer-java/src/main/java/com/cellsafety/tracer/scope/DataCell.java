package com.cellsafety.tracer.scope;

/**
 * A tracked attribute or subscript binding inside a scope.
 *
 * Equality is identity: two cells with the same key in different scopes are different bindings.
 */
public class DataCell {

    private final Object key;
    private int valueHandle;
    private final Scope scope;
    private final boolean subscript;

    /**
     * @param key         attribute name, or the subscript key
     * @param valueHandle identity handle of the last observed value, or -1 for null
     * @param scope       owning scope
     * @param subscript   whether the binding is a subscript rather than an attribute
     */
    public DataCell(Object key, int valueHandle, Scope scope, boolean subscript) {
        this.key = key;
        this.valueHandle = valueHandle;
        this.scope = scope;
        this.subscript = subscript;
    }

    public Object getKey()        { return key; }
    public String getName()       { return String.valueOf(key); }
    public int getValueHandle()   { return valueHandle; }
    public Scope getScope()       { return scope; }
    public boolean isSubscript()  { return subscript; }

    public void setValueHandle(int valueHandle) {
        this.valueHandle = valueHandle;
    }

    /** Copy of this binding owned by {@code other}. */
    DataCell copyInto(Scope other) {
        return new DataCell(key, valueHandle, other, subscript);
    }

    public String fullName() {
        return subscript ? scope.fullPath() + "[" + key + "]" : scope.fullPath() + "." + key;
    }

    @Override
    public String toString() {
        return "<" + fullName() + ">";
    }
}
