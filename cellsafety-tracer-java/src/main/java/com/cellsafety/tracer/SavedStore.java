package com.cellsafety.tracer;

import com.cellsafety.tracer.scope.NamespaceScope;

/**
 * An attribute or subscript store observed during a statement. The stored value is not known
 * yet when the access is traced, so creating or updating the data cell is left to whoever
 * handles finished statements.
 */
public record SavedStore(NamespaceScope scope, Object obj, Object key, boolean isSubscript) {}
