package com.cellsafety.tracer;

import com.cellsafety.analysis.syntax.Ast;
import com.cellsafety.tracer.scope.NamespaceScope;
import com.cellsafety.tracer.scope.Scope;

import java.util.Map;
import java.util.WeakHashMap;

/**
 * Resolves call scopes from the lexical structure of the cell:
 * a class body gets a fresh unbound namespace, a function body gets a child scope of the
 * scope it was defined in (one per definition, reused across calls), and a lambda runs in
 * the scope of its caller.
 */
public class LexicalCallScopeResolver implements CallScopeResolver {

    private final Map<TracedStatement, Scope> functionScopes = new WeakHashMap<>();

    @Override
    public Scope postCallScope(TracedStatement statement, Scope currentScope) {
        Scope definingScope = statement.getScope() != null ? statement.getScope() : currentScope;
        switch (statement.getKind()) {
            case CLASS_DEF:
                String className = ((Ast.ClassDef) statement.getNode()).name();
                return new NamespaceScope(IdentityRegistry.UNBOUND, className, definingScope);
            case FUNCTION_DEF:
                String functionName = ((Ast.FunctionDef) statement.getNode()).name();
                return functionScopes.computeIfAbsent(statement, s -> definingScope.makeChildScope(functionName));
            default:
                return currentScope;
        }
    }
}
