package com.cellsafety.tracer;

import com.cellsafety.analysis.static_analysis.Hyperedge;
import com.cellsafety.analysis.syntax.Ast;
import com.cellsafety.analysis.syntax.CellParser;
import com.cellsafety.analysis.syntax.SiteId;
import com.cellsafety.tracer.scope.NamespaceScope;
import com.cellsafety.tracer.scope.Scope;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LexicalCallScopeResolverTest {

    private final LexicalCallScopeResolver resolver = new LexicalCallScopeResolver();
    private final Scope global = new Scope("<module>", null);

    private static TracedStatement statement(String source) {
        Ast.Stmt stmt = new CellParser().parse(source).body().get(0);
        return new TracedStatement(new SiteId(0, 0), stmt, Hyperedge.empty());
    }

    @Test
    void functionBodyGetsOneChildScopePerDefinition() {
        TracedStatement def = statement("def f(x):\n    return x\n");
        def.bindScope(global);

        Scope first = resolver.postCallScope(def, global);
        Scope second = resolver.postCallScope(def, new Scope("elsewhere", null));

        assertEquals("f", first.getName());
        assertSame(global, first.getParent());
        assertSame(first, second);
    }

    @Test
    void classBodyGetsFreshUnboundNamespace() {
        TracedStatement cls = statement("class Foo:\n    pass\n");
        cls.bindScope(global);

        Scope body = resolver.postCallScope(cls, global);

        NamespaceScope namespace = assertInstanceOf(NamespaceScope.class, body);
        assertEquals("Foo", namespace.getName());
        assertFalse(namespace.isBound());
        assertNotSame(body, resolver.postCallScope(cls, global));
    }

    @Test
    void lambdaRunsInCallerScope() {
        TracedStatement assign = statement("g = lambda q: q\n");
        Scope caller = global.makeChildScope("caller");
        assertSame(caller, resolver.postCallScope(assign, caller));
    }

    @Test
    void unboundDefinitionUsesCurrentScope() {
        TracedStatement def = statement("def h():\n    pass\n");
        Scope current = global.makeChildScope("outer");
        assertSame(current, resolver.postCallScope(def, current).getParent());
    }
}
