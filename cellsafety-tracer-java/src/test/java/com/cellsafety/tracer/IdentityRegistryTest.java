package com.cellsafety.tracer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentityRegistryTest {

    private final IdentityRegistry registry = new IdentityRegistry();

    @Test
    void sameObjectKeepsItsHandle() {
        Object o = new Object();
        int handle = registry.handleOf(o);
        assertEquals(handle, registry.handleOf(o));
        assertSame(o, registry.objectFor(handle));
    }

    @Test
    void equalButDistinctObjectsGetDistinctHandles() {
        String a = new String("same");
        String b = new String("same");
        assertNotEquals(registry.handleOf(a), registry.handleOf(b));
        assertEquals(2, registry.size());
    }

    @Test
    void findDoesNotAssign() {
        Object o = new Object();
        assertEquals(IdentityRegistry.UNBOUND, registry.find(o));
        assertEquals(0, registry.size());
        int handle = registry.handleOf(o);
        assertEquals(handle, registry.find(o));
    }

    @Test
    void nullHasNoHandle() {
        assertThrows(IllegalArgumentException.class, () -> registry.handleOf(null));
        assertEquals(IdentityRegistry.UNBOUND, registry.find(null));
    }

    @Test
    void unknownHandleIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.objectFor(3));
    }

    @Test
    void counterOnlyMovesForward() {
        TraceEventCounter counter = new TraceEventCounter();
        assertEquals(0, counter.get());
        assertEquals(1, counter.increment());
        assertEquals(2, counter.increment());
        assertEquals(2, counter.get());
    }
}
