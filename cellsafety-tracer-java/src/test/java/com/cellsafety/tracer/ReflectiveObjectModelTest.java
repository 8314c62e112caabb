package com.cellsafety.tracer;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ReflectiveObjectModelTest {

    static class Base {
        private String id = "base-id";
    }

    static class Account extends Base {
        private int balance = 10;
        private final String owner = "ada";

        int reads = 0;

        public String getOwnerName() {
            reads++;
            return owner.toUpperCase();
        }
    }

    record Pair(String left, int right) {}

    private final ReflectiveObjectModel model = new ReflectiveObjectModel();

    // --- attributes ---

    @Test
    void readsPrivateField() throws Exception {
        assertEquals(10, model.read(new Account(), "balance", false));
    }

    @Test
    void readsInheritedField() throws Exception {
        assertEquals("base-id", model.read(new Account(), "id", false));
    }

    @Test
    void neverInvokesAccessors() {
        Account account = new Account();
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(account, "ownerName", false));
        assertEquals(0, account.reads);
    }

    @Test
    void methodNamedLikeAttributeIsNotCalled() {
        Deque<String> deque = new ArrayDeque<>(List.of("a", "b"));
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(deque, "pop", false));
        assertEquals("a", deque.pop());
    }

    @Test
    void readsRecordComponent() throws Exception {
        assertEquals("l", model.read(new Pair("l", 2), "left", false));
    }

    @Test
    void missingAttributeFails() {
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(new Account(), "nope", false));
    }

    // --- subscripts ---

    @Test
    void readsMapEntryIncludingNullValue() throws Exception {
        Map<String, Integer> map = new java.util.HashMap<>();
        map.put("a", 1);
        map.put("gone", null);
        assertEquals(1, model.read(map, "a", true));
        assertNull(model.read(map, "gone", true));
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(map, "b", true));
    }

    @Test
    void readsListWithNegativeIndex() throws Exception {
        List<String> list = List.of("x", "y", "z");
        assertEquals("y", model.read(list, 1L, true));
        assertEquals("z", model.read(list, -1L, true));
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(list, 3L, true));
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(list, "1", true));
    }

    @Test
    void keysRejectedByTheMapFailTheLookup() {
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(Map.of("a", 1), null, true));
        assertThrows(ObjectModel.LookupFailedException.class,
            () -> model.read(new TreeMap<>(Map.of("a", 1)), 1L, true));
    }

    @Test
    void bigIntegerIndexMustFitInALong() throws Exception {
        List<String> list = List.of("x", "y");
        assertEquals("y", model.read(list, BigInteger.ONE, true));
        BigInteger huge = BigInteger.ONE.shiftLeft(64).add(BigInteger.ONE);
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(list, huge, true));
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(list, 1.0, true));
    }

    @Test
    void readsArraysAndStrings() throws Exception {
        assertEquals(5, model.read(new int[] {4, 5}, 1L, true));
        assertEquals("b", model.read("abc", 1L, true));
    }

    @Test
    void nonSubscriptableObjectFails() {
        assertThrows(ObjectModel.LookupFailedException.class, () -> model.read(new Account(), 0L, true));
    }

    @Test
    void typeOfIsRuntimeClass() {
        assertEquals(Account.class, model.typeOf(new Account()));
    }
}
