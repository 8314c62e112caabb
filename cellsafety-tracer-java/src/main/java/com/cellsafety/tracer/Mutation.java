package com.cellsafety.tracer;

import java.util.List;

/**
 * A call of the form {@code target.method(args)} that is assumed to have mutated {@code target}:
 * it returned null and no other traced event happened between the callee lookup and the return.
 *
 * @param objectHandle  identity handle of the receiver
 * @param argumentNames bare-identifier arguments of the call, in order of first appearance
 */
public record Mutation(int objectHandle, List<String> argumentNames) {

    public Mutation {
        argumentNames = List.copyOf(argumentNames);
    }
}
