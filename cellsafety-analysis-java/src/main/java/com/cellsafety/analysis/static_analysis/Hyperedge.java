package com.cellsafety.analysis.static_analysis;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names written (lvals) and read (rvals) by one statement, in first-seen order.
 */
public record Hyperedge(Set<String> writes, Set<String> reads) {

    public Hyperedge {
        writes = Collections.unmodifiableSet(new LinkedHashSet<>(writes));
        reads = Collections.unmodifiableSet(new LinkedHashSet<>(reads));
    }

    public static Hyperedge empty() {
        return new Hyperedge(Set.of(), Set.of());
    }
}
