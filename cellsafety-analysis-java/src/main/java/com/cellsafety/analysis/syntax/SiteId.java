package com.cellsafety.analysis.syntax;

/**
 * Stable key of one statement of one instrumented cell version.
 * Counters are assigned in strictly increasing order each time a cell is instrumented.
 */
public record SiteId(int cellNumber, int counter) implements Comparable<SiteId> {

    @Override
    public int compareTo(SiteId other) {
        int byCell = Integer.compare(cellNumber, other.cellNumber);
        return byCell != 0 ? byCell : Integer.compare(counter, other.counter);
    }

    @Override
    public String toString() {
        return "(" + cellNumber + ", " + counter + ")";
    }
}
