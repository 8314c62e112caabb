package com.cellsafety.analysis.instrument;

import java.util.OptionalInt;

/**
 * Synthetic code identities of instrumented cells, e.g. {@code <cell-12>}.
 * The host reports this name with every traced frame; the cell number is decoded from it.
 */
public final class CellCodeNames {

    private CellCodeNames() {}

    public static String of(String prefix, int cellNumber) {
        return prefix + cellNumber + ">";
    }

    /** Returns the cell number encoded in {@code codeName}, or empty for code that is not a cell. */
    public static OptionalInt parseCellNumber(String prefix, String codeName) {
        if (codeName == null || !codeName.startsWith(prefix)) {
            return OptionalInt.empty();
        }
        int start = prefix.length();
        int end = start;
        while (end < codeName.length() && Character.isDigit(codeName.charAt(end))) end++;
        if (end == start || end - start > 9) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(codeName.substring(start, end)));
    }
}
