package com.cellsafety.analysis.instrument;

import com.cellsafety.analysis.syntax.Ast;
import com.cellsafety.analysis.syntax.Ast.Stmt;
import com.cellsafety.analysis.syntax.SiteId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of instrumenting one version of a cell.
 *
 * @param cellNumber  sequence number of the cell
 * @param codeName    synthetic code identity the host reports for frames of this cell
 * @param original    parsed tree before instrumentation
 * @param executable  tree with position markers and tracer calls, to be executed by the host
 * @param statements  original statement for every site, in marker order
 */
public record InstrumentedCell(
    int cellNumber,
    String codeName,
    Ast.Module original,
    Ast.Module executable,
    Map<SiteId, Stmt> statements
) {
    public InstrumentedCell {
        statements = Collections.unmodifiableMap(new LinkedHashMap<>(statements));
    }
}
