package com.cellsafety.tracer;

import com.cellsafety.analysis.instrument.InstrumentedCell;
import com.cellsafety.analysis.static_analysis.HyperedgeExtractor;
import com.cellsafety.analysis.syntax.Ast;
import com.cellsafety.analysis.syntax.SiteId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Statements of the current version of every instrumented cell, addressable by site or by line.
 */
public class StatementRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementRegistry.class);

    private final HyperedgeExtractor extractor = new HyperedgeExtractor();
    private final Map<Integer, CellStatements> cells = new HashMap<>();

    private record CellStatements(Map<SiteId, TracedStatement> bySite, Map<Integer, TracedStatement> byLine) {}

    /**
     * Registers every statement of {@code cell}, replacing the statements of a previously
     * registered version of the same cell.
     */
    public List<TracedStatement> register(InstrumentedCell cell) {
        Map<SiteId, TracedStatement> bySite = new LinkedHashMap<>();
        Map<Integer, TracedStatement> byLine = new HashMap<>();
        for (Map.Entry<SiteId, Ast.Stmt> entry : cell.statements().entrySet()) {
            Ast.Stmt stmt = entry.getValue();
            TracedStatement traced = new TracedStatement(entry.getKey(), stmt, extractor.extract(stmt));
            bySite.put(entry.getKey(), traced);
            // sites are in pre-order, so the outermost statement of a line wins
            byLine.putIfAbsent(stmt.line(), traced);
        }
        CellStatements previous = cells.put(cell.cellNumber(), new CellStatements(bySite, byLine));
        if (previous != null) {
            LOGGER.debug("replaced {} statements of cell {}", previous.bySite().size(), cell.cellNumber());
        }
        LOGGER.debug("registered {} statements of cell {}", bySite.size(), cell.cellNumber());
        return List.copyOf(bySite.values());
    }

    public Optional<TracedStatement> resolve(SiteId site) {
        CellStatements statements = cells.get(site.cellNumber());
        return statements == null ? Optional.empty() : Optional.ofNullable(statements.bySite().get(site));
    }

    /** First statement (in site order) that starts on {@code line} of cell {@code cellNumber}. */
    public Optional<TracedStatement> resolve(int cellNumber, int line) {
        CellStatements statements = cells.get(cellNumber);
        return statements == null ? Optional.empty() : Optional.ofNullable(statements.byLine().get(line));
    }

    public Collection<TracedStatement> statementsOf(int cellNumber) {
        CellStatements statements = cells.get(cellNumber);
        return statements == null ? List.of() : Collections.unmodifiableCollection(statements.bySite().values());
    }
}
