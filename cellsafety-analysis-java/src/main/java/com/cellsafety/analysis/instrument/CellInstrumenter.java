package com.cellsafety.analysis.instrument;

import com.cellsafety.analysis.config.CellSafetyConfig;
import com.cellsafety.analysis.syntax.Ast.Module;
import com.cellsafety.analysis.syntax.CellParser;
import com.cellsafety.analysis.syntax.SourcePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates instrumentation of one cell version.
 * Produces an InstrumentedCell whose executable tree carries position markers and tracer calls.
 */
public class CellInstrumenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CellInstrumenter.class);

    private final CellSafetyConfig config;
    private final CellParser parser = new CellParser();

    public CellInstrumenter(CellSafetyConfig config) {
        this.config = config;
    }

    /**
     * @throws CellParser.ParseException    if the source is not valid cell code
     * @throws InstrumentationException     if the cell uses a construct that cannot be traced
     */
    public InstrumentedCell instrument(int cellNumber, String source) {
        // 1. Parse the cell source
        Module original = parser.parse(source);

        // 2. Insert a position marker before every statement
        StatementInserter inserter = new StatementInserter(cellNumber);
        Module marked = inserter.insert(original);

        // 3. Route attribute, subscript and method-call accesses through the tracing handle
        Module executable = new AttributeTracingRewriter(config.isTraceSubscripts()).rewrite(marked);

        String codeName = CellCodeNames.of(config.getCodeNamePrefix(), cellNumber);
        LOGGER.debug("instrumented {}: {} statement sites", codeName, inserter.getSites().size());
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{} executable form:\n{}", codeName, SourcePrinter.print(executable));
        }
        return new InstrumentedCell(cellNumber, codeName, original, executable, inserter.getSites());
    }
}
