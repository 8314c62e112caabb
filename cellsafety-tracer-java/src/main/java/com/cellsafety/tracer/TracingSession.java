package com.cellsafety.tracer;

import com.cellsafety.analysis.config.CellSafetyConfig;
import com.cellsafety.analysis.config.CellSafetyConfigReader;
import com.cellsafety.analysis.instrument.CellInstrumenter;
import com.cellsafety.analysis.instrument.InstrumentedCell;
import com.cellsafety.analysis.instrument.TracingHooks;
import com.cellsafety.analysis.syntax.SiteId;
import com.cellsafety.tracer.scope.NamespaceScope;
import com.cellsafety.tracer.scope.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Wires instrumentation, the tracing runtime and the event state machine for one interactive session.
 *
 * Typical host loop:
 * <pre>
 *   InstrumentedCell cell = session.instrumentCell(n, source);
 *   session.beginCellExecution(n);
 *   // run cell.executable() with session.hooks() bound to the tracer handle,
 *   // reporting every step through onTraceEvent(...)
 *   session.endCellExecution();
 * </pre>
 */
public class TracingSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(TracingSession.class);

    private final CellSafetyConfig config;
    private final IdentityRegistry identities = new IdentityRegistry();
    private final Map<Integer, NamespaceScope> namespaces = new HashMap<>();
    private final AliasIndex aliases = new AliasIndex();
    private final Scope globalScope = new Scope("<module>", null);
    private final TraceEventCounter counter = new TraceEventCounter();
    private final StatementRegistry statements = new StatementRegistry();
    private final CellInstrumenter instrumenter;
    private final AttributeTracer tracer;
    private final TraceStateMachine stateMachine;

    public TracingSession(CellSafetyConfig config, StatementFinishedListener listener) {
        this(config, new ReflectiveObjectModel(), new LexicalCallScopeResolver(), listener);
    }

    public TracingSession(
            CellSafetyConfig config,
            ObjectModel objectModel,
            CallScopeResolver callScopeResolver,
            StatementFinishedListener listener) {
        this.config = config;
        this.instrumenter = new CellInstrumenter(config);
        this.tracer = new AttributeTracer(identities, namespaces, aliases, globalScope, counter, objectModel, config);
        this.stateMachine = new TraceStateMachine(tracer, counter, statements, callScopeResolver, listener,
            globalScope, config.getCodeNamePrefix());
    }

    /**
     * Session configured from the JSON document at {@code configPath}, or from the defaults when
     * there is no such file.
     *
     * @throws CellSafetyConfigReader.ConfigReadException if the file exists but cannot be read
     */
    public static TracingSession fromConfigFile(Path configPath, StatementFinishedListener listener) {
        return new TracingSession(new CellSafetyConfigReader().readOrDefaults(configPath), listener);
    }

    /** Instruments a new version of a cell and makes its statements resolvable. */
    public InstrumentedCell instrumentCell(int cellNumber, String source) {
        InstrumentedCell cell = instrumenter.instrument(cellNumber, source);
        statements.register(cell);
        return cell;
    }

    /** Handle the executing cell's tracer calls must be dispatched to. */
    public TracingHooks hooks() {
        return tracer;
    }

    /** Resets execution records of the cell's statements before it runs again. */
    public void beginCellExecution(int cellNumber) {
        statements.statementsOf(cellNumber).forEach(TracedStatement::resetExecutionState);
        stateMachine.startExecution();
        LOGGER.debug("executing cell {}", cellNumber);
    }

    public void endCellExecution() {
        stateMachine.finishExecution();
    }

    /** Returns false if the event's frame is not part of any registered cell. */
    public boolean onTraceEvent(TraceEvent event, TraceFrame frame) {
        return stateMachine.onFrameEvent(event, frame);
    }

    /** Processes an event for a statement identified by the site of the last executed marker. */
    public void onTraceEvent(TraceEvent event, SiteId site) {
        TracedStatement statement = statements.resolve(site)
            .orElseThrow(() -> new IllegalArgumentException("unknown site " + site));
        stateMachine.onEvent(event, statement);
    }

    /**
     * Declares the namespace holding class-level bindings of {@code type}; instances of that
     * type start from a clone of it on first attribute access.
     */
    public NamespaceScope registerClassNamespace(Object type) {
        int handle = identities.handleOf(type);
        NamespaceScope scope = namespaces.get(handle);
        if (scope == null) {
            String name = type instanceof Class<?> cls ? cls.getSimpleName() : String.valueOf(type);
            scope = new NamespaceScope(handle, name, globalScope);
            namespaces.put(handle, scope);
        }
        return scope;
    }

    /**
     * Binds the namespace collected while a class statement's body ran to the class object the
     * statement produced.
     */
    public Optional<NamespaceScope> bindClassNamespace(TracedStatement classStatement, Object classObject) {
        NamespaceScope scope = classStatement.getClassScope();
        if (scope == null) {
            return Optional.empty();
        }
        int handle = identities.handleOf(classObject);
        scope.bind(handle);
        namespaces.put(handle, scope);
        LOGGER.debug("bound {} to class object #{}", scope, handle);
        return Optional.of(scope);
    }

    public Optional<NamespaceScope> namespaceOf(Object obj) {
        int handle = identities.find(obj);
        return handle == IdentityRegistry.UNBOUND ? Optional.empty() : Optional.ofNullable(namespaces.get(handle));
    }

    public CellSafetyConfig getConfig()             { return config; }
    public Scope getGlobalScope()                   { return globalScope; }
    public IdentityRegistry getIdentities()         { return identities; }
    public AliasIndex getAliases()                  { return aliases; }
    public TraceEventCounter getCounter()           { return counter; }
    public AttributeTracer getTracer()              { return tracer; }
    public StatementRegistry getStatements()        { return statements; }
    public TraceStateMachine getStateMachine()      { return stateMachine; }
}
