package com.cellsafety.tracer;

import com.cellsafety.analysis.config.CellSafetyConfig;
import com.cellsafety.analysis.instrument.TracingHooks;
import com.cellsafety.analysis.syntax.Ast.ExprContext;
import com.cellsafety.tracer.scope.DataCell;
import com.cellsafety.tracer.scope.NamespaceScope;
import com.cellsafety.tracer.scope.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runtime side of attribute and subscript instrumentation.
 *
 * Instrumented code calls {@link #begin} for every link of an access chain, {@link #end} once the
 * outermost link has been evaluated, {@link #key} to index a traced subscript, and
 * {@link #recordArgument} for bare-identifier arguments of method calls. From these the tracer resolves a namespace scope per accessed object, collects the
 * data cells loaded by the current statement, buffers stores and detects likely in-place mutations.
 *
 * Frame state is saved by {@link #push} on every call and restored by {@link #pop} on the matching
 * return. Not thread-safe: one tracer follows one executing call stack.
 */
public class AttributeTracer implements TracingHooks {

    private static final Logger LOGGER = LoggerFactory.getLogger(AttributeTracer.class);

    /** Pending hint that a call-position load may turn out to be a mutation. */
    public record MutationCandidate(long counter, int objectHandle) {}

    /** Everything {@link #push} saves and {@link #pop} restores. */
    record FrameSnapshot(
        List<SavedStore> savedStores,
        Set<Mutation> mutations,
        MutationCandidate mutationCandidate,
        Set<String> recordedArguments,
        Scope activeScope,
        Scope originalActiveScope
    ) {}

    private final IdentityRegistry identities;
    private final Map<Integer, NamespaceScope> namespaces;
    private final AliasIndex aliases;
    private final TraceEventCounter counter;
    private final ObjectModel objectModel;
    private final boolean trackMutations;
    private final String unknownNamespaceName;

    private Scope originalActiveScope;
    private Scope activeScope;
    private Set<DataCell> loadedDataCells = new LinkedHashSet<>();
    private List<SavedStore> savedStores = new ArrayList<>();
    private Set<Mutation> mutations = new LinkedHashSet<>();
    private Set<String> recordedArguments = new LinkedHashSet<>();
    private MutationCandidate mutationCandidate;
    private Object lastKey;
    private final Deque<FrameSnapshot> stack = new ArrayDeque<>();

    public AttributeTracer(
            IdentityRegistry identities,
            Map<Integer, NamespaceScope> namespaces,
            AliasIndex aliases,
            Scope activeScope,
            TraceEventCounter counter,
            ObjectModel objectModel,
            CellSafetyConfig config) {
        this.identities = identities;
        this.namespaces = namespaces;
        this.aliases = aliases;
        this.originalActiveScope = activeScope;
        this.activeScope = activeScope;
        this.counter = counter;
        this.objectModel = objectModel;
        this.trackMutations = config.isTrackMutations();
        this.unknownNamespaceName = config.getUnknownNamespaceName();
    }

    // -----------------------------------------------------------------------
    // Hooks
    // -----------------------------------------------------------------------

    @Override
    public Object begin(Object obj, Object key, boolean isSubscript, ExprContext ctx,
                        boolean inCallPosition, boolean makeActive) {
        lastKey = key;
        if (obj == null) {
            return null;
        }
        int handle = identities.handleOf(obj);
        NamespaceScope scope = resolveNamespace(obj, handle, isSubscript);
        if (makeActive) {
            activeScope = scope;
        }

        if (ctx == ExprContext.LOAD) {
            if (inCallPosition) {
                // a dependency or a mutation, depending on what the call returns
                mutationCandidate = trackMutations ? new MutationCandidate(counter.get(), handle) : null;
            } else {
                mutationCandidate = null;
                DataCell cell = lookupOrCreate(scope, obj, key, isSubscript);
                if (cell != null) {
                    loadedDataCells.add(cell);
                }
            }
        } else if (ctx == ExprContext.STORE || ctx == ExprContext.AUG_STORE) {
            savedStores.add(new SavedStore(scope, obj, key, isSubscript));
        }
        return obj;
    }

    @Override
    public Object end(Object obj) {
        if (mutationCandidate != null) {
            MutationCandidate candidate = mutationCandidate;
            mutationCandidate = null;
            if (candidate.counter() == counter.get() && obj == null) {
                Mutation mutation = new Mutation(candidate.objectHandle(), new ArrayList<>(recordedArguments));
                mutations.add(mutation);
                LOGGER.debug("recorded mutation {}", mutation);
            }
        }
        activeScope = originalActiveScope;
        recordedArguments = new LinkedHashSet<>();
        return obj;
    }

    @Override
    public Object recordArgument(Object obj, String name) {
        recordedArguments.add(name);
        return obj;
    }

    @Override
    public Object key() {
        return lastKey;
    }

    private NamespaceScope resolveNamespace(Object obj, int handle, boolean isSubscript) {
        NamespaceScope scope = namespaces.get(handle);
        if (scope != null) {
            return scope;
        }
        NamespaceScope classScope = isSubscript ? null : namespaces.get(identities.find(objectModel.typeOf(obj)));
        if (classScope != null) {
            scope = classScope.cloneFor(handle);
            LOGGER.debug("cloned {} for object #{}", classScope, handle);
        } else {
            String name = aliases.nameFor(handle).orElse(unknownNamespaceName);
            scope = new NamespaceScope(handle, name, activeScope);
            LOGGER.debug("created {}", scope);
        }
        namespaces.put(handle, scope);
        return scope;
    }

    private DataCell lookupOrCreate(NamespaceScope scope, Object obj, Object key, boolean isSubscript) {
        DataCell cell = scope.lookupDataCellByNameThisIndentation(key);
        if (cell != null) {
            return cell;
        }
        Object value;
        try {
            value = objectModel.read(obj, key, isSubscript);
        } catch (ObjectModel.LookupFailedException e) {
            LOGGER.debug("dropped load of {} in {}: {}", key, scope, e.getMessage());
            return null;
        }
        int valueHandle = value == null ? IdentityRegistry.UNBOUND : identities.handleOf(value);
        cell = new DataCell(key, valueHandle, scope, isSubscript);
        scope.put(key, cell);
        if (value != null) {
            aliases.add(valueHandle, cell);
        }
        return cell;
    }

    // -----------------------------------------------------------------------
    // Frame stack
    // -----------------------------------------------------------------------

    /** Saves the frame state and starts a fresh one whose scopes are {@code newScope}. */
    public void push(Scope newScope) {
        stack.push(new FrameSnapshot(savedStores, mutations, mutationCandidate, recordedArguments,
            activeScope, originalActiveScope));
        savedStores = new ArrayList<>();
        mutations = new LinkedHashSet<>();
        recordedArguments = new LinkedHashSet<>();
        originalActiveScope = newScope;
        activeScope = newScope;
    }

    /**
     * Restores the frame state saved by the matching {@link #push}.
     *
     * @throws TracingInvariantError if there is no saved frame
     */
    public void pop() {
        if (stack.isEmpty()) {
            throw new TracingInvariantError("pop without a matching push");
        }
        FrameSnapshot snapshot = stack.pop();
        savedStores = snapshot.savedStores();
        mutations = snapshot.mutations();
        mutationCandidate = snapshot.mutationCandidate();
        recordedArguments = snapshot.recordedArguments();
        activeScope = snapshot.activeScope();
        originalActiveScope = snapshot.originalActiveScope();
    }

    /** Clears per-statement state; scopes, namespaces and aliases are kept. */
    public void reset() {
        loadedDataCells = new LinkedHashSet<>();
        savedStores = new ArrayList<>();
        mutations = new LinkedHashSet<>();
        mutationCandidate = null;
        activeScope = originalActiveScope;
    }

    // -----------------------------------------------------------------------
    // Accessors
    // -----------------------------------------------------------------------

    public Set<DataCell> getLoadedDataCells()  { return Collections.unmodifiableSet(loadedDataCells); }
    public List<SavedStore> getSavedStores()   { return Collections.unmodifiableList(savedStores); }
    public Set<Mutation> getMutations()        { return Collections.unmodifiableSet(mutations); }
    public Set<String> getRecordedArguments()  { return Collections.unmodifiableSet(recordedArguments); }
    public Optional<MutationCandidate> getMutationCandidate() { return Optional.ofNullable(mutationCandidate); }
    public Scope getActiveScope()              { return activeScope; }
    public Scope getOriginalActiveScope()      { return originalActiveScope; }
    public int getStackDepth()                 { return stack.size(); }

    /** Snapshot on top of the stack, for checking that {@link #pop} restores exactly what was saved. */
    Optional<FrameSnapshot> peekSnapshot() {
        return Optional.ofNullable(stack.peek());
    }
}
