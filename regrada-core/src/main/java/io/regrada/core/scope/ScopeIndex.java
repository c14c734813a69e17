package io.regrada.core.scope;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.Scope;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Tree of lexical scopes built once from a flat [Graph].
///
/// Each scope maps to a [ScopeEntry] holding its local events, child scopes
/// and owned relations. A relation belongs to the scope that owns its source:
/// the parent of a source event, or the parent of a source scope.
///
/// ### Name resolution
/// [#resolve(String, String)] searches the current scope, then each ancestor
/// in turn, and finally falls back to the first event with that label
/// anywhere in the graph, in document order.
///
/// @implNote Immutable once built. Build one index per batch of reads rather
/// than rescanning parent links.
public final class ScopeIndex {

    private final Graph graph;
    private final Map<String, ScopeEntry> entries;

    private ScopeIndex(Graph graph, Map<String, ScopeEntry> entries) {
        this.graph = graph;
        this.entries = Collections.unmodifiableMap(entries);
    }

    /// Builds the index for a graph.
    ///
    /// @param graph source graph, not null
    /// @return index, never null
    public static ScopeIndex of(Graph graph) {
        Map<String, List<Event>> events = new LinkedHashMap<>();
        Map<String, List<Scope>> children = new LinkedHashMap<>();
        Map<String, List<Relation>> relations = new LinkedHashMap<>();
        for (Scope scope : graph.getScopes()) {
            events.put(scope.id(), new ArrayList<>());
            children.put(scope.id(), new ArrayList<>());
            relations.put(scope.id(), new ArrayList<>());
        }
        for (Event event : graph.getEvents()) {
            events.get(event.getParent()).add(event);
        }
        for (Scope scope : graph.getScopes()) {
            if (!scope.isGlobal()) {
                children.get(scope.parent()).add(scope);
            }
        }
        for (Relation relation : graph.getRelations()) {
            String owner = graph.parentOf(relation.source());
            relations.get(owner == null ? Scope.GLOBAL_ID : owner).add(relation);
        }

        Map<String, ScopeEntry> entries = new LinkedHashMap<>();
        for (Scope scope : graph.getScopes()) {
            entries.put(
                    scope.id(),
                    new ScopeEntry(
                            scope,
                            events.get(scope.id()),
                            children.get(scope.id()),
                            relations.get(scope.id())));
        }
        return new ScopeIndex(graph, entries);
    }

    public Graph graph() {
        return graph;
    }

    /// Returns the entry for a scope.
    ///
    /// @throws IllegalArgumentException if the scope is unknown
    public ScopeEntry entry(String scopeId) {
        ScopeEntry entry = entries.get(scopeId);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown scope: " + scopeId);
        }
        return entry;
    }

    public ScopeEntry global() {
        return entry(Scope.GLOBAL_ID);
    }

    /// Returns the scope chain from the given scope up to the global scope.
    public List<Scope> ancestry(String scopeId) {
        List<Scope> chain = new ArrayList<>();
        String current = scopeId;
        while (current != null) {
            Scope scope = entry(current).scope();
            chain.add(scope);
            current = scope.parent();
        }
        return chain;
    }

    /// Resolves an event label as seen from a scope.
    ///
    /// @param label event label, not null
    /// @param scopeId scope the label is written in, not null
    /// @return resolved event, or empty if no event carries the label
    public Optional<Event> resolve(String label, String scopeId) {
        for (Scope scope : ancestry(scopeId)) {
            for (Event event : entry(scope.id()).events()) {
                if (event.getLabel().equals(label)) {
                    return Optional.of(event);
                }
            }
        }
        for (Event event : graph.getEvents()) {
            if (event.getLabel().equals(label)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    /// Expands an element to the events it stands for.
    ///
    /// @param id event or scope id
    /// @return the event itself, or every event contained at any depth in the
    ///     scope in document order; empty for unknown ids
    public List<Event> leafEvents(String id) {
        Optional<Event> event = graph.findEvent(id);
        if (event.isPresent()) {
            return List.of(event.get());
        }
        if (!entries.containsKey(id)) {
            return List.of();
        }
        List<Event> leaves = new ArrayList<>();
        for (Event candidate : graph.getEvents()) {
            if (graph.isWithin(candidate.getId(), id)) {
                leaves.add(candidate);
            }
        }
        return leaves;
    }

    /// Returns the nearest scope enclosing (or equal to) `scopeId` that has a
    /// textual block: the global scope or a subprocess.
    public Scope blockOf(String scopeId) {
        for (Scope scope : ancestry(scopeId)) {
            if (scope.kind().hasBlock()) {
                return scope;
            }
        }
        return entry(Scope.GLOBAL_ID).scope();
    }

    /// Returns the nest scopes directly or transitively inside a block that
    /// print into that block.
    public List<Scope> nestsFlattenedInto(String blockId) {
        List<Scope> nests = new ArrayList<>();
        collectNests(blockId, nests);
        return nests;
    }

    private void collectNests(String scopeId, List<Scope> nests) {
        for (Scope child : entry(scopeId).childScopes()) {
            if (!child.kind().hasBlock()) {
                nests.add(child);
                collectNests(child.id(), nests);
            }
        }
    }

    /// Returns the subprocesses whose nearest enclosing block is `blockId`.
    public List<Scope> subprocessesOf(String blockId) {
        List<Scope> result = new ArrayList<>();
        for (ScopeEntry entry : entries.values()) {
            Scope scope = entry.scope();
            if (scope.isSubprocess() && blockOf(scope.parent()).id().equals(blockId)) {
                result.add(scope);
            }
        }
        return result;
    }
}
