package io.regrada.core.scope;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.Scope;
import java.util.List;

/// Contents of one scope: its own events, its direct child scopes, and the
/// relations whose source endpoint it owns.
///
/// @param scope the scope itself, not null
/// @param events events whose parent is this scope, in document order
/// @param childScopes scopes whose parent is this scope, in document order
/// @param relations relations owned by this scope, in graph order
public record ScopeEntry(
        Scope scope, List<Event> events, List<Scope> childScopes, List<Relation> relations) {

    public ScopeEntry {
        events = List.copyOf(events);
        childScopes = List.copyOf(childScopes);
        relations = List.copyOf(relations);
    }
}
