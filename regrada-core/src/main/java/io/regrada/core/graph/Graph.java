package io.regrada.core.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable DCR choreography graph.
///
/// A graph is a pure value holding role declarations, the security lattice
/// text, events and scopes in insertion order, relations in insertion order,
/// and the id pools used to name new elements. Operations that change a graph
/// return a new value; see [io.regrada.core.edit.GraphEditor].
///
/// ### Validation
/// The builder checks that the global scope exists, every parent reference
/// names a known scope, the scope parent relation is a tree, and every
/// relation endpoint names a known event or scope.
///
/// @implNote Immutable and thread-safe after construction. The id pools are
/// copied on the way in and on the way out.
public final class Graph {

    private final List<Role> roles;
    private final String security;
    private final Map<String, Event> events;
    private final Map<String, Scope> scopes;
    private final List<Relation> relations;
    private final IdPools idPools;

    private Graph(Builder builder) {
        this.roles = List.copyOf(builder.roles);
        this.security = builder.security == null ? "" : builder.security;
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(builder.events));
        this.scopes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.scopes));
        this.relations = List.copyOf(builder.relations);
        this.idPools = builder.idPools.copy();

        validate();
    }

    private void validate() {
        Scope global = scopes.get(Scope.GLOBAL_ID);
        if (global == null || !global.isGlobal()) {
            throw new IllegalStateException("Graph requires the global scope");
        }
        for (Scope scope : scopes.values()) {
            if (scope.isGlobal() && !scope.id().equals(Scope.GLOBAL_ID)) {
                throw new IllegalStateException("Only '" + Scope.GLOBAL_ID + "' may be a global scope");
            }
            if (!scope.isGlobal() && !scopes.containsKey(scope.parent())) {
                throw new IllegalStateException(
                        "Scope '" + scope.id() + "' references unknown parent '" + scope.parent() + "'");
            }
            if (events.containsKey(scope.id())) {
                throw new IllegalStateException("Id '" + scope.id() + "' used by both an event and a scope");
            }
        }
        for (Scope scope : scopes.values()) {
            Set<String> seen = new HashSet<>();
            String current = scope.id();
            while (current != null) {
                if (!seen.add(current)) {
                    throw new IllegalStateException("Scope '" + scope.id() + "' is its own ancestor");
                }
                current = scopes.get(current).parent();
            }
        }
        for (Event event : events.values()) {
            if (!scopes.containsKey(event.getParent())) {
                throw new IllegalStateException(
                        "Event '" + event.getId() + "' references unknown scope '" + event.getParent() + "'");
            }
        }
        for (Relation relation : relations) {
            if (!contains(relation.source()) || !contains(relation.target())) {
                throw new IllegalStateException(
                        "Relation '" + relation.id() + "' references an unknown element");
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns an empty graph holding only the global scope.
    public static Graph empty() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.roles.addAll(roles);
        builder.security = security;
        builder.events.putAll(events);
        builder.scopes.putAll(scopes);
        builder.relations.addAll(relations);
        builder.idPools = idPools.copy();
        return builder;
    }

    public List<Role> getRoles() {
        return roles;
    }

    public Optional<Role> findRole(String label) {
        return roles.stream().filter(r -> r.label().equals(label)).findFirst();
    }

    /// Returns the security lattice text.
    ///
    /// @return lattice declaration, possibly multi-line, never null
    public String getSecurity() {
        return security;
    }

    /// Returns all events in insertion order.
    public Collection<Event> getEvents() {
        return events.values();
    }

    /// Returns all scopes in insertion order, the global scope first.
    public Collection<Scope> getScopes() {
        return scopes.values();
    }

    public List<Relation> getRelations() {
        return relations;
    }

    /// Returns a private copy of the id pools.
    ///
    /// @return mutable copy; changes do not affect this graph
    public IdPools getIdPools() {
        return idPools.copy();
    }

    public Optional<Event> findEvent(String id) {
        return Optional.ofNullable(events.get(id));
    }

    public Optional<Scope> findScope(String id) {
        return Optional.ofNullable(scopes.get(id));
    }

    public Optional<Relation> findRelation(String id) {
        return relations.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public boolean hasEvent(String id) {
        return events.containsKey(id);
    }

    public boolean hasScope(String id) {
        return scopes.containsKey(id);
    }

    /// Returns whether the id names an event or a scope.
    public boolean contains(String id) {
        return events.containsKey(id) || scopes.containsKey(id);
    }

    /// Returns the parent scope of an event or scope.
    ///
    /// @return parent scope id, or null for the global scope and unknown ids
    public String parentOf(String id) {
        Event event = events.get(id);
        if (event != null) {
            return event.getParent();
        }
        Scope scope = scopes.get(id);
        return scope == null ? null : scope.parent();
    }

    /// Returns whether `ancestorId` is `id` itself or one of its enclosing scopes.
    public boolean isWithin(String id, String ancestorId) {
        String current = id;
        while (current != null) {
            if (current.equals(ancestorId)) {
                return true;
            }
            current = parentOf(current);
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Graph other)) {
            return false;
        }
        return roles.equals(other.roles)
                && security.equals(other.security)
                && events.equals(other.events)
                && scopes.equals(other.scopes)
                && relations.equals(other.relations)
                && idPools.equals(other.idPools);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roles, security, events.keySet(), scopes.keySet(), relations);
    }

    @Override
    public String toString() {
        return "Graph{events=" + events.size() + ", scopes=" + scopes.size()
                + ", relations=" + relations.size() + "}";
    }

    public static final class Builder {
        private final List<Role> roles = new ArrayList<>();
        private String security = "";
        private final Map<String, Event> events = new LinkedHashMap<>();
        private final Map<String, Scope> scopes = new LinkedHashMap<>();
        private final List<Relation> relations = new ArrayList<>();
        private IdPools idPools = IdPools.initial();

        private Builder() {
            scopes.put(Scope.GLOBAL_ID, Scope.global());
        }

        public Builder roles(List<Role> roles) {
            this.roles.clear();
            this.roles.addAll(roles);
            return this;
        }

        public Builder role(Role role) {
            this.roles.add(role);
            return this;
        }

        public Builder security(String security) {
            this.security = security;
            return this;
        }

        /// Adds or replaces an event, keeping its original position.
        public Builder event(Event event) {
            events.put(event.getId(), event);
            return this;
        }

        public Builder removeEvent(String id) {
            events.remove(id);
            return this;
        }

        /// Adds or replaces a scope, keeping its original position.
        public Builder scope(Scope scope) {
            scopes.put(scope.id(), scope);
            return this;
        }

        public Builder removeScope(String id) {
            scopes.remove(id);
            return this;
        }

        public Builder relation(Relation relation) {
            relations.add(relation);
            return this;
        }

        public Builder relations(List<Relation> relations) {
            this.relations.clear();
            this.relations.addAll(relations);
            return this;
        }

        public Builder idPools(IdPools idPools) {
            this.idPools = Objects.requireNonNull(idPools, "idPools must not be null");
            return this;
        }

        /// Returns the builder's own pools, for allocating ids while building.
        public IdPools idPools() {
            return idPools;
        }

        public boolean hasEvent(String id) {
            return events.containsKey(id);
        }

        public boolean hasScope(String id) {
            return scopes.containsKey(id);
        }

        public Graph build() {
            return new Graph(this);
        }
    }
}
