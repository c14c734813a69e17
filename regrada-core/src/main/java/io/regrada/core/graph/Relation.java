package io.regrada.core.graph;

import java.util.Objects;

/// Directed DCR relation between two events or scopes.
///
/// Ids follow the pattern `<letter>-<source>-<target>`, for example
/// `c-e0-e1` for a condition or `s-e1-s0` for a spawn. Spawn relations
/// never carry a guard.
///
/// @param id relation id, not null
/// @param kind relation kind, not null
/// @param source source event or scope id, not null
/// @param target target event or scope id, not null
/// @param guard boolean guard expression, empty when absent
public record Relation(String id, RelationKind kind, String source, String target, String guard) {

    public Relation {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        guard = guard == null ? "" : guard.trim();
    }

    /// Creates a relation with the conventional id.
    public static Relation of(RelationKind kind, String source, String target, String guard) {
        return new Relation(idFor(kind, source, target), kind, source, target, guard);
    }

    public static Relation of(RelationKind kind, String source, String target) {
        return of(kind, source, target, "");
    }

    /// Computes the conventional id for a relation.
    public static String idFor(RelationKind kind, String source, String target) {
        return kind.idLetter() + "-" + source + "-" + target;
    }

    public boolean hasGuard() {
        return !guard.isEmpty();
    }

    public boolean touches(String elementId) {
        return source.equals(elementId) || target.equals(elementId);
    }

    /// Returns a copy with endpoints renamed and the id recomputed.
    public Relation withEndpoints(String newSource, String newTarget) {
        return of(kind, newSource, newTarget, guard);
    }

    public Relation withGuard(String newGuard) {
        return new Relation(id, kind, source, target, newGuard);
    }
}
