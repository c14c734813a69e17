package io.regrada.core.graph;

/// Structural checks applied before a relation enters a graph.
public final class GraphValidator {

    private GraphValidator() {}

    /// Returns whether a relation is a valid spawn, or not a spawn at all.
    ///
    /// A spawn must target a subprocess scope.
    public static boolean isValidSpawn(Graph graph, Relation relation) {
        if (relation.kind() != RelationKind.SPAWN) {
            return true;
        }
        return graph.findScope(relation.target()).map(Scope::isSubprocess).orElse(false);
    }

    /// Returns whether a relation of the given kind already joins the ordered pair.
    public static boolean relationExists(Graph graph, String source, String target, RelationKind kind) {
        for (Relation relation : graph.getRelations()) {
            if (relation.kind() == kind
                    && relation.source().equals(source)
                    && relation.target().equals(target)) {
                return true;
            }
        }
        return false;
    }

    /// Returns whether some spawn relation targets the scope.
    public static boolean isSpawnTarget(Graph graph, String scopeId) {
        for (Relation relation : graph.getRelations()) {
            if (relation.kind() == RelationKind.SPAWN && relation.target().equals(scopeId)) {
                return true;
            }
        }
        return false;
    }
}
