package io.regrada.core.projection.model;

import io.regrada.core.graph.RelationKind;
import java.util.Objects;

/// Compiled relation: a control-flow relation or a spawn carrying a nested graph.
public sealed interface ProjectionRelation
        permits ProjectionRelation.ControlFlow, ProjectionRelation.Spawn {

    String sourceId();

    record ControlFlow(String sourceId, RelationKind kind, String targetId) implements ProjectionRelation {
        public ControlFlow {
            Objects.requireNonNull(sourceId, "sourceId must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(targetId, "targetId must not be null");
            if (kind == RelationKind.SPAWN) {
                throw new IllegalArgumentException("Spawn relations carry a graph");
            }
        }
    }

    record Spawn(String sourceId, ProjectionGraph graph) implements ProjectionRelation {
        public Spawn {
            Objects.requireNonNull(sourceId, "sourceId must not be null");
            Objects.requireNonNull(graph, "graph must not be null");
        }
    }
}
