package io.regrada.core.projection.model;

import java.util.Objects;

/// Per-role compiled model returned by the compile service.
public record Projection(ProjectedRole role, ProjectionGraph graph) {

    public Projection {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
    }
}
