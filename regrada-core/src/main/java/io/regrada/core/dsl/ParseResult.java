package io.regrada.core.dsl;

import io.regrada.core.graph.Graph;
import java.util.List;
import java.util.Objects;

/// Graph built from source text plus every problem found while building it.
///
/// The graph holds everything that parsed; lines with errors contribute nothing.
///
/// @param graph parsed graph, never null
/// @param errors problems in line order, never null
public record ParseResult(Graph graph, List<ParseError> errors) {

    public ParseResult {
        Objects.requireNonNull(graph, "graph must not be null");
        errors = List.copyOf(errors);
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }
}
