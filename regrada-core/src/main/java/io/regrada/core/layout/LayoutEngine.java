package io.regrada.core.layout;

import java.util.Map;

/// Computes node positions for a graph drawing.
///
/// Implementations are pure: the same request always yields the same positions.
@FunctionalInterface
public interface LayoutEngine {

    /// Lays out the request's nodes.
    ///
    /// @param request sized nodes and edges, not null
    /// @return position per node id, covering every node in the request
    Map<String, Position> layout(LayoutRequest request);
}
