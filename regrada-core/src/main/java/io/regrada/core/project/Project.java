package io.regrada.core.project;

import io.regrada.core.graph.Graph;
import io.regrada.core.layout.LayoutEngine;
import io.regrada.core.layout.LayoutRequest;
import io.regrada.core.layout.Position;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Contents of a project file: the graph, its source text, and node geometry.
///
/// @param graph the graph, not null
/// @param code source text last written or parsed, empty when unknown
/// @param geometry canvas placement by node id, never null
public record Project(Graph graph, String code, Map<String, NodeGeometry> geometry) {

    public Project {
        Objects.requireNonNull(graph, "graph must not be null");
        code = code == null ? "" : code;
        geometry = geometry == null ? Map.of() : Map.copyOf(geometry);
    }

    public static Project of(Graph graph, String code) {
        return new Project(graph, code, Map.of());
    }

    /// Returns a copy where every node without a position is placed by the engine.
    ///
    /// Explicit sizes are passed on to the layout request.
    public Project laidOut(LayoutEngine engine) {
        Map<String, double[]> sizes = new HashMap<>();
        geometry.forEach((id, g) -> {
            if (g.hasSize()) {
                sizes.put(id, new double[] {g.width(), g.height()});
            }
        });
        Map<String, Position> positions = engine.layout(LayoutRequest.of(graph, sizes));

        Map<String, NodeGeometry> placed = new LinkedHashMap<>(geometry);
        positions.forEach((id, position) -> {
            NodeGeometry current = placed.get(id);
            if (current == null) {
                placed.put(id, NodeGeometry.at(position));
            } else if (current.position() == null) {
                placed.put(id, current.withPosition(position));
            }
        });
        return new Project(graph, code, placed);
    }
}
