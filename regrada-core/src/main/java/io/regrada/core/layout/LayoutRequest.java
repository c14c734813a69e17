package io.regrada.core.layout;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.Scope;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Nodes and edges of a graph, sized for layout.
///
/// Nodes without an explicit size get [#DEFAULT_WIDTH] by [#DEFAULT_HEIGHT].
public record LayoutRequest(List<LayoutNode> nodes, List<LayoutEdge> edges) {

    public static final double DEFAULT_WIDTH = 100;
    public static final double DEFAULT_HEIGHT = 100;

    public LayoutRequest {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /// Builds a request with default sizes for every node.
    public static LayoutRequest of(Graph graph) {
        return of(graph, Map.of());
    }

    /// Builds a request, taking sizes from `sizes` where present.
    ///
    /// @param sizes explicit `{width, height}` pairs by node id, not null
    public static LayoutRequest of(Graph graph, Map<String, double[]> sizes) {
        List<LayoutNode> nodes = new ArrayList<>();
        for (Scope scope : graph.getScopes()) {
            if (!scope.isGlobal()) {
                nodes.add(node(scope.id(), parentId(scope.parent()), sizes));
            }
        }
        for (Event event : graph.getEvents()) {
            nodes.add(node(event.getId(), parentId(event.getParent()), sizes));
        }
        List<LayoutEdge> edges = new ArrayList<>();
        for (Relation relation : graph.getRelations()) {
            edges.add(new LayoutEdge(relation.source(), relation.target()));
        }
        return new LayoutRequest(nodes, edges);
    }

    private static LayoutNode node(String id, String parentId, Map<String, double[]> sizes) {
        double[] size = sizes.get(id);
        if (size == null || size.length < 2) {
            return new LayoutNode(id, parentId, DEFAULT_WIDTH, DEFAULT_HEIGHT);
        }
        return new LayoutNode(id, parentId, size[0], size[1]);
    }

    private static String parentId(String scopeId) {
        return Scope.GLOBAL_ID.equals(scopeId) ? "" : scopeId;
    }
}
