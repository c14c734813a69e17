package io.regrada.core.layout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Left-to-right longest-path layering.
///
/// Each node's layer is the length of the longest edge chain reaching it.
/// On cyclic graphs relaxation stops after one round per node. Layers become
/// columns; nodes within a column stack top to bottom in request order.
public class LayeredLayout implements LayoutEngine {

    private final double horizontalGap;
    private final double verticalGap;

    public LayeredLayout() {
        this(50, 50);
    }

    public LayeredLayout(double horizontalGap, double verticalGap) {
        this.horizontalGap = horizontalGap;
        this.verticalGap = verticalGap;
    }

    @Override
    public Map<String, Position> layout(LayoutRequest request) {
        Map<String, Integer> layers = layers(request);

        Map<Integer, List<LayoutNode>> columns = new HashMap<>();
        int maxLayer = 0;
        for (LayoutNode node : request.nodes()) {
            int layer = layers.get(node.id());
            columns.computeIfAbsent(layer, k -> new ArrayList<>()).add(node);
            maxLayer = Math.max(maxLayer, layer);
        }

        Map<String, Position> positions = new LinkedHashMap<>();
        double x = 0;
        for (int layer = 0; layer <= maxLayer; layer++) {
            List<LayoutNode> column = columns.getOrDefault(layer, List.of());
            double y = 0;
            double columnWidth = 0;
            for (LayoutNode node : column) {
                positions.put(node.id(), new Position(x, y));
                y += node.height() + verticalGap;
                columnWidth = Math.max(columnWidth, node.width());
            }
            x += columnWidth + horizontalGap;
        }
        return positions;
    }

    private static Map<String, Integer> layers(LayoutRequest request) {
        Map<String, Integer> layers = new LinkedHashMap<>();
        for (LayoutNode node : request.nodes()) {
            layers.put(node.id(), 0);
        }
        int rounds = request.nodes().size();
        boolean changed = true;
        while (changed && rounds-- > 0) {
            changed = false;
            for (LayoutEdge edge : request.edges()) {
                Integer source = layers.get(edge.source());
                Integer target = layers.get(edge.target());
                if (source == null || target == null || edge.source().equals(edge.target())) {
                    continue;
                }
                if (target < source + 1) {
                    layers.put(edge.target(), source + 1);
                    changed = true;
                }
            }
        }
        return layers;
    }
}
