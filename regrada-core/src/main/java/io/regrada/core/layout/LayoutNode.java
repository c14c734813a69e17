package io.regrada.core.layout;

import java.util.Objects;

/// Node handed to a layout engine.
///
/// @param id event or scope id, not null
/// @param parentId enclosing scope id, empty for top-level nodes
/// @param width node width, positive
/// @param height node height, positive
public record LayoutNode(String id, String parentId, double width, double height) {

    public LayoutNode {
        Objects.requireNonNull(id, "id must not be null");
        parentId = parentId == null ? "" : parentId;
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Node '" + id + "' needs a positive size");
        }
    }
}
