package io.regrada.core.project;

import io.regrada.core.layout.Position;

/// Canvas placement of one node as stored in a project file.
///
/// @param position top-left position, null when never laid out
/// @param width explicit width, null for the default
/// @param height explicit height, null for the default
public record NodeGeometry(Position position, Double width, Double height) {

    public static NodeGeometry at(Position position) {
        return new NodeGeometry(position, null, null);
    }

    public boolean hasSize() {
        return width != null && height != null;
    }

    public NodeGeometry withPosition(Position newPosition) {
        return new NodeGeometry(newPosition, width, height);
    }
}
