package io.regrada.core.layout;

import java.util.Objects;

/// Directed edge handed to a layout engine.
public record LayoutEdge(String source, String target) {

    public LayoutEdge {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }
}
