package io.regrada.core.graph;

import java.util.Objects;

/// Typed role parameter, such as `id:Integer`.
///
/// @param name parameter name, not null
/// @param type primitive type name, not null
public record RoleParameter(String name, String type) {

    public RoleParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
