package io.regrada.core.projection.model;

import io.regrada.core.graph.RoleParameter;
import java.util.List;
import java.util.Objects;

/// The role a projection was computed for.
///
/// @param label role label, not null
/// @param params role parameters, never null
public record ProjectedRole(String label, List<RoleParameter> params) {

    public ProjectedRole {
        Objects.requireNonNull(label, "label must not be null");
        params = params == null ? List.of() : List.copyOf(params);
    }
}
