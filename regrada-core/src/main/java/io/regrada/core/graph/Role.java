package io.regrada.core.graph;

import java.util.List;
import java.util.Objects;

/// Choreography role declaration.
///
/// @param label unique short label used in role expressions, not null
/// @param name display name, defaults to the label
/// @param parameters ordered typed parameters, never null
/// @param participants concrete role instances such as `P(id=1)`, never null
public record Role(
        String label, String name, List<RoleParameter> parameters, List<String> participants) {

    public Role {
        Objects.requireNonNull(label, "label must not be null");
        name = name == null || name.isBlank() ? label : name;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public static Role of(String label, RoleParameter... parameters) {
        return new Role(label, label, List.of(parameters), List.of());
    }
}
