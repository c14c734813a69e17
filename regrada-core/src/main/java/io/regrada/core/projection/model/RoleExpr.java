package io.regrada.core.projection.model;

import java.util.List;
import java.util.Objects;

/// Compiled role expression naming a counterpart of an interaction.
public sealed interface RoleExpr permits RoleExpr.RoleRef, RoleExpr.InitiatorOf, RoleExpr.ReceiverOf {

    /// Role with parameter values; a null value means "any instance".
    record RoleRef(String roleLabel, List<Param> params) implements RoleExpr {
        public RoleRef {
            Objects.requireNonNull(roleLabel, "roleLabel must not be null");
            params = params == null ? List.of() : List.copyOf(params);
        }
    }

    /// The initiator of another event.
    record InitiatorOf(String eventId) implements RoleExpr {
        public InitiatorOf {
            Objects.requireNonNull(eventId, "eventId must not be null");
        }
    }

    /// The receiver of another event.
    record ReceiverOf(String eventId) implements RoleExpr {
        public ReceiverOf {
            Objects.requireNonNull(eventId, "eventId must not be null");
        }
    }

    /// @param name parameter name, not null
    /// @param value parameter value, null for a wildcard
    record Param(String name, Expression value) {
        public Param {
            Objects.requireNonNull(name, "name must not be null");
        }
    }
}
