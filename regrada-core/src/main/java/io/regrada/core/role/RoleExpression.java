package io.regrada.core.role;

import java.util.List;
import java.util.Objects;

/// Structured form of a role expression in an event's initiators or receivers.
public sealed interface RoleExpression permits RoleExpression.RoleRef, RoleExpression.EventRoleRef {

    /// Role label with parameter bindings, such as `P(id=1)`.
    record RoleRef(String label, List<ParameterBinding> bindings) implements RoleExpression {
        public RoleRef {
            Objects.requireNonNull(label, "label must not be null");
            bindings = bindings == null ? List.of() : List.copyOf(bindings);
        }
    }

    /// The initiator or receiver of another event, such as `@Initiator(e0)`.
    record EventRoleRef(Side side, String eventId) implements RoleExpression {
        public EventRoleRef {
            Objects.requireNonNull(side, "side must not be null");
            Objects.requireNonNull(eventId, "eventId must not be null");
        }
    }

    enum Side {
        INITIATOR("@Initiator"),
        RECEIVER("@Receiver");

        private final String keyword;

        Side(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }
}
