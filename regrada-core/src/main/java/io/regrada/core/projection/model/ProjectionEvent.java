package io.regrada.core.projection.model;

import java.util.List;
import java.util.Objects;

/// Compiled event, as seen from the projected role.
public sealed interface ProjectionEvent
        permits ProjectionEvent.InputEvent, ProjectionEvent.ReceiveEvent, ProjectionEvent.ComputationEvent {

    EventCommon common();

    /// Input initiated by the projected role towards the receivers.
    record InputEvent(EventCommon common, List<RoleExpr> receivers) implements ProjectionEvent {
        public InputEvent {
            Objects.requireNonNull(common, "common must not be null");
            receivers = receivers == null ? List.of() : List.copyOf(receivers);
        }
    }

    /// Input received by the projected role from the initiators.
    record ReceiveEvent(EventCommon common, List<RoleExpr> initiators) implements ProjectionEvent {
        public ReceiveEvent {
            Objects.requireNonNull(common, "common must not be null");
            initiators = initiators == null ? List.of() : List.copyOf(initiators);
        }
    }

    /// Computation performed by the projected role.
    record ComputationEvent(EventCommon common, Expression dataExpr, List<RoleExpr> receivers)
            implements ProjectionEvent {
        public ComputationEvent {
            Objects.requireNonNull(common, "common must not be null");
            receivers = receivers == null ? List.of() : List.copyOf(receivers);
        }
    }
}
