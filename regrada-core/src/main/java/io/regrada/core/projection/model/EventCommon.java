package io.regrada.core.projection.model;

import java.util.Objects;

/// Fields shared by every compiled event.
///
/// @param choreoElementUid choreography-level label, becomes the event label
/// @param endpointElementUid endpoint-level id, becomes the event id
/// @param label display name
/// @param dataType payload type, not null
/// @param included initial included flag
/// @param pending initial pending flag
/// @param instantiationConstraint optional conjunction constraining the self role
public record EventCommon(
        String choreoElementUid,
        String endpointElementUid,
        String label,
        DataType dataType,
        boolean included,
        boolean pending,
        Expression instantiationConstraint) {

    public EventCommon {
        Objects.requireNonNull(choreoElementUid, "choreoElementUid must not be null");
        Objects.requireNonNull(endpointElementUid, "endpointElementUid must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        label = label == null ? choreoElementUid : label;
    }
}
