package io.regrada.core.engine;

import java.util.Objects;
import java.util.Optional;

/// Outcome of firing an event.
///
/// @param state state after firing, or the unchanged state on rejection
/// @param rejection reason the event did not fire, null on success
public record FireResult(SimulationState state, FireRejection rejection) {

    public FireResult {
        Objects.requireNonNull(state, "state must not be null");
    }

    public boolean isFired() {
        return rejection == null;
    }

    public Optional<FireRejection> getRejection() {
        return Optional.ofNullable(rejection);
    }
}
