package io.regrada.core.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Immutable snapshot of a running simulation.
///
/// Holds one [EventState] per event, in graph order, and the spawned flag of
/// every subprocess. There is no terminal state: a snapshot answers which
/// events may fire at any time.
public final class SimulationState {

    private final Map<String, EventState> events;
    private final Map<String, Boolean> spawned;

    SimulationState(Map<String, EventState> events, Map<String, Boolean> spawned) {
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(events));
        this.spawned = Collections.unmodifiableMap(new LinkedHashMap<>(spawned));
    }

    /// Returns the state of one event.
    ///
    /// @throws IllegalArgumentException if the event is unknown
    public EventState event(String eventId) {
        EventState state = events.get(eventId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown event: " + eventId);
        }
        return state;
    }

    public boolean hasEvent(String eventId) {
        return events.containsKey(eventId);
    }

    public Map<String, EventState> events() {
        return events;
    }

    public boolean isExecutable(String eventId) {
        return event(eventId).executable();
    }

    public boolean isVisible(String eventId) {
        return event(eventId).visible();
    }

    /// Returns whether a subprocess has been spawned; false for unknown ids.
    public boolean isSpawned(String subprocessId) {
        return spawned.getOrDefault(subprocessId, false);
    }

    public Map<String, Boolean> spawned() {
        return spawned;
    }

    /// Returns the visible events that may fire now, in graph order.
    public List<String> enabledEvents() {
        List<String> enabled = new ArrayList<>();
        events.forEach((id, state) -> {
            if (state.visible() && state.executable()) {
                enabled.add(id);
            }
        });
        return enabled;
    }

    /// Returns the visible events still pending, in graph order.
    public List<String> pendingEvents() {
        List<String> pending = new ArrayList<>();
        events.forEach((id, state) -> {
            if (state.visible() && state.pending() && state.included()) {
                pending.add(id);
            }
        });
        return pending;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SimulationState other && events.equals(other.events) && spawned.equals(other.spawned);
    }

    @Override
    public int hashCode() {
        return events.hashCode() * 31 + spawned.hashCode();
    }

    @Override
    public String toString() {
        return "SimulationState{events=" + events + ", spawned=" + spawned + "}";
    }
}
