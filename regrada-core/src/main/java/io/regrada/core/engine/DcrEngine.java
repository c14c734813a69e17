package io.regrada.core.engine;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RelationKind;
import io.regrada.core.graph.Scope;
import io.regrada.core.scope.ScopeIndex;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Interprets DCR marking semantics over a [Graph].
///
/// ### Firing an event `X`
/// `X` becomes executed and not pending. Then, per relation leaving `X`:
///
/// | kind | effect on target |
/// |---|---|
/// | condition | target's blocking count drops once `X` has executed |
/// | response | target becomes pending, `X` itself included |
/// | include | target becomes included |
/// | exclude | target becomes excluded, `X` itself included |
/// | milestone | target is unblocked once `X` is no longer pending |
/// | spawn | target subprocess is spawned |
///
/// After the direct effects one synchronous pass recomputes visibility from
/// the spawned subprocesses, recounts conditions and milestones over the
/// whole graph, and refreshes every event's executable flag. An event is
/// executable when it is included and has no blocking condition or milestone.
///
/// ### Scope endpoints
/// A relation with a scope endpoint acts on every leaf event of that scope.
/// Spawn targets stay the subprocess itself.
///
/// @implNote Stateless and thread-safe; states are immutable values.
public final class DcrEngine {

    private static final Logger logger = Logger.getLogger(DcrEngine.class.getName());

    private DcrEngine() {}

    /// Builds the initial simulation state.
    ///
    /// @param graph graph to simulate, not null
    /// @return initial state, never null
    public static SimulationState start(Graph graph) {
        Map<String, EventState> events = new LinkedHashMap<>();
        for (Event event : graph.getEvents()) {
            events.put(event.getId(), new EventState(
                    event.getMarking().included(), event.getMarking().pending(), false, false, false, 0, 0));
        }
        Map<String, Boolean> spawned = new LinkedHashMap<>();
        for (Scope scope : graph.getScopes()) {
            if (scope.isSubprocess()) {
                spawned.put(scope.id(), false);
            }
        }
        logger.info("Simulation started with " + events.size() + " events");
        return recompute(graph, effectiveRelations(graph), events, spawned);
    }

    /// Fires an event.
    ///
    /// @param graph simulated graph, not null
    /// @param state current state, not null
    /// @param eventId event to fire, not null
    /// @return the next state, or the unchanged state with a rejection
    public static FireResult fire(Graph graph, SimulationState state, String eventId) {
        if (!state.hasEvent(eventId)) {
            return reject(state, FireRejection.UNKNOWN_EVENT, eventId);
        }
        EventState current = state.event(eventId);
        if (!current.visible()) {
            return reject(state, FireRejection.EVENT_HIDDEN, eventId);
        }
        if (!current.executable()) {
            return reject(state, FireRejection.NOT_EXECUTABLE, eventId);
        }

        List<Relation> relations = effectiveRelations(graph);
        Map<String, EventState> events = new LinkedHashMap<>(state.events());
        Map<String, Boolean> spawned = new LinkedHashMap<>(state.spawned());
        events.put(eventId, current.fired());

        for (Relation relation : relations) {
            if (!relation.source().equals(eventId)) {
                continue;
            }
            String target = relation.target();
            switch (relation.kind()) {
                case RESPONSE -> events.put(target, events.get(target).withPending(true));
                case INCLUDE -> events.put(target, events.get(target).withIncluded(true));
                case EXCLUDE -> events.put(target, events.get(target).withIncluded(false));
                case SPAWN -> spawned.put(target, true);
                case CONDITION, MILESTONE -> {
                    // unblocking follows from the recount below
                }
            }
        }

        logger.info("Fired " + eventId);
        return new FireResult(recompute(graph, relations, events, spawned), null);
    }

    /// Expands scope endpoints into event-to-event relations.
    ///
    /// Self relations produced by expansion are kept only for kinds that allow them.
    static List<Relation> effectiveRelations(Graph graph) {
        ScopeIndex index = ScopeIndex.of(graph);
        List<Relation> effective = new ArrayList<>();
        for (Relation relation : graph.getRelations()) {
            if (relation.kind() == RelationKind.SPAWN) {
                for (Event source : index.leafEvents(relation.source())) {
                    effective.add(Relation.of(RelationKind.SPAWN, source.getId(), relation.target()));
                }
                continue;
            }
            if (graph.hasEvent(relation.source()) && graph.hasEvent(relation.target())) {
                effective.add(relation);
                continue;
            }
            for (Event source : index.leafEvents(relation.source())) {
                for (Event target : index.leafEvents(relation.target())) {
                    if (!source.getId().equals(target.getId()) || relation.kind().allowsSelfRelation()) {
                        effective.add(relation.withEndpoints(source.getId(), target.getId()));
                    }
                }
            }
        }
        return effective;
    }

    private static SimulationState recompute(
            Graph graph,
            List<Relation> relations,
            Map<String, EventState> events,
            Map<String, Boolean> spawned) {
        Map<String, Integer> conditions = new LinkedHashMap<>();
        Map<String, Integer> milestones = new LinkedHashMap<>();
        for (Relation relation : relations) {
            EventState source = events.get(relation.source());
            if (relation.kind() == RelationKind.CONDITION && !source.executed()) {
                conditions.merge(relation.target(), 1, Integer::sum);
            } else if (relation.kind() == RelationKind.MILESTONE && source.pending()) {
                milestones.merge(relation.target(), 1, Integer::sum);
            }
        }

        Map<String, EventState> refreshed = new LinkedHashMap<>();
        for (Map.Entry<String, EventState> entry : events.entrySet()) {
            String id = entry.getKey();
            refreshed.put(id, entry.getValue().refreshed(
                    isVisible(graph, id, spawned),
                    conditions.getOrDefault(id, 0),
                    milestones.getOrDefault(id, 0)));
        }
        return new SimulationState(refreshed, spawned);
    }

    private static boolean isVisible(Graph graph, String eventId, Map<String, Boolean> spawned) {
        String current = graph.parentOf(eventId);
        while (current != null) {
            if (spawned.containsKey(current) && !spawned.get(current)) {
                return false;
            }
            current = graph.parentOf(current);
        }
        return true;
    }

    private static FireResult reject(SimulationState state, FireRejection rejection, String eventId) {
        logger.info("Cannot fire " + eventId + ": " + rejection);
        return new FireResult(state, rejection);
    }
}
