package io.regrada.core.edit;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.EventKind;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.GraphValidator;
import io.regrada.core.graph.IdAllocator;
import io.regrada.core.graph.IdPools;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RelationKind;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.Scope;
import io.regrada.core.graph.ScopeKind;
import io.regrada.core.graph.ValueType;
import io.regrada.core.scope.ScopeIndex;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Pure edit operations over [Graph] values.
///
/// Every operation validates first and applies second. A business-rule
/// violation never throws: the operation returns an [EditResult] carrying a
/// [Rejection] and the unchanged input graph. Rejections are logged at INFO.
///
/// ### Id allocation
/// New events take the smallest free `e<n>`, new nests `n<n>` and new
/// subprocesses `s<n>`. Removing an element returns its id to the pool so
/// the next creation reuses it.
///
/// @implNote Stateless and thread-safe.
public final class GraphEditor {

    private static final Logger logger = Logger.getLogger(GraphEditor.class.getName());

    private GraphEditor() {}

    /// Creates an event with default marking in the given scope.
    ///
    /// @param graph graph to edit, not null
    /// @param kind input or computation, not null
    /// @param parentScope owning scope id, not null
    /// @return result whose `createdId` is the new event id
    public static EditResult addEvent(Graph graph, EventKind kind, String parentScope) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (!graph.hasScope(parentScope)) {
            return reject(graph, Rejection.UNKNOWN_SCOPE, parentScope);
        }
        Graph.Builder builder = graph.toBuilder();
        String id = builder.idPools().events().allocate();
        Event.Builder event = Event.builder().id(id).label(id).name(id).kind(kind).parent(parentScope);
        if (kind == EventKind.INPUT) {
            event.valueType(ValueType.unit());
        }
        builder.event(event.build());
        logger.info("Added " + kind.name().toLowerCase() + " event " + id + " to " + parentScope);
        return EditResult.created(builder.build(), id);
    }

    /// Creates an empty nest or subprocess in the given scope.
    ///
    /// @return result whose `createdId` is the new scope id
    public static EditResult addScope(Graph graph, ScopeKind kind, String parentScope) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == ScopeKind.GLOBAL) {
            return reject(graph, Rejection.INVALID_SCOPE_KIND, kind.name());
        }
        if (!graph.hasScope(parentScope)) {
            return reject(graph, Rejection.UNKNOWN_SCOPE, parentScope);
        }
        Graph.Builder builder = graph.toBuilder();
        String id = builder.idPools().forScope(kind).allocate();
        Scope scope = kind == ScopeKind.NEST
                ? Scope.nest(id, parentScope)
                : Scope.subprocess(id, parentScope);
        builder.scope(scope);
        logger.info("Added " + kind.jsonName() + " " + id + " to " + parentScope);
        return EditResult.created(builder.build(), id);
    }

    /// Replaces the fields of an existing event.
    ///
    /// The id and owning scope are kept; use [#moveNode] to change the scope.
    public static EditResult updateEvent(Graph graph, Event updated) {
        Optional<Event> current = graph.findEvent(updated.getId());
        if (current.isEmpty()) {
            return reject(graph, Rejection.UNKNOWN_ENTITY, updated.getId());
        }
        String parent = current.get().getParent();
        Event event = updated.getParent().equals(parent) ? updated : updated.withParent(parent);
        Graph edited = graph.toBuilder().event(event).build();
        if (labelClash(edited, List.of(event.getId()))) {
            return reject(graph, Rejection.DUPLICATE_LABEL, updated.getLabel());
        }
        logger.info("Updated event " + event.getId());
        return EditResult.applied(edited);
    }

    /// Re-parents an event or a scope.
    public static EditResult moveNode(Graph graph, String id, String newParent) {
        if (!graph.contains(id) || Scope.GLOBAL_ID.equals(id)) {
            return reject(graph, Rejection.UNKNOWN_ENTITY, id);
        }
        if (!graph.hasScope(newParent)) {
            return reject(graph, Rejection.UNKNOWN_SCOPE, newParent);
        }
        Graph.Builder builder = graph.toBuilder();
        Optional<Event> event = graph.findEvent(id);
        if (event.isPresent()) {
            builder.event(event.get().withParent(newParent));
        } else {
            if (graph.isWithin(newParent, id)) {
                return reject(graph, Rejection.SCOPE_CYCLE, id + " -> " + newParent);
            }
            builder.scope(graph.findScope(id).orElseThrow().withParent(newParent));
        }
        Graph moved = builder.build();
        if (labelClash(moved, leafIds(moved, id))) {
            return reject(graph, Rejection.DUPLICATE_LABEL, id + " -> " + newParent);
        }
        logger.info("Moved " + id + " to " + newParent);
        return EditResult.applied(moved);
    }

    /// Removes elements together with everything they contain.
    ///
    /// Every relation touching a removed element is dropped and every removed
    /// id returns to its pool.
    public static EditResult removeNodes(Graph graph, Collection<String> ids) {
        for (String id : ids) {
            if (!graph.contains(id) || Scope.GLOBAL_ID.equals(id)) {
                return reject(graph, Rejection.UNKNOWN_ENTITY, id);
            }
        }
        Set<String> removed = new LinkedHashSet<>();
        for (Event event : graph.getEvents()) {
            if (ids.stream().anyMatch(id -> graph.isWithin(event.getId(), id))) {
                removed.add(event.getId());
            }
        }
        for (Scope scope : graph.getScopes()) {
            if (ids.stream().anyMatch(id -> graph.isWithin(scope.id(), id))) {
                removed.add(scope.id());
            }
        }

        Graph.Builder builder = graph.toBuilder();
        IdPools pools = builder.idPools();
        for (String id : removed) {
            if (graph.hasEvent(id)) {
                builder.removeEvent(id);
            } else {
                builder.removeScope(id);
            }
            pools.release(id);
        }
        List<Relation> kept = new ArrayList<>();
        for (Relation relation : graph.getRelations()) {
            if (!removed.contains(relation.source()) && !removed.contains(relation.target())) {
                kept.add(relation);
            }
        }
        builder.relations(kept);
        logger.info("Removed " + removed);
        return EditResult.applied(builder.build());
    }

    /// Adds a relation after checking endpoint, spawn, self-relation and duplicate rules.
    ///
    /// Spawn relations are placed before all other relations. A spawn trigger
    /// must sit in the block that encloses the subprocess or further out,
    /// where its label resolves from the subprocess's spawn line.
    ///
    /// @param guard guard expression, null or blank for none
    /// @return result whose `createdId` is the relation id
    public static EditResult addRelation(
            Graph graph, RelationKind kind, String source, String target, String guard) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (!graph.contains(source)) {
            return reject(graph, Rejection.UNKNOWN_ENTITY, source);
        }
        if (!graph.contains(target)) {
            return reject(graph, Rejection.UNKNOWN_ENTITY, target);
        }
        Relation relation = Relation.of(kind, source, target, guard);
        if (kind == RelationKind.SPAWN) {
            if (!graph.hasEvent(source)) {
                return reject(graph, Rejection.INVALID_SPAWN_SOURCE, source + " -> " + target);
            }
            if (!GraphValidator.isValidSpawn(graph, relation)) {
                return reject(graph, Rejection.INVALID_SPAWN_TARGET, source + " -> " + target);
            }
            if (!triggerReaches(graph, source, target)) {
                return reject(graph, Rejection.SPAWN_TRIGGER_OUT_OF_REACH, source + " -> " + target);
            }
            if (relation.hasGuard()) {
                return reject(graph, Rejection.GUARD_ON_SPAWN, relation.id());
            }
        }
        if (source.equals(target) && !kind.allowsSelfRelation()) {
            return reject(graph, Rejection.SELF_RELATION_NOT_ALLOWED, relation.id());
        }
        if (GraphValidator.relationExists(graph, source, target, kind)) {
            return reject(graph, Rejection.DUPLICATE_RELATION, relation.id());
        }

        List<Relation> relations = new ArrayList<>(graph.getRelations());
        if (kind == RelationKind.SPAWN) {
            relations.add(0, relation);
        } else {
            relations.add(relation);
        }
        logger.info("Added " + kind.jsonName() + " relation from " + source + " to " + target);
        return EditResult.created(graph.toBuilder().relations(relations).build(), relation.id());
    }

    /// Replaces the guard of a relation.
    public static EditResult updateGuard(Graph graph, String relationId, String guard) {
        Optional<Relation> relation = graph.findRelation(relationId);
        if (relation.isEmpty()) {
            return reject(graph, Rejection.UNKNOWN_ENTITY, relationId);
        }
        Relation updated = relation.get().withGuard(guard);
        if (updated.kind() == RelationKind.SPAWN && updated.hasGuard()) {
            return reject(graph, Rejection.GUARD_ON_SPAWN, relationId);
        }
        List<Relation> relations = new ArrayList<>();
        for (Relation r : graph.getRelations()) {
            relations.add(r.id().equals(relationId) ? updated : r);
        }
        logger.info("Updated guard of " + relationId);
        return EditResult.applied(graph.toBuilder().relations(relations).build());
    }

    public static EditResult removeRelation(Graph graph, String relationId) {
        if (graph.findRelation(relationId).isEmpty()) {
            return reject(graph, Rejection.UNKNOWN_ENTITY, relationId);
        }
        List<Relation> relations = new ArrayList<>(graph.getRelations());
        relations.removeIf(r -> r.id().equals(relationId));
        logger.info("Removed relation " + relationId);
        return EditResult.applied(graph.toBuilder().relations(relations).build());
    }

    /// Converts a nest into a subprocess or back.
    ///
    /// The numeral moves between the two pools: it is released to the old
    /// pool and claimed in the new one, falling back to the smallest free
    /// numeral when the new pool already uses it. Children and relation
    /// endpoints follow the new id.
    ///
    /// @return result whose `createdId` is the scope's new id
    public static EditResult convertScope(Graph graph, String id, ScopeKind newKind) {
        Optional<Scope> found = graph.findScope(id);
        if (found.isEmpty()) {
            return reject(graph, Rejection.UNKNOWN_ENTITY, id);
        }
        Scope scope = found.get();
        if (scope.isGlobal() || newKind == ScopeKind.GLOBAL || scope.kind() == newKind) {
            return reject(graph, Rejection.INVALID_SCOPE_KIND, id + " -> " + newKind);
        }
        if (newKind == ScopeKind.NEST && GraphValidator.isSpawnTarget(graph, id)) {
            return reject(graph, Rejection.SPAWN_TARGET_IN_USE, id);
        }

        IdPools pools = graph.getIdPools();
        IdAllocator from = pools.forScope(scope.kind());
        IdAllocator to = pools.forScope(newKind);
        Integer numeral = IdAllocator.suffixOf(from.prefix(), id);
        from.release(id);
        String newId = numeral != null && to.claim(numeral) ? to.prefix() + numeral : to.allocate();

        Graph.Builder builder = Graph.builder()
                .roles(graph.getRoles())
                .security(graph.getSecurity())
                .idPools(pools);
        for (Scope s : graph.getScopes()) {
            if (s.isGlobal()) {
                continue;
            }
            if (s.id().equals(id)) {
                builder.scope(s.convertedTo(newId, newKind));
            } else {
                builder.scope(id.equals(s.parent()) ? s.withParent(newId) : s);
            }
        }
        for (Event event : graph.getEvents()) {
            builder.event(id.equals(event.getParent()) ? event.withParent(newId) : event);
        }
        for (Relation relation : graph.getRelations()) {
            if (relation.touches(id)) {
                builder.relation(relation.withEndpoints(
                        rename(relation.source(), id, newId), rename(relation.target(), id, newId)));
            } else {
                builder.relation(relation);
            }
        }
        Graph converted = builder.build();
        if (labelClash(converted, leafIds(converted, newId))) {
            return reject(graph, Rejection.DUPLICATE_LABEL, id + " -> " + newKind);
        }
        logger.info("Converted " + id + " to " + newKind.jsonName() + " " + newId);
        return EditResult.created(converted, newId);
    }

    public static EditResult setRoles(Graph graph, List<Role> roles) {
        return EditResult.applied(graph.toBuilder().roles(roles).build());
    }

    public static EditResult setSecurity(Graph graph, String security) {
        return EditResult.applied(graph.toBuilder().security(security).build());
    }

    /// Nests have no textual form, so a label must be unique across the whole
    /// block its event prints into, not just within its own scope.
    private static boolean labelClash(Graph graph, Collection<String> eventIds) {
        ScopeIndex index = ScopeIndex.of(graph);
        for (String id : eventIds) {
            Event event = graph.findEvent(id).orElseThrow();
            String block = index.blockOf(event.getParent()).id();
            for (Event other : graph.getEvents()) {
                if (!other.getId().equals(id)
                        && other.getLabel().equals(event.getLabel())
                        && index.blockOf(other.getParent()).id().equals(block)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> leafIds(Graph graph, String id) {
        List<String> ids = new ArrayList<>();
        for (Event event : ScopeIndex.of(graph).leafEvents(id)) {
            ids.add(event.getId());
        }
        return ids;
    }

    private static boolean triggerReaches(Graph graph, String trigger, String subprocess) {
        ScopeIndex index = ScopeIndex.of(graph);
        String triggerBlock = index.blockOf(graph.parentOf(trigger)).id();
        String enclosingBlock = index.blockOf(graph.parentOf(subprocess)).id();
        return graph.isWithin(enclosingBlock, triggerBlock);
    }

    private static String rename(String endpoint, String oldId, String newId) {
        return endpoint.equals(oldId) ? newId : endpoint;
    }

    private static EditResult reject(Graph graph, Rejection rejection, String detail) {
        logger.info("Rejected edit (" + rejection.description() + "): " + detail);
        return EditResult.rejected(graph, rejection);
    }
}
