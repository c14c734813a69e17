package io.regrada.core.projection;

import io.regrada.core.graph.Event;
import io.regrada.core.graph.EventKind;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.IdAllocator;
import io.regrada.core.graph.IdPools;
import io.regrada.core.graph.Marking;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RelationKind;
import io.regrada.core.graph.Role;
import io.regrada.core.graph.Scope;
import io.regrada.core.projection.model.EventCommon;
import io.regrada.core.projection.model.Expressions;
import io.regrada.core.projection.model.ProjectedRole;
import io.regrada.core.projection.model.Projection;
import io.regrada.core.projection.model.ProjectionEvent;
import io.regrada.core.projection.model.ProjectionGraph;
import io.regrada.core.projection.model.ProjectionRelation;
import io.regrada.core.role.ResolvedRoles;
import io.regrada.core.role.RoleBindingResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Turns compiled per-role projections into graphs.
///
/// Each compiled event becomes an [Event] whose id is the endpoint uid and
/// whose label is the choreography uid. Role expressions are resolved with
/// [RoleBindingResolver]:
///
/// | compiled event | initiators | receivers |
/// |---|---|---|
/// | input | projected role | resolved receivers |
/// | receive | resolved initiators | projected role |
/// | computation | projected role | resolved receivers |
///
/// A spawn relation becomes a fresh subprocess holding the spawned graph.
///
/// @implNote Stateless and thread-safe.
public final class ProjectionImporter {

    private static final Logger logger = Logger.getLogger(ProjectionImporter.class.getName());

    private ProjectionImporter() {}

    /// Imports every projection, keyed by role label in service order.
    public static Map<String, Graph> importAll(List<Projection> projections) {
        Map<String, Graph> graphs = new LinkedHashMap<>();
        for (Projection projection : projections) {
            graphs.put(projection.role().label(), importProjection(projection));
        }
        return graphs;
    }

    /// Imports one projection.
    ///
    /// @param projection compiled projection, not null
    /// @return graph for the projected role, never null
    public static Graph importProjection(Projection projection) {
        ProjectedRole role = projection.role();
        Graph.Builder builder = Graph.builder()
                .role(new Role(role.label(), role.label(), role.params(), List.of()));
        List<Relation> relations = new ArrayList<>();
        List<String> eventIds = new ArrayList<>();
        importGraph(role, projection.graph(), Scope.GLOBAL_ID, builder, relations, eventIds);

        Set<String> seen = new LinkedHashSet<>();
        List<Relation> kept = new ArrayList<>();
        for (Relation relation : relations) {
            boolean known = (builder.hasEvent(relation.source()) || builder.hasScope(relation.source()))
                    && (builder.hasEvent(relation.target()) || builder.hasScope(relation.target()));
            if (!known) {
                logger.warning("Dropping relation " + relation.id() + " with an unknown endpoint");
            } else if (seen.add(relation.id())) {
                kept.add(relation);
            }
        }
        builder.relations(kept);

        IdPools pools = builder.idPools();
        builder.idPools(new IdPools(
                IdAllocator.fromUsed(IdPools.EVENT_PREFIX, eventIds), pools.nests(), pools.subprocesses()));

        logger.info("Imported projection for role " + role.label() + " with " + eventIds.size() + " events");
        return builder.build();
    }

    private static void importGraph(
            ProjectedRole role,
            ProjectionGraph graph,
            String scopeId,
            Graph.Builder builder,
            List<Relation> relations,
            List<String> eventIds) {
        for (ProjectionEvent event : graph.events()) {
            Event imported = toEvent(role, event, scopeId);
            builder.event(imported);
            eventIds.add(imported.getId());
        }
        for (ProjectionRelation relation : graph.relations()) {
            if (relation instanceof ProjectionRelation.ControlFlow flow) {
                relations.add(Relation.of(flow.kind(), flow.sourceId(), flow.targetId()));
            } else {
                ProjectionRelation.Spawn spawn = (ProjectionRelation.Spawn) relation;
                String subprocessId = builder.idPools().subprocesses().allocate();
                builder.scope(Scope.subprocess(subprocessId, scopeId));
                relations.add(0, Relation.of(RelationKind.SPAWN, spawn.sourceId(), subprocessId));
                importGraph(role, spawn.graph(), subprocessId, builder, relations, eventIds);
            }
        }
    }

    private static Event toEvent(ProjectedRole role, ProjectionEvent event, String scopeId) {
        EventCommon common = event.common();
        Event.Builder builder = Event.builder()
                .id(common.endpointElementUid())
                .label(common.choreoElementUid())
                .name(common.label())
                .marking(new Marking(common.included(), common.pending()))
                .parent(scopeId);

        if (event instanceof ProjectionEvent.ReceiveEvent receive) {
            ResolvedRoles roles = RoleBindingResolver.resolve(
                    role, receive.initiators(), common.instantiationConstraint());
            return builder.kind(EventKind.INPUT)
                    .valueType(common.dataType().toValueType())
                    .initiators(roles.counterpartTexts())
                    .receivers(List.of(roles.selfText()))
                    .build();
        }
        if (event instanceof ProjectionEvent.ComputationEvent computation) {
            ResolvedRoles roles = RoleBindingResolver.resolve(
                    role, computation.receivers(), common.instantiationConstraint());
            return builder.kind(EventKind.COMPUTATION)
                    .expression(Expressions.format(computation.dataExpr()))
                    .initiators(List.of(roles.selfText()))
                    .receivers(roles.counterpartTexts())
                    .build();
        }
        ProjectionEvent.InputEvent input = (ProjectionEvent.InputEvent) event;
        ResolvedRoles roles = RoleBindingResolver.resolve(
                role, input.receivers(), common.instantiationConstraint());
        return builder.kind(EventKind.INPUT)
                .valueType(common.dataType().toValueType())
                .initiators(List.of(roles.selfText()))
                .receivers(roles.counterpartTexts())
                .build();
    }
}
