package io.regrada.core.edit;

import static org.assertj.core.api.Assertions.assertThat;

import io.regrada.core.graph.EventKind;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.RelationKind;
import io.regrada.core.graph.Scope;
import io.regrada.core.graph.ScopeKind;
import io.regrada.core.graph.ValueType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GraphEditor")
class GraphEditorTest {

    private Graph graph;

    @BeforeEach
    void setUp() {
        graph = Graph.empty();
    }

    private String addEvent(String parent) {
        EditResult result = GraphEditor.addEvent(graph, EventKind.INPUT, parent);
        assertThat(result.isApplied()).isTrue();
        graph = result.graph();
        return result.createdId();
    }

    private String addScope(ScopeKind kind, String parent) {
        EditResult result = GraphEditor.addScope(graph, kind, parent);
        assertThat(result.isApplied()).isTrue();
        graph = result.graph();
        return result.createdId();
    }

    @Nested
    @DisplayName("events")
    class Events {

        @Test
        @DisplayName("creates input events with default marking and unit type")
        void shouldCreateDefaultEvent() {
            String id = addEvent(Scope.GLOBAL_ID);

            var event = graph.findEvent(id).orElseThrow();
            assertThat(id).isEqualTo("e0");
            assertThat(event.getLabel()).isEqualTo("e0");
            assertThat(event.getMarking().included()).isTrue();
            assertThat(event.getMarking().pending()).isFalse();
            assertThat(event.getValueType()).isEqualTo(ValueType.unit());
        }

        @Test
        @DisplayName("reuses the id of the smallest deleted event")
        void shouldReuseDeletedId() {
            // Given
            for (int i = 0; i < 4; i++) {
                addEvent(Scope.GLOBAL_ID);
            }

            // When
            graph = GraphEditor.removeNodes(graph, List.of("e0")).graph();

            // Then
            assertThat(addEvent(Scope.GLOBAL_ID)).isEqualTo("e0");
            assertThat(addEvent(Scope.GLOBAL_ID)).isEqualTo("e4");
        }

        @Test
        @DisplayName("rejects an unknown parent scope")
        void shouldRejectUnknownScope() {
            EditResult result = GraphEditor.addEvent(graph, EventKind.INPUT, "s3");

            assertThat(result.getRejection()).contains(Rejection.UNKNOWN_SCOPE);
            assertThat(result.graph()).isSameAs(graph);
        }

        @Test
        @DisplayName("rejects a label already used in the same scope")
        void shouldRejectDuplicateLabel() {
            addEvent(Scope.GLOBAL_ID);
            String second = addEvent(Scope.GLOBAL_ID);
            var renamed = graph.findEvent(second).orElseThrow().toBuilder().label("e0").build();

            EditResult result = GraphEditor.updateEvent(graph, renamed);

            assertThat(result.getRejection()).contains(Rejection.DUPLICATE_LABEL);
        }

        @Test
        @DisplayName("rejects a label already used by an event of another nest in the same block")
        void shouldRejectDuplicateLabelAcrossNests() {
            // Given
            String first = addScope(ScopeKind.NEST, Scope.GLOBAL_ID);
            String second = addScope(ScopeKind.NEST, Scope.GLOBAL_ID);
            addEvent(first);
            String other = addEvent(second);
            var renamed = graph.findEvent(other).orElseThrow().toBuilder().label("e0").build();

            // When
            EditResult result = GraphEditor.updateEvent(graph, renamed);

            // Then
            assertThat(result.getRejection()).contains(Rejection.DUPLICATE_LABEL);
            assertThat(result.graph()).isSameAs(graph);
        }

        @Test
        @DisplayName("allows the same label in separate subprocess blocks")
        void shouldAllowSameLabelInSeparateBlocks() {
            addEvent(Scope.GLOBAL_ID);
            String sub = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            String inner = addEvent(sub);
            var renamed = graph.findEvent(inner).orElseThrow().toBuilder().label("e0").build();

            EditResult result = GraphEditor.updateEvent(graph, renamed);

            assertThat(result.isApplied()).isTrue();
            assertThat(result.graph().findEvent(inner).orElseThrow().getLabel()).isEqualTo("e0");
        }

        @Test
        @DisplayName("rejects moving a nest whose labels clash with the target block")
        void shouldRejectMovingNestIntoClashingBlock() {
            // Given
            addEvent(Scope.GLOBAL_ID);
            String sub = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            String nest = addScope(ScopeKind.NEST, sub);
            String inner = addEvent(nest);
            var renamed = graph.findEvent(inner).orElseThrow().toBuilder().label("e0").build();
            graph = GraphEditor.updateEvent(graph, renamed).graph();

            // When
            EditResult result = GraphEditor.moveNode(graph, nest, Scope.GLOBAL_ID);

            // Then
            assertThat(result.getRejection()).contains(Rejection.DUPLICATE_LABEL);
            assertThat(result.graph().findScope(nest).orElseThrow().parent()).isEqualTo(sub);
        }

        @Test
        @DisplayName("keeps the owning scope on update")
        void shouldKeepParentOnUpdate() {
            String id = addEvent(Scope.GLOBAL_ID);
            addScope(ScopeKind.NEST, Scope.GLOBAL_ID);
            var moved = graph.findEvent(id).orElseThrow().toBuilder().name("read").parent("n0").build();

            graph = GraphEditor.updateEvent(graph, moved).graph();

            assertThat(graph.findEvent(id).orElseThrow().getName()).isEqualTo("read");
            assertThat(graph.findEvent(id).orElseThrow().getParent()).isEqualTo(Scope.GLOBAL_ID);
        }
    }

    @Nested
    @DisplayName("scopes")
    class Scopes {

        @Test
        @DisplayName("refuses to create a second global scope")
        void shouldRejectGlobalScope() {
            EditResult result = GraphEditor.addScope(graph, ScopeKind.GLOBAL, Scope.GLOBAL_ID);

            assertThat(result.getRejection()).contains(Rejection.INVALID_SCOPE_KIND);
        }

        @Test
        @DisplayName("refuses to move a scope into its own descendant")
        void shouldRejectScopeCycle() {
            String outer = addScope(ScopeKind.NEST, Scope.GLOBAL_ID);
            String inner = addScope(ScopeKind.SUBPROCESS, outer);

            EditResult result = GraphEditor.moveNode(graph, outer, inner);

            assertThat(result.getRejection()).contains(Rejection.SCOPE_CYCLE);
        }

        @Test
        @DisplayName("removes descendants and touching relations with a scope")
        void shouldRemoveScopeContents() {
            // Given
            String sub = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            String outside = addEvent(Scope.GLOBAL_ID);
            String inside = addEvent(sub);
            graph = GraphEditor.addRelation(graph, RelationKind.CONDITION, outside, inside, null).graph();
            graph = GraphEditor.addRelation(graph, RelationKind.SPAWN, outside, sub, null).graph();

            // When
            graph = GraphEditor.removeNodes(graph, List.of(sub)).graph();

            // Then
            assertThat(graph.hasScope(sub)).isFalse();
            assertThat(graph.hasEvent(inside)).isFalse();
            assertThat(graph.getRelations()).isEmpty();
            assertThat(graph.getIdPools().subprocesses().available()).containsExactly(0, 1);
            assertThat(graph.getIdPools().events().available()).containsExactly(1, 2);
        }

        @Test
        @DisplayName("converts a nest to a subprocess keeping its numeral and rewriting references")
        void shouldConvertNestToSubprocess() {
            // Given
            addScope(ScopeKind.NEST, Scope.GLOBAL_ID);
            String nest = addScope(ScopeKind.NEST, Scope.GLOBAL_ID);
            String child = addEvent(nest);
            String outside = addEvent(Scope.GLOBAL_ID);
            graph = GraphEditor.addRelation(graph, RelationKind.RESPONSE, outside, nest, null).graph();

            // When
            EditResult result = GraphEditor.convertScope(graph, nest, ScopeKind.SUBPROCESS);

            // Then
            assertThat(result.createdId()).isEqualTo("s1");
            graph = result.graph();
            assertThat(graph.findScope("s1").orElseThrow().kind()).isEqualTo(ScopeKind.SUBPROCESS);
            assertThat(graph.hasScope("n1")).isFalse();
            assertThat(graph.findEvent(child).orElseThrow().getParent()).isEqualTo("s1");
            assertThat(graph.getRelations()).extracting(r -> r.id()).containsExactly("r-" + outside + "-s1");
            assertThat(graph.getIdPools().nests().available()).containsExactly(1, 2);
            assertThat(graph.getIdPools().subprocesses().available()).containsExactly(0, 2);
        }

        @Test
        @DisplayName("refuses to turn a spawned subprocess into a nest")
        void shouldRejectConvertingSpawnTarget() {
            String sub = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            String trigger = addEvent(Scope.GLOBAL_ID);
            graph = GraphEditor.addRelation(graph, RelationKind.SPAWN, trigger, sub, null).graph();

            EditResult result = GraphEditor.convertScope(graph, sub, ScopeKind.NEST);

            assertThat(result.getRejection()).contains(Rejection.SPAWN_TARGET_IN_USE);
        }
    }

    @Nested
    @DisplayName("relations")
    class Relations {

        @Test
        @DisplayName("rejects a second relation of the same kind between the same pair")
        void shouldRejectDuplicateRelation() {
            String a = addEvent(Scope.GLOBAL_ID);
            String b = addEvent(Scope.GLOBAL_ID);
            graph = GraphEditor.addRelation(graph, RelationKind.CONDITION, a, b, null).graph();

            EditResult duplicate = GraphEditor.addRelation(graph, RelationKind.CONDITION, a, b, "x > 1");
            EditResult otherKind = GraphEditor.addRelation(graph, RelationKind.RESPONSE, a, b, null);

            assertThat(duplicate.getRejection()).contains(Rejection.DUPLICATE_RELATION);
            assertThat(duplicate.graph().getRelations()).hasSize(1);
            assertThat(otherKind.isApplied()).isTrue();
        }

        @Test
        @DisplayName("rejects a spawn that does not target a subprocess")
        void shouldRejectInvalidSpawnTarget() {
            String a = addEvent(Scope.GLOBAL_ID);
            String nest = addScope(ScopeKind.NEST, Scope.GLOBAL_ID);

            EditResult result = GraphEditor.addRelation(graph, RelationKind.SPAWN, a, nest, null);

            assertThat(result.getRejection()).contains(Rejection.INVALID_SPAWN_TARGET);
        }

        @Test
        @DisplayName("rejects a spawn from a scope and a guarded spawn")
        void shouldRejectInvalidSpawnSourceAndGuard() {
            String a = addEvent(Scope.GLOBAL_ID);
            String sub = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            String other = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);

            assertThat(GraphEditor.addRelation(graph, RelationKind.SPAWN, other, sub, null).getRejection())
                    .contains(Rejection.INVALID_SPAWN_SOURCE);
            assertThat(GraphEditor.addRelation(graph, RelationKind.SPAWN, a, sub, "true").getRejection())
                    .contains(Rejection.GUARD_ON_SPAWN);
        }

        @Test
        @DisplayName("rejects a spawn whose trigger is not visible from the subprocess's block")
        void shouldRejectSpawnTriggerOutOfReach() {
            // Given
            String target = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            String sibling = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            String hidden = addEvent(sibling);
            String outer = addEvent(Scope.GLOBAL_ID);
            String nested = addScope(ScopeKind.SUBPROCESS, target);

            // When
            EditResult fromSibling = GraphEditor.addRelation(graph, RelationKind.SPAWN, hidden, target, null);
            EditResult fromOutside = GraphEditor.addRelation(graph, RelationKind.SPAWN, outer, nested, null);

            // Then
            assertThat(fromSibling.getRejection()).contains(Rejection.SPAWN_TRIGGER_OUT_OF_REACH);
            assertThat(fromOutside.isApplied()).isTrue();
        }

        @Test
        @DisplayName("allows self relations only for exclude and response")
        void shouldRestrictSelfRelations() {
            String a = addEvent(Scope.GLOBAL_ID);

            assertThat(GraphEditor.addRelation(graph, RelationKind.EXCLUDE, a, a, null).isApplied()).isTrue();
            assertThat(GraphEditor.addRelation(graph, RelationKind.RESPONSE, a, a, null).isApplied()).isTrue();
            assertThat(GraphEditor.addRelation(graph, RelationKind.CONDITION, a, a, null).getRejection())
                    .contains(Rejection.SELF_RELATION_NOT_ALLOWED);
        }

        @Test
        @DisplayName("places spawn relations before the others")
        void shouldPrependSpawns() {
            String a = addEvent(Scope.GLOBAL_ID);
            String b = addEvent(Scope.GLOBAL_ID);
            String sub = addScope(ScopeKind.SUBPROCESS, Scope.GLOBAL_ID);
            graph = GraphEditor.addRelation(graph, RelationKind.CONDITION, a, b, null).graph();
            graph = GraphEditor.addRelation(graph, RelationKind.SPAWN, b, sub, null).graph();

            assertThat(graph.getRelations()).extracting(r -> r.kind())
                    .containsExactly(RelationKind.SPAWN, RelationKind.CONDITION);
        }

        @Test
        @DisplayName("updates and removes guards and relations by id")
        void shouldUpdateAndRemove() {
            String a = addEvent(Scope.GLOBAL_ID);
            String b = addEvent(Scope.GLOBAL_ID);
            EditResult added = GraphEditor.addRelation(graph, RelationKind.INCLUDE, a, b, null);
            graph = added.graph();

            graph = GraphEditor.updateGuard(graph, added.createdId(), " e0.value > 2 ").graph();
            assertThat(graph.getRelations().get(0).guard()).isEqualTo("e0.value > 2");

            graph = GraphEditor.removeRelation(graph, added.createdId()).graph();
            assertThat(graph.getRelations()).isEmpty();
            assertThat(GraphEditor.removeRelation(graph, "i-e0-e1").getRejection())
                    .contains(Rejection.UNKNOWN_ENTITY);
        }
    }
}
