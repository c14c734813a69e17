package io.regrada.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.regrada.core.dsl.DcrParser;
import io.regrada.core.dsl.ParseResult;
import io.regrada.core.graph.Graph;
import io.regrada.core.graph.Relation;
import io.regrada.core.graph.RelationKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DcrEngine")
class DcrEngineTest {

    private static Graph graph(String... body) {
        ParseResult result = DcrParser.parse("P\n;\nPublic\n;\n" + String.join("\n", body));
        assertThat(result.errors()).isEmpty();
        return result.graph();
    }

    private static SimulationState fire(Graph graph, SimulationState state, String eventId) {
        FireResult result = DcrEngine.fire(graph, state, eventId);
        assertThat(result.isFired()).as("fire %s", eventId).isTrue();
        return result.state();
    }

    @Nested
    @DisplayName("conditions and responses")
    class ConditionsAndResponses {

        private final Graph graph = graph(
                "(a:a) (Public) [?] [P]",
                "(b:b) (Public) [?] [P]",
                "(c:c) (Public) [?] [P]",
                ";",
                "a -->* b",
                "b *--> c");

        @Test
        @DisplayName("blocks an event until its condition has executed")
        void shouldBlockOnCondition() {
            // Given
            SimulationState state = DcrEngine.start(graph);

            // When
            FireResult blocked = DcrEngine.fire(graph, state, "e1");

            // Then
            assertThat(state.enabledEvents()).containsExactly("e0", "e2");
            assertThat(state.event("e1").conditions()).isEqualTo(1);
            assertThat(blocked.getRejection()).contains(FireRejection.NOT_EXECUTABLE);
            assertThat(blocked.state()).isSameAs(state);
        }

        @Test
        @DisplayName("makes the response target pending until it fires")
        void shouldTrackResponses() {
            SimulationState state = DcrEngine.start(graph);

            state = fire(graph, state, "e0");
            assertThat(state.isExecutable("e1")).isTrue();

            state = fire(graph, state, "e1");
            assertThat(state.pendingEvents()).containsExactly("e2");
            assertThat(state.event("e1").executed()).isTrue();

            state = fire(graph, state, "e2");
            assertThat(state.pendingEvents()).isEmpty();
        }

        @Test
        @DisplayName("rejects unknown events")
        void shouldRejectUnknownEvent() {
            SimulationState state = DcrEngine.start(graph);

            assertThat(DcrEngine.fire(graph, state, "e9").getRejection()).contains(FireRejection.UNKNOWN_EVENT);
        }
    }

    @Test
    @DisplayName("excludes and re-includes targets")
    void shouldExcludeAndInclude() {
        Graph graph = graph(
                "(a:a) (Public) [?] [P]",
                "(b:b) (Public) [?] [P]",
                ";",
                "a -->% a",
                "a -->% b",
                "b -->+ a");
        SimulationState state = DcrEngine.start(graph);

        state = fire(graph, state, "e0");

        assertThat(state.event("e0").included()).isFalse();
        assertThat(state.isExecutable("e1")).isFalse();
        assertThat(state.enabledEvents()).isEmpty();
    }

    @Test
    @DisplayName("gates milestone targets on the source being pending")
    void shouldGateOnMilestone() {
        Graph graph = graph(
                "!(a:a) (Public) [?] [P]",
                "(b:b) (Public) [?] [P]",
                ";",
                "a --<> b");
        SimulationState state = DcrEngine.start(graph);
        assertThat(state.event("e1").milestones()).isEqualTo(1);
        assertThat(state.isExecutable("e1")).isFalse();

        state = fire(graph, state, "e0");

        assertThat(state.isExecutable("e1")).isTrue();
    }

    @Test
    @DisplayName("blocks a milestone target while a response keeps its source pending")
    void shouldGateMilestoneThroughResponse() {
        // Given
        Graph graph = graph(
                "(a:a) (Public) [?] [P]",
                "(b:b) (Public) [?] [P]",
                "(c:c) (Public) [?] [P]",
                ";",
                "a *--> b",
                "b --<> c");
        SimulationState state = DcrEngine.start(graph);
        assertThat(state.isExecutable("e2")).isTrue();

        // When
        SimulationState afterA = fire(graph, state, "e0");
        SimulationState afterB = fire(graph, afterA, "e1");

        // Then
        assertThat(afterA.event("e1").pending()).isTrue();
        assertThat(afterA.event("e2").milestones()).isEqualTo(1);
        assertThat(afterA.isExecutable("e2")).isFalse();
        assertThat(DcrEngine.fire(graph, afterA, "e2").getRejection()).contains(FireRejection.NOT_EXECUTABLE);
        assertThat(afterB.event("e1").pending()).isFalse();
        assertThat(afterB.event("e2").milestones()).isZero();
        assertThat(afterB.isExecutable("e2")).isTrue();
    }

    @Test
    @DisplayName("keeps an excluded event blocked across later firings until it is included again")
    void shouldKeepExclusionUntilIncluded() {
        // Given
        Graph graph = graph(
                "(a:a) (Public) [?] [P]",
                "(b:b) (Public) [?] [P]",
                "(c:c) (Public) [?] [P]",
                "(d:d) (Public) [?] [P]",
                ";",
                "a -->% b",
                "c *--> b",
                "d -->+ b");
        SimulationState state = fire(graph, DcrEngine.start(graph), "e0");

        // When
        state = fire(graph, state, "e2");
        state = fire(graph, state, "e0");

        // Then
        assertThat(state.event("e1").included()).isFalse();
        assertThat(state.isExecutable("e1")).isFalse();
        assertThat(state.pendingEvents()).doesNotContain("e1");
        assertThat(DcrEngine.fire(graph, state, "e1").getRejection()).contains(FireRejection.NOT_EXECUTABLE);

        state = fire(graph, state, "e3");
        assertThat(state.event("e1").included()).isTrue();
        assertThat(state.isExecutable("e1")).isTrue();
        assertThat(state.pendingEvents()).containsExactly("e1");
    }

    @Test
    @DisplayName("reveals subprocess events once spawned")
    void shouldRevealSpawnedEvents() {
        Graph graph = graph(
                "(a:a) (Public) [?] [P]",
                ";",
                "a -->> {",
                "(d:d) (Public) [?] [P]",
                "}");
        SimulationState state = DcrEngine.start(graph);
        assertThat(state.isVisible("e1")).isFalse();
        assertThat(DcrEngine.fire(graph, state, "e1").getRejection()).contains(FireRejection.EVENT_HIDDEN);

        state = fire(graph, state, "e0");

        assertThat(state.isSpawned("s0")).isTrue();
        assertThat(state.enabledEvents()).containsExactly("e0", "e1");
    }

    @Test
    @DisplayName("applies relations with scope endpoints to every contained event")
    void shouldExpandScopeEndpoints() {
        Graph graph = graph(
                "(a:a) (Public) [?] [P]",
                "(b:b) (Public) [?] [P]",
                ";",
                "a -->> {",
                "(d:d) (Public) [?] [P]",
                "}");
        Graph withScopeRelation = graph.toBuilder()
                .relation(Relation.of(RelationKind.CONDITION, "e1", "s0"))
                .build();
        SimulationState state = DcrEngine.start(withScopeRelation);

        state = fire(withScopeRelation, state, "e0");

        assertThat(state.isExecutable("e2")).isFalse();
        state = fire(withScopeRelation, state, "e1");
        assertThat(state.isExecutable("e2")).isTrue();
    }
}
