package io.regrada.core.project;

import static org.assertj.core.api.Assertions.assertThat;

import io.regrada.core.dsl.DcrParser;
import io.regrada.core.graph.Graph;
import io.regrada.core.layout.LayeredLayout;
import io.regrada.core.layout.LayoutRequest;
import io.regrada.core.layout.Position;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProjectTest {

    private static final String SOURCE = String.join("\n",
            ";", ";",
            "(a:a) () [?] []",
            "(b:b) () [?] []",
            ";",
            "a -->* b");

    @Test
    @DisplayName("places only the nodes that have no position yet")
    void shouldKeepExistingPositions() {
        // Given
        Graph graph = DcrParser.parse(SOURCE).graph();
        Project project = new Project(graph, SOURCE, Map.of("e0", NodeGeometry.at(new Position(7, 9))));

        // When
        Project laidOut = project.laidOut(new LayeredLayout());

        // Then
        assertThat(laidOut.geometry().get("e0").position()).isEqualTo(new Position(7, 9));
        assertThat(laidOut.geometry().get("e1").position()).isEqualTo(new Position(150, 0));
        assertThat(laidOut.code()).isEqualTo(SOURCE);
    }

    @Test
    @DisplayName("passes explicit sizes to the layout engine")
    void shouldPassSizes() {
        Graph graph = DcrParser.parse(SOURCE).graph();
        Project project = new Project(graph, null, Map.of("e1", new NodeGeometry(null, 30.0, 20.0)));
        AtomicReference<LayoutRequest> seen = new AtomicReference<>();

        Project laidOut = project.laidOut(request -> {
            seen.set(request);
            return Map.of("e0", new Position(1, 1), "e1", new Position(2, 2));
        });

        assertThat(seen.get().nodes().get(1).width()).isEqualTo(30.0);
        assertThat(laidOut.geometry().get("e1")).isEqualTo(new NodeGeometry(new Position(2, 2), 30.0, 20.0));
        assertThat(laidOut.code()).isEmpty();
    }
}
