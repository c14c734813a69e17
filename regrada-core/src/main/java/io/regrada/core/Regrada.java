package io.regrada.core;

import io.regrada.core.dsl.DcrParser;
import io.regrada.core.dsl.DcrWriter;
import io.regrada.core.dsl.ParseResult;
import io.regrada.core.engine.DcrEngine;
import io.regrada.core.engine.FireResult;
import io.regrada.core.engine.SimulationState;
import io.regrada.core.graph.Graph;

/// Library entry point: text to graph, graph to text, and stepping a simulation.
///
/// ```java
/// ParseResult parsed = Regrada.parse(source);
/// SimulationState state = Regrada.start(parsed.graph());
/// FireResult next = Regrada.step(parsed.graph(), state, "e0");
/// String text = Regrada.serialize(parsed.graph());
/// ```
public final class Regrada {

    private Regrada() {}

    public static ParseResult parse(String source) {
        return DcrParser.parse(source);
    }

    public static String serialize(Graph graph) {
        return DcrWriter.write(graph);
    }

    public static SimulationState start(Graph graph) {
        return DcrEngine.start(graph);
    }

    /// Fires one event; see [DcrEngine#fire].
    public static FireResult step(Graph graph, SimulationState state, String eventId) {
        return DcrEngine.fire(graph, state, eventId);
    }
}
