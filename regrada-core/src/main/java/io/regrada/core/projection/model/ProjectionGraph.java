package io.regrada.core.projection.model;

import java.util.List;

/// Compiled graph of one projection or one spawned subprocess.
public record ProjectionGraph(List<ProjectionEvent> events, List<ProjectionRelation> relations) {

    public ProjectionGraph {
        events = events == null ? List.of() : List.copyOf(events);
        relations = relations == null ? List.of() : List.copyOf(relations);
    }

    /// Counts the events of this graph and of every spawned graph inside it.
    public int totalEvents() {
        int total = events.size();
        for (ProjectionRelation relation : relations) {
            if (relation instanceof ProjectionRelation.Spawn spawn) {
                total += spawn.graph().totalEvents();
            }
        }
        return total;
    }
}
