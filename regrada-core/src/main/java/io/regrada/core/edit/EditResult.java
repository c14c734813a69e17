package io.regrada.core.edit;

import io.regrada.core.graph.Graph;
import java.util.Objects;
import java.util.Optional;

/// Outcome of a graph edit.
///
/// On success `graph` is the edited graph and `createdId` names the element
/// the edit created, if any. On rejection `graph` is the unchanged input.
///
/// @param graph resulting graph, never null
/// @param rejection reason the edit was refused, null on success
/// @param createdId id of a newly created element, null when nothing was created
public record EditResult(Graph graph, Rejection rejection, String createdId) {

    public EditResult {
        Objects.requireNonNull(graph, "graph must not be null");
    }

    public static EditResult applied(Graph graph) {
        return new EditResult(graph, null, null);
    }

    public static EditResult created(Graph graph, String createdId) {
        return new EditResult(graph, null, createdId);
    }

    public static EditResult rejected(Graph unchanged, Rejection rejection) {
        return new EditResult(unchanged, Objects.requireNonNull(rejection, "rejection"), null);
    }

    public boolean isApplied() {
        return rejection == null;
    }

    public Optional<Rejection> getRejection() {
        return Optional.ofNullable(rejection);
    }
}
