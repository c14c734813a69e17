package io.regrada.core.compile;

import io.regrada.core.projection.model.Projection;
import java.util.List;
import java.util.Objects;

/// Result of submitting source text to the compile service.
///
/// A pending outcome means the service produced nothing within the polling
/// window; the caller may retry. It never stands for an empty success.
public sealed interface CompileOutcome
        permits CompileOutcome.Completed, CompileOutcome.Failed, CompileOutcome.Pending {

    /// Per-role projections in service order.
    record Completed(List<Projection> projections) implements CompileOutcome {
        public Completed {
            projections = List.copyOf(projections);
        }
    }

    /// The source did not type-check.
    record Failed(CompileError error) implements CompileOutcome {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    /// No result after the given number of polls.
    record Pending(int attempts) implements CompileOutcome {}
}
