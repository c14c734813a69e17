package io.regrada.core.compile;

import java.util.List;

/// Structured compile error: the service's stack trace, outermost first.
public record CompileError(List<Diagnostic> diagnostics) {

    public CompileError {
        diagnostics = List.copyOf(diagnostics);
    }
}
