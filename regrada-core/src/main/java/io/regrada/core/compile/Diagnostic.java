package io.regrada.core.compile;

import java.util.Objects;
import java.util.Optional;

/// One message of a compile error, with its source range when known.
///
/// @param message diagnostic text, not null
/// @param span source range, null when the service gives none
public record Diagnostic(String message, SourceSpan span) {

    public Diagnostic {
        Objects.requireNonNull(message, "message must not be null");
    }

    public Optional<SourceSpan> getSpan() {
        return Optional.ofNullable(span);
    }

    @Override
    public String toString() {
        return span == null ? message : span + " " + message;
    }
}
