package io.regrada.core.dsl;

import java.util.Objects;

/// Problem found on one source line.
///
/// @param line 1-based line number in the parsed text
/// @param reason human-readable description, not null
public record ParseError(int line, String reason) {

    public ParseError {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    @Override
    public String toString() {
        return "line " + line + ": " + reason;
    }
}
