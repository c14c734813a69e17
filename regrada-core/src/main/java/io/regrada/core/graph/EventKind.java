package io.regrada.core.graph;

/// Kind of a choreography event.
///
/// Input events carry a value type supplied by the initiator; computation
/// events carry an expression evaluated from other events' values.
public enum EventKind {
    INPUT("i"),
    COMPUTATION("c");

    private final String code;

    EventKind(String code) {
        this.code = code;
    }

    /// Returns the one-letter code used in project files.
    ///
    /// @return `i` or `c`, never null
    public String code() {
        return code;
    }

    /// Looks up an event kind by its project-file code.
    ///
    /// @param code one-letter code, not null
    /// @return matching kind, never null
    /// @throws IllegalArgumentException if the code is unknown
    public static EventKind fromCode(String code) {
        for (EventKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + code);
    }
}
