package io.regrada.core.graph;

/// DCR relation kinds with their textual arrows.
///
/// | kind | arrow | effect when the source fires |
/// |---|---|---|
/// | CONDITION | `-->*` | target may fire once the source has executed |
/// | RESPONSE | `*-->` | target becomes pending |
/// | INCLUDE | `-->+` | target becomes included |
/// | EXCLUDE | `-->%` | target becomes excluded |
/// | MILESTONE | `--<>` | target is blocked while the source is pending |
/// | SPAWN | `-->>` | target subprocess is instantiated |
public enum RelationKind {
    CONDITION("-->*", "condition"),
    RESPONSE("*-->", "response"),
    INCLUDE("-->+", "include"),
    EXCLUDE("-->%", "exclude"),
    MILESTONE("--<>", "milestone"),
    SPAWN("-->>", "spawn");

    private final String arrow;
    private final String jsonName;

    RelationKind(String arrow, String jsonName) {
        this.arrow = arrow;
        this.jsonName = jsonName;
    }

    public String arrow() {
        return arrow;
    }

    public String jsonName() {
        return jsonName;
    }

    /// Returns the letter that prefixes relation ids of this kind.
    public char idLetter() {
        return jsonName.charAt(0);
    }

    /// Returns whether a relation of this kind may connect an element to itself.
    public boolean allowsSelfRelation() {
        return this == EXCLUDE || this == RESPONSE;
    }

    /// Looks up a kind by its arrow.
    ///
    /// @param arrow textual arrow, not null
    /// @return matching kind, never null
    /// @throws IllegalArgumentException if no kind uses the arrow
    public static RelationKind fromArrow(String arrow) {
        for (RelationKind kind : values()) {
            if (kind.arrow.equals(arrow)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown relation arrow: " + arrow);
    }

    /// Looks up a kind by its project-file name.
    ///
    /// @param name lower-case name such as `condition`, not null
    /// @return matching kind, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static RelationKind fromJsonName(String name) {
        for (RelationKind kind : values()) {
            if (kind.jsonName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown relation type: " + name);
    }
}
