package io.regrada.core.edit;

/// Named reason for refusing a graph edit.
public enum Rejection {
    UNKNOWN_SCOPE("Unknown parent scope"),
    INVALID_SCOPE_KIND("Scope kind not allowed here"),
    UNKNOWN_ENTITY("Unknown element"),
    DUPLICATE_LABEL("Label already used in this block"),
    SCOPE_CYCLE("Scope would become its own ancestor"),
    DUPLICATE_RELATION("Relation of this kind already exists between these elements"),
    INVALID_SPAWN_TARGET("Spawn relations must target a subprocess"),
    INVALID_SPAWN_SOURCE("Spawn relations must start at an event"),
    SPAWN_TRIGGER_OUT_OF_REACH("Spawn trigger must be declared in or around the block holding the subprocess"),
    SELF_RELATION_NOT_ALLOWED("Only exclude and response relations may target their source"),
    GUARD_ON_SPAWN("Spawn relations cannot carry a guard"),
    SPAWN_TARGET_IN_USE("Subprocess is still the target of a spawn relation");

    private final String description;

    Rejection(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
