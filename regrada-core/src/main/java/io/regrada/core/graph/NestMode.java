package io.regrada.core.graph;

/// Grouping mode of a nest scope.
public enum NestMode {
    GROUP("group"),
    CHOICE("choice");

    private final String jsonName;

    NestMode(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public static NestMode fromJsonName(String name) {
        for (NestMode mode : values()) {
            if (mode.jsonName.equals(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown nest type: " + name);
    }
}
