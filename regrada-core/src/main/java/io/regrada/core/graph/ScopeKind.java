package io.regrada.core.graph;

/// Kind of a lexical scope.
///
/// Nests are static groupings with no textual form. Subprocesses are
/// instantiated by a spawn relation and own a textual block.
public enum ScopeKind {
    GLOBAL("global", null),
    NEST("nest", IdPools.NEST_PREFIX),
    SUBPROCESS("subprocess", IdPools.SUBPROCESS_PREFIX);

    private final String jsonName;
    private final String idPrefix;

    ScopeKind(String jsonName, String idPrefix) {
        this.jsonName = jsonName;
        this.idPrefix = idPrefix;
    }

    public String jsonName() {
        return jsonName;
    }

    /// Returns the id prefix, or null for the single global scope.
    public String idPrefix() {
        return idPrefix;
    }

    /// Returns whether scopes of this kind have their own textual block.
    public boolean hasBlock() {
        return this != NEST;
    }
}
