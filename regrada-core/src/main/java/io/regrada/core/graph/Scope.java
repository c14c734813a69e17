package io.regrada.core.graph;

import java.util.Objects;

/// Lexical scope: the global scope, a nest, or a subprocess.
///
/// The global scope has id [#GLOBAL_ID] and no parent. Every other scope
/// has a parent scope id. Nest mode is present for nests only.
///
/// @param id scope id, not null
/// @param kind scope kind, not null
/// @param label display label, defaults to the id
/// @param nestMode grouping mode for nests, null otherwise
/// @param marking declared marking, not null
/// @param parent parent scope id, null only for the global scope
public record Scope(
        String id, ScopeKind kind, String label, NestMode nestMode, Marking marking, String parent) {

    public static final String GLOBAL_ID = "global";

    public Scope {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        label = label == null || label.isBlank() ? id : label;
        marking = marking == null ? Marking.DEFAULT : marking;
        if (kind == ScopeKind.NEST) {
            nestMode = nestMode == null ? NestMode.GROUP : nestMode;
        } else {
            nestMode = null;
        }
        if (kind == ScopeKind.GLOBAL) {
            if (parent != null) {
                throw new IllegalStateException("Global scope cannot have a parent");
            }
        } else {
            Objects.requireNonNull(parent, "Scope '" + id + "' requires a parent");
        }
    }

    public static Scope global() {
        return new Scope(GLOBAL_ID, ScopeKind.GLOBAL, GLOBAL_ID, null, Marking.DEFAULT, null);
    }

    public static Scope nest(String id, String parent) {
        return new Scope(id, ScopeKind.NEST, id, NestMode.GROUP, Marking.DEFAULT, parent);
    }

    public static Scope subprocess(String id, String parent) {
        return new Scope(id, ScopeKind.SUBPROCESS, id, null, Marking.DEFAULT, parent);
    }

    public boolean isGlobal() {
        return kind == ScopeKind.GLOBAL;
    }

    public boolean isSubprocess() {
        return kind == ScopeKind.SUBPROCESS;
    }

    public Scope withParent(String newParent) {
        return new Scope(id, kind, label, nestMode, marking, newParent);
    }

    /// Returns a copy with a new id and kind. A label equal to the old id follows the id.
    public Scope convertedTo(String newId, ScopeKind newKind) {
        String newLabel = label.equals(id) ? newId : label;
        return new Scope(newId, newKind, newLabel, nestMode, marking, parent);
    }
}
