package io.regrada.core.graph;

/// Static marking of an event or scope as declared in the model.
///
/// @param included whether the element starts included
/// @param pending whether the element starts pending (a response is owed)
public record Marking(boolean included, boolean pending) {

    /// Marking given to freshly created events and scopes.
    public static final Marking DEFAULT = new Marking(true, false);

    public Marking withIncluded(boolean value) {
        return new Marking(value, pending);
    }

    public Marking withPending(boolean value) {
        return new Marking(included, value);
    }
}
