package io.regrada.core.engine;

/// Reason an event could not fire.
public enum FireRejection {
    UNKNOWN_EVENT,
    EVENT_HIDDEN,
    NOT_EXECUTABLE
}
