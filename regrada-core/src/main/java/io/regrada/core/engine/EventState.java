package io.regrada.core.engine;

/// Runtime marking of one event during simulation.
///
/// @param included event is currently included
/// @param pending event owes a response
/// @param executable event may fire now
/// @param executed event has fired at least once
/// @param visible every enclosing subprocess has been spawned
/// @param conditions incoming conditions whose source has not executed
/// @param milestones incoming milestones whose source is pending
public record EventState(
        boolean included,
        boolean pending,
        boolean executable,
        boolean executed,
        boolean visible,
        int conditions,
        int milestones) {

    EventState withIncluded(boolean value) {
        return new EventState(value, pending, executable, executed, visible, conditions, milestones);
    }

    EventState withPending(boolean value) {
        return new EventState(included, value, executable, executed, visible, conditions, milestones);
    }

    EventState fired() {
        return new EventState(included, false, executable, true, visible, conditions, milestones);
    }

    /// Recomputes the derived fields from fresh counts and visibility.
    EventState refreshed(boolean newVisible, int newConditions, int newMilestones) {
        boolean canFire = included && newConditions == 0 && newMilestones == 0;
        return new EventState(included, pending, canFire, executed, newVisible, newConditions, newMilestones);
    }
}
