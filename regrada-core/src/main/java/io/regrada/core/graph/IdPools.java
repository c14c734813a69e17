package io.regrada.core.graph;

import java.util.Objects;

/// The three id pools of a graph: events, nests and subprocesses.
public final class IdPools {

    public static final String EVENT_PREFIX = "e";
    public static final String NEST_PREFIX = "n";
    public static final String SUBPROCESS_PREFIX = "s";

    private final IdAllocator events;
    private final IdAllocator nests;
    private final IdAllocator subprocesses;

    public IdPools(IdAllocator events, IdAllocator nests, IdAllocator subprocesses) {
        this.events = Objects.requireNonNull(events, "events pool required");
        this.nests = Objects.requireNonNull(nests, "nests pool required");
        this.subprocesses = Objects.requireNonNull(subprocesses, "subprocesses pool required");
    }

    public static IdPools initial() {
        return new IdPools(
                IdAllocator.initial(EVENT_PREFIX),
                IdAllocator.initial(NEST_PREFIX),
                IdAllocator.initial(SUBPROCESS_PREFIX));
    }

    public IdAllocator events() {
        return events;
    }

    public IdAllocator nests() {
        return nests;
    }

    public IdAllocator subprocesses() {
        return subprocesses;
    }

    /// Returns the pool for a scope kind.
    ///
    /// @throws IllegalArgumentException for the global scope, which has no pool
    public IdAllocator forScope(ScopeKind kind) {
        return switch (kind) {
            case NEST -> nests;
            case SUBPROCESS -> subprocesses;
            case GLOBAL -> throw new IllegalArgumentException("Global scope has no id pool");
        };
    }

    /// Returns the element id to the pool owning its prefix.
    public void release(String id) {
        if (id == null || id.isEmpty()) {
            return;
        }
        switch (id.substring(0, 1)) {
            case EVENT_PREFIX -> events.release(id);
            case NEST_PREFIX -> nests.release(id);
            case SUBPROCESS_PREFIX -> subprocesses.release(id);
            default -> {
                // foreign ids, such as imported projection uids, have no pool
            }
        }
    }

    public IdPools copy() {
        return new IdPools(events.copy(), nests.copy(), subprocesses.copy());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IdPools other
                && events.equals(other.events)
                && nests.equals(other.nests)
                && subprocesses.equals(other.subprocesses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(events, nests, subprocesses);
    }

    @Override
    public String toString() {
        return "IdPools{" + events + ", " + nests + ", " + subprocesses + "}";
    }
}
