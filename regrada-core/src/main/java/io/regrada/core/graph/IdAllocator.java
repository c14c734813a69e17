package io.regrada.core.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/// Smallest-available-id pool for one entity kind.
///
/// The pool is a sorted ascending list of free numeric suffixes whose last
/// element is the frontier: every suffix at or above it is free. Allocation
/// always hands out the smallest suffix, so ids freed by deletions are reused
/// first and generated labels stay short.
///
/// ### Example
/// ```
/// pool [0]          allocate -> e0, pool [1]
/// pool [1]          allocate -> e1, pool [2]
/// release e0        pool [0, 2]
/// allocate -> e0    pool [2]
/// ```
///
/// @implNote Not thread-safe. [Graph] hands out copies, so a pool is only
/// ever mutated by the operation that owns it.
public final class IdAllocator {

    private final String prefix;
    private final List<Integer> available;

    private IdAllocator(String prefix, List<Integer> available) {
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
        this.available = normalize(available);
    }

    /// Creates an empty pool whose first id is `<prefix>0`.
    public static IdAllocator initial(String prefix) {
        return new IdAllocator(prefix, List.of(0));
    }

    /// Restores a pool from its stored free list.
    ///
    /// @param prefix id prefix, not null
    /// @param available stored free suffixes; an empty list is treated as `[0]`
    /// @return restored pool, never null
    public static IdAllocator fromAvailable(String prefix, List<Integer> available) {
        return new IdAllocator(prefix, available == null || available.isEmpty() ? List.of(0) : available);
    }

    /// Rebuilds a pool from the ids currently in use.
    ///
    /// Every gap below the highest used suffix becomes free again. Ids that do
    /// not carry this pool's prefix are ignored.
    ///
    /// @param prefix id prefix, not null
    /// @param usedIds ids in use, not null
    /// @return rebuilt pool, never null
    public static IdAllocator fromUsed(String prefix, Collection<String> usedIds) {
        TreeSet<Integer> used = new TreeSet<>();
        for (String id : usedIds) {
            Integer suffix = suffixOf(prefix, id);
            if (suffix != null) {
                used.add(suffix);
            }
        }
        int frontier = used.isEmpty() ? 0 : used.last() + 1;
        List<Integer> free = new ArrayList<>();
        for (int i = 0; i < frontier; i++) {
            if (!used.contains(i)) {
                free.add(i);
            }
        }
        free.add(frontier);
        return new IdAllocator(prefix, free);
    }

    /// Parses the numeric suffix of an id carrying the given prefix.
    ///
    /// @return suffix, or null when the id does not match `<prefix><digits>`
    public static Integer suffixOf(String prefix, String id) {
        if (id == null || !id.startsWith(prefix) || id.length() == prefix.length()) {
            return null;
        }
        String digits = id.substring(prefix.length());
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return null;
            }
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String prefix() {
        return prefix;
    }

    /// Hands out the smallest free id.
    ///
    /// @return id of the form `<prefix><n>`, never null
    public String allocate() {
        int next = available.remove(0);
        if (available.isEmpty()) {
            available.add(next + 1);
        }
        return prefix + next;
    }

    /// Returns an id to the pool.
    ///
    /// Ids without this pool's prefix, ids already free, and suffixes at or
    /// above the frontier are ignored.
    ///
    /// @param id released id, may be null
    public void release(String id) {
        Integer suffix = suffixOf(prefix, id);
        if (suffix == null || suffix >= frontier() || available.contains(suffix)) {
            return;
        }
        available.add(suffix);
        available.sort(null);
    }

    /// Takes a specific suffix out of the pool.
    ///
    /// A suffix at or beyond the frontier is claimed by moving the frontier
    /// past it and leaving the skipped suffixes free.
    ///
    /// @param suffix requested suffix, not negative
    /// @return true if the suffix was free and is now taken
    public boolean claim(int suffix) {
        if (suffix < 0) {
            return false;
        }
        int frontier = frontier();
        if (suffix < frontier) {
            return available.remove(Integer.valueOf(suffix));
        }
        available.remove(available.size() - 1);
        for (int i = frontier; i < suffix; i++) {
            available.add(i);
        }
        available.add(suffix + 1);
        return true;
    }

    public boolean isFree(int suffix) {
        return suffix >= frontier() || available.contains(suffix);
    }

    /// Returns the smallest suffix from which every suffix is free.
    public int frontier() {
        return available.get(available.size() - 1);
    }

    /// Returns a snapshot of the free list, as stored in project files.
    public List<Integer> available() {
        return List.copyOf(available);
    }

    public IdAllocator copy() {
        return new IdAllocator(prefix, available);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IdAllocator other
                && prefix.equals(other.prefix)
                && available.equals(other.available);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, available);
    }

    @Override
    public String toString() {
        return prefix + available;
    }

    private static List<Integer> normalize(List<Integer> values) {
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(values));
        if (sorted.isEmpty()) {
            sorted.add(0);
        }
        return sorted;
    }
}
