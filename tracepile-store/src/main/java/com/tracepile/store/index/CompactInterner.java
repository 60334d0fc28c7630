package com.tracepile.store.index;

import java.lang.ref.WeakReference;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

/**
 * Shares equal immutable sets between aggregates.
 *
 * Many files carry the same station or channel lists, so the compact sets built
 * after a full rebuild are deduplicated here. Entries disappear once no aggregate
 * refers to them any more.
 */
final class CompactInterner {

    private final Map<Set<?>, WeakReference<Set<?>>> pool = new WeakHashMap<>();

    /**
     * Get the shared immutable set equal to {@code values}.
     */
    @SuppressWarnings("unchecked")
    synchronized <T> Set<T> intern(Set<T> values) {
        Set<T> frozen = Set.copyOf(values);
        WeakReference<Set<?>> ref = pool.get(frozen);
        Set<?> shared = ref != null ? ref.get() : null;
        if (shared != null) {
            return (Set<T>) shared;
        }
        pool.put(frozen, new WeakReference<>(frozen));
        return frozen;
    }

    synchronized int size() {
        return pool.size();
    }
}
