package com.tracepile.store.index;

import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Union of identity values (network, station, ... codes) held by an aggregate.
 *
 * <p>Small sets are kept as shared immutable sets after a full rebuild. The first
 * incremental addition turns the set back into a private mutable one. Both forms
 * answer {@link #contains} and iteration identically.</p>
 */
public final class IdentitySet<T> implements Iterable<T> {

    public static final int COMPACT_THRESHOLD = 32;

    static final CompactInterner INTERNER = new CompactInterner();

    private Set<T> values = Set.of();
    private boolean compact = true;

    public boolean add(T value) {
        expand();
        return values.add(value);
    }

    public void addAll(IdentitySet<? extends T> other) {
        if (other.values.isEmpty()) return;
        expand();
        values.addAll(other.values);
    }

    public boolean contains(Object value) {
        return values.contains(value);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void clear() {
        values = Set.of();
        compact = true;
    }

    /**
     * Switch to the shared immutable form if the set is below the threshold.
     */
    public void compact() {
        if (!compact && values.size() < COMPACT_THRESHOLD) {
            values = INTERNER.intern(values);
            compact = true;
        }
    }

    public boolean isCompact() {
        return compact;
    }

    /**
     * Read-only view of the current values.
     */
    public Set<T> asSet() {
        return Collections.unmodifiableSet(values);
    }

    @Override
    public Iterator<T> iterator() {
        return asSet().iterator();
    }

    private void expand() {
        if (compact) {
            values = new HashSet<>(values);
            compact = false;
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
