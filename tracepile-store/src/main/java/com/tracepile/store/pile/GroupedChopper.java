package com.tracepile.store.pile;

import com.tracepile.core.model.Trace;
import com.tracepile.store.index.TraceGroup;

import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Windows of a pile, one key after the other.
 *
 * <p>The distinct keys are gathered once when the chopper is created; changing the pile
 * while iterating is not supported. For each key a {@link WindowChopper} runs with the
 * request's selectors narrowed to traces and groups carrying that key.</p>
 */
public class GroupedChopper<K extends Comparable<? super K>> implements Iterator<List<Trace>>, AutoCloseable {

    private final TracePile pile;
    private final Function<? super Trace, ? extends K> gather;
    private final ChopRequest request;
    private final Iterator<K> keys;
    private final Map<TraceGroup, Set<K>> groupKeys = new IdentityHashMap<>();

    private K currentKey;
    private WindowChopper current;

    GroupedChopper(TracePile pile, Function<? super Trace, ? extends K> gather, ChopRequest request) {
        this.pile = pile;
        this.gather = gather;
        this.request = request.copy();
        this.keys = pile.<K>gatherSortedKeys(gather, this.request.getTraceSelector()).iterator();
    }

    @Override
    public boolean hasNext() {
        while (current == null || !current.hasNext()) {
            if (!keys.hasNext()) {
                return false;
            }
            startKey(keys.next());
        }
        return true;
    }

    @Override
    public List<Trace> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    /**
     * Key of the window returned last.
     */
    public K getCurrentKey() {
        return currentKey;
    }

    @Override
    public void close() {
        if (current != null) {
            current.close();
        }
    }

    private void startKey(K key) {
        Predicate<? super Trace> outerTrace = request.getTraceSelector();
        Predicate<? super TraceGroup> outerGroup = request.getGroupSelector();

        Predicate<Trace> traceSelector = trace ->
            key.equals(gather.apply(trace)) && (outerTrace == null || outerTrace.test(trace));
        Predicate<TraceGroup> groupSelector = group ->
            keysOf(group).contains(key) && (outerGroup == null || outerGroup.test(group));

        currentKey = key;
        current = pile.chopper(request.copy().traceSelector(traceSelector).groupSelector(groupSelector));
    }

    private Set<K> keysOf(TraceGroup group) {
        return groupKeys.computeIfAbsent(group, g -> g.gatherKeys(gather, request.getTraceSelector()));
    }
}
