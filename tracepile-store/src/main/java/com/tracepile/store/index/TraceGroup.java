package com.tracepile.store.index;

import com.tracepile.core.model.Trace;
import com.tracepile.core.model.TraceId;
import com.tracepile.core.util.Times;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Base class of everything containing traces: piles, time buckets and files.
 *
 * <p>A group maintains the union of the identity codes of its content and the
 * combined time span {@code [tmin, tmax]} of its content. Content is either child
 * groups or traces. The span is null until the first content is added.</p>
 *
 * <p>The parent link is non-owning. It is only used to push incremental updates
 * towards the root and must be cleared when a group is detached.</p>
 */
public abstract class TraceGroup {

    private TraceGroup parent;

    private final IdentitySet<String> networks = new IdentitySet<>();
    private final IdentitySet<String> stations = new IdentitySet<>();
    private final IdentitySet<String> locations = new IdentitySet<>();
    private final IdentitySet<String> channels = new IdentitySet<>();
    private final IdentitySet<TraceId> ids = new IdentitySet<>();

    private Double tmin;
    private Double tmax;
    private long updateCount;

    protected TraceGroup(TraceGroup parent) {
        this.parent = parent;
    }

    public TraceGroup getParent() {
        return parent;
    }

    public void setParent(TraceGroup parent) {
        this.parent = parent;
    }

    /**
     * Discard identities and span and recompute them from {@code content}.
     *
     * @param content child groups and/or traces
     */
    public void rebuildFrom(Collection<?> content) {
        update(content, true);
    }

    /**
     * Fold {@code content} into the current identities and span.
     *
     * @param content child groups and/or traces
     */
    public void growFrom(Collection<?> content) {
        update(content, false);
    }

    private void update(Collection<?> content, boolean empty) {
        if (empty) {
            networks.clear();
            stations.clear();
            locations.clear();
            channels.clear();
            ids.clear();
            tmin = null;
            tmax = null;
        }

        for (Object item : content) {
            double itemTmin;
            double itemTmax;
            if (item instanceof TraceGroup group) {
                if (!group.hasSpan()) continue;
                networks.addAll(group.networks);
                stations.addAll(group.stations);
                locations.addAll(group.locations);
                channels.addAll(group.channels);
                ids.addAll(group.ids);
                itemTmin = group.tmin;
                itemTmax = group.tmax;
            } else if (item instanceof Trace trace) {
                TraceId id = trace.id();
                networks.add(id.network());
                stations.add(id.station());
                locations.add(id.location());
                channels.add(id.channel());
                ids.add(id);
                itemTmin = trace.tmin();
                itemTmax = trace.tmax();
            } else {
                throw new IllegalArgumentException("Not a trace or trace group: " + item);
            }

            tmin = tmin == null ? itemTmin : Math.min(tmin, itemTmin);
            tmax = tmax == null ? itemTmax : Math.max(tmax, itemTmax);
        }

        if (empty) {
            networks.compact();
            stations.compact();
            locations.compact();
            channels.compact();
            ids.compact();
        }

        updateCount++;
    }

    /**
     * Grow this group by {@code content} (if given) and push the change up to the root.
     */
    public void recursiveGrowUpdate(Collection<?> content) {
        if (content != null) {
            growFrom(content);
        }
        if (parent != null) {
            parent.recursiveGrowUpdate(List.of(this));
        }
        notifyListeners(ChangeEvent.UPDATE);
    }

    /**
     * Rebuild this group from its own content and every ancestor from theirs.
     */
    public abstract void recursiveFullUpdate();

    /**
     * Hook for groups which have external listeners.
     */
    protected void notifyListeners(ChangeEvent event) {
    }

    public long getUpdateCount() {
        return updateCount;
    }

    public boolean hasSpan() {
        return tmin != null;
    }

    public Double getTmin() {
        return tmin;
    }

    public Double getTmax() {
        return tmax;
    }

    /**
     * Check if the span touches or overlaps {@code [tmin, tmax]}. Both ends are inclusive.
     */
    public boolean overlaps(double tmin, double tmax) {
        return hasSpan() && tmax >= this.tmin && this.tmax >= tmin;
    }

    /**
     * Check if this group overlaps the window and passes the optional group selector.
     */
    public boolean isRelevant(double tmin, double tmax, Predicate<? super TraceGroup> groupSelector) {
        return overlaps(tmin, tmax) && (groupSelector == null || groupSelector.test(this));
    }

    /**
     * Collect {@code gather(trace)} over all traces passing {@code selector}.
     */
    public abstract <K> Set<K> gatherKeys(Function<? super Trace, ? extends K> gather, Predicate<? super Trace> selector);

    public Set<String> getNetworks() {
        return networks.asSet();
    }

    public Set<String> getStations() {
        return stations.asSet();
    }

    public Set<String> getLocations() {
        return locations.asSet();
    }

    public Set<String> getChannels() {
        return channels.asSet();
    }

    public Set<TraceId> getIds() {
        return ids.asSet();
    }

    IdentitySet<String> stationSet() {
        return stations;
    }

    /**
     * Common part of the summaries printed by subclasses.
     */
    protected String describeContent() {
        return "timerange: " + Times.format(tmin) + " - " + Times.format(tmax) + "\n"
            + "networks: " + String.join(", ", new TreeSet<>(networks.asSet())) + "\n"
            + "stations: " + String.join(", ", new TreeSet<>(stations.asSet())) + "\n"
            + "locations: " + String.join(", ", new TreeSet<>(locations.asSet())) + "\n"
            + "channels: " + String.join(", ", new TreeSet<>(channels.asSet())) + "\n";
    }
}
