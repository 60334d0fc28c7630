package com.tracepile.core.model;

import java.util.Comparator;

/**
 * Four-part identity of a trace.
 * Empty strings are valid components (an empty location code is common).
 */
public record TraceId(
    String network,
    String station,
    String location,
    String channel
) implements Comparable<TraceId> {

    private static final Comparator<TraceId> ORDER = Comparator
        .comparing(TraceId::network)
        .thenComparing(TraceId::station)
        .thenComparing(TraceId::location)
        .thenComparing(TraceId::channel);

    public TraceId {
        if (network == null) network = "";
        if (station == null) station = "";
        if (location == null) location = "";
        if (channel == null) channel = "";
    }

    /**
     * Dotted form, e.g. {@code GE.APE..BHZ}.
     */
    public String toKeyString() {
        return network + "." + station + "." + location + "." + channel;
    }

    @Override
    public int compareTo(TraceId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toKeyString();
    }
}
