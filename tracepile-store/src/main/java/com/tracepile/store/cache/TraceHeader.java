package com.tracepile.store.cache;

import com.tracepile.core.model.SampledTrace;
import com.tracepile.core.model.Trace;
import com.tracepile.core.model.TraceId;

/**
 * Header facts of one trace as stored in the metadata cache.
 */
public record TraceHeader(
    String network,
    String station,
    String location,
    String channel,
    double tmin,
    double deltat,
    int size           // number of samples
) {
    public static TraceHeader of(Trace trace) {
        TraceId id = trace.id();
        return new TraceHeader(id.network(), id.station(), id.location(), id.channel(),
            trace.tmin(), trace.deltat(), trace.size());
    }

    /**
     * Recreate a header-only trace.
     */
    public Trace toTrace() {
        return SampledTrace.header(new TraceId(network, station, location, channel), tmin, deltat, size);
    }
}
