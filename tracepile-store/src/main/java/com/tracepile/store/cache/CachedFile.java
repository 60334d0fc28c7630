package com.tracepile.store.cache;

import java.util.List;

/**
 * Flat per-file metadata kept in the cache. Carries no link to the pile structure.
 */
public record CachedFile(
    String path,               // absolute path of the trace file
    String format,
    long mtime,                // modification time in millis at header load
    Double tmin,               // null for files without traces
    Double tmax,
    List<TraceHeader> traces
) {
    public CachedFile {
        traces = traces == null ? List.of() : List.copyOf(traces);
    }
}
