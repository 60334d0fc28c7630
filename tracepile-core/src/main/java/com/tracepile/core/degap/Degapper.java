package com.tracepile.core.degap;

import com.tracepile.core.model.Trace;

import java.util.List;

/**
 * Merges abutting, overlapping or slightly gapped traces of the same identity.
 */
public interface Degapper {

    /**
     * Merge traces into contiguous runs.
     *
     * @param ordered traces sorted by identity, then time
     * @return new list, sorted the same way; the input traces are not modified
     */
    List<Trace> degap(List<Trace> ordered);
}
